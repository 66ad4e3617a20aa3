package io.skuldata.school.model;

public enum StudentStatus {
  ACTIVE,
  SUSPENDED,
  GRADUATED,
  WITHDRAWN
}
