package io.skuldata.school.model;

public enum UserRole {
  ADMIN,
  TEACHER,
  STAFF
}
