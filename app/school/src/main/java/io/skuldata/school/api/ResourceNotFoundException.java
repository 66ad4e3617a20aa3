package io.skuldata.school.api;

public class ResourceNotFoundException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public ResourceNotFoundException(String message) {
    super(message);
  }

  public static ResourceNotFoundException of(String typeTag, Object id) {
    return new ResourceNotFoundException(typeTag + " not found: " + id);
  }
}
