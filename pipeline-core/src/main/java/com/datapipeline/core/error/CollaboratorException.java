package com.datapipeline.core.error;

import java.util.OptionalInt;

/** Thrown by external collaborators (image upload, seeding, state store) to describe what went wrong. */
public class CollaboratorException extends RuntimeException implements ErrorCodeAware {
  private final String errorCode;
  private final int statusCode;

  public CollaboratorException(String errorCode, String message) {
    this(errorCode, 0, message, null);
  }

  public CollaboratorException(String errorCode, int statusCode, String message) {
    this(errorCode, statusCode, message, null);
  }

  public CollaboratorException(String errorCode, int statusCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
    this.statusCode = statusCode;
  }

  @Override
  public String errorCode() {
    return errorCode;
  }

  @Override
  public OptionalInt statusCode() {
    return statusCode > 0 ? OptionalInt.of(statusCode) : OptionalInt.empty();
  }
}
