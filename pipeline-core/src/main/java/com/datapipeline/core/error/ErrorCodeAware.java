package com.datapipeline.core.error;

import java.util.OptionalInt;

/** Exceptions that carry a machine-readable code (e.g. {@code ECONNREFUSED}) and optionally an HTTP status. */
public interface ErrorCodeAware {
  String errorCode();

  default OptionalInt statusCode() {
    return OptionalInt.empty();
  }
}
