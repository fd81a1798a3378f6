package com.gentoro.godex.exception;

/** Input validation failure or illegal argument. */
public class ValidationException extends GodexException {
  public ValidationException(String message) {
    super(GodexErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(GodexErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
