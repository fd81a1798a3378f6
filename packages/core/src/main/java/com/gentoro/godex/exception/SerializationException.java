package com.gentoro.godex.exception;

/** JSON/YAML serialization or deserialization error. */
public class SerializationException extends GodexException {
  public SerializationException(String message) {
    super(GodexErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(GodexErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
