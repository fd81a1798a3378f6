package com.gentoro.godex.exception;

/** I/O operation failed (filesystem, classpath streams). */
public class IoException extends GodexException {
  public IoException(String message) {
    super(GodexErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(GodexErrorCode.IO_ERROR, message, cause);
  }
}
