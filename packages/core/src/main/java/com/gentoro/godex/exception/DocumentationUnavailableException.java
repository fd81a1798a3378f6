package com.gentoro.godex.exception;

import java.util.Map;

/** The documentation text for a package could not be obtained from its source. */
public class DocumentationUnavailableException extends GodexException {
  public DocumentationUnavailableException(String message, Map<String, ?> context) {
    super(GodexErrorCode.DOCUMENTATION_UNAVAILABLE, message, context);
  }
}
