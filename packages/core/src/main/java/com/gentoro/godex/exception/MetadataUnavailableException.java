package com.gentoro.godex.exception;

import java.util.Map;

/**
 * Package name or import path could not be supplied for a package. Parsing of the package's
 * documentation text is unaffected; only building the package record fails.
 */
public class MetadataUnavailableException extends GodexException {
  public MetadataUnavailableException(String message) {
    super(GodexErrorCode.METADATA_UNAVAILABLE, message);
  }

  public MetadataUnavailableException(String message, Map<String, ?> context) {
    super(GodexErrorCode.METADATA_UNAVAILABLE, message, context);
  }

  public MetadataUnavailableException(String message, Throwable cause) {
    super(GodexErrorCode.METADATA_UNAVAILABLE, message, cause);
  }
}
