package com.gentoro.godex.exception;

/**
 * Stable error codes for godex. Codes are suitable for logs and indexing reports; prefer the most
 * specific code that reflects where the failure originated.
 */
public enum GodexErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,

  // Domain specific
  METADATA_UNAVAILABLE,
  DOCUMENTATION_UNAVAILABLE,
}
