package com.gentoro.godex.exception;

/** Configuration problem detected while loading or reading settings. */
public class ConfigException extends GodexException {
  public ConfigException(String message) {
    super(GodexErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(GodexErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
