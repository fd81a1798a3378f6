package com.gentoro.godex.exception;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Utility helpers for turning failures into structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails}. If the throwable is a {@link
   * GodexException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    return toErrorDetails(t, Map.of());
  }

  /**
   * Same as {@link #toErrorDetails(Throwable)} but merges {@code extraContext} into the details.
   * Keys already present in the exception's own context win.
   */
  public static ErrorDetails toErrorDetails(Throwable t, Map<String, ?> extraContext) {
    Map<String, Object> context = new LinkedHashMap<>();
    if (extraContext != null) {
      context.putAll(extraContext);
    }
    if (t instanceof GodexException ex) {
      context.putAll(ex.getContext());
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          ex.getCode(),
          safeMessage(ex.getMessage()),
          Collections.unmodifiableMap(context),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        GodexErrorCode.UNKNOWN,
        safeMessage(t.getMessage()),
        Collections.unmodifiableMap(context),
        Instant.now());
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }
}
