package com.gentoro.godex.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Unchecked base exception of godex. Every failure carries a {@link GodexErrorCode}; failures tied
 * to a package or file also carry a small context map (import path, file path) that ends up in
 * {@link ErrorDetails}.
 */
public class GodexException extends RuntimeException {
  private final GodexErrorCode code;
  private final Map<String, Object> context;

  public GodexException(GodexErrorCode code, String message) {
    this(code, message, Map.of());
  }

  public GodexException(GodexErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = Map.of();
  }

  public GodexException(GodexErrorCode code, String message, Map<String, ?> context) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
    this.context =
        context == null || context.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
  }

  public GodexErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return context;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(getClass().getSimpleName());
    sb.append("{code=").append(code).append(", message=").append(getMessage());
    if (!context.isEmpty()) {
      sb.append(", context=").append(context);
    }
    if (getCause() != null) {
      sb.append(", cause=").append(getCause().getClass().getSimpleName());
    }
    return sb.append('}').toString();
  }
}
