package com.gentoro.godex.exception;

import java.time.Instant;
import java.util.Map;

/**
 * Structured view of a failure, as recorded in an indexing report.
 *
 * @param type simple class name of the failure
 * @param code {@link GodexErrorCode#UNKNOWN} for failures outside the godex hierarchy
 * @param message never null
 * @param context merged caller and exception context
 * @param timestamp when the details were built
 */
public record ErrorDetails(
    String type,
    GodexErrorCode code,
    String message,
    Map<String, Object> context,
    Instant timestamp) {}
