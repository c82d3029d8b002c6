package com.questrail.aviationwx.observability;

import java.time.Instant;

/**
 * Record representing a report that could not be decoded.
 */
public record ReportErrorEvent(
    Instant timestamp,
    ReportKind kind,
    String rawText,
    String message,
    Throwable cause
) {
}
