package com.questrail.aviationwx.observability;

import com.questrail.aviationwx.model.FieldDefect;

import java.time.Instant;

/**
 * Record representing a non-fatal field defect met while decoding.
 */
public record FieldDefectEvent(
    Instant timestamp,
    ReportKind kind,
    FieldDefect defect
) {
}
