package com.questrail.aviationwx.observability;

import com.questrail.aviationwx.model.StationId;

import java.time.Instant;

/**
 * Record summarising a successful decode.
 */
public record ReportDecodedEvent(
    Instant timestamp,
    ReportKind kind,
    StationId station,
    int tokenCount,
    int defectCount
) {
    /**
     * Checks if the report decoded without any field defect.
     */
    public boolean isClean() {
        return defectCount == 0;
    }
}
