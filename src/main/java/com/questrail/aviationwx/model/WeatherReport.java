package com.questrail.aviationwx.model;

import java.util.List;

/**
 * Common view of a decoded aviation weather report.
 *
 * <p>
 * Every report has a resolved station identity, keeps its raw text verbatim so
 * that a caller can always fall back to showing it, and lists the non-fatal
 * defects met while decoding.
 * </p>
 */
public sealed interface WeatherReport permits MetarRecord, TafRecord
{
    StationId station();

    String rawText();

    List<FieldDefect> defects();

    default boolean hasDefects() {
        return !defects().isEmpty();
    }
}
