package com.questrail.aviationwx.model;

import java.util.Optional;

/**
 * Observation report type keyword.
 */
public enum ReportType
{
    ROUTINE("METAR", "routine"),
    SPECIAL("SPECI", "special");

    private final String keyword;
    private final String label;

    ReportType(String keyword, String label) {
        this.keyword = keyword;
        this.label = label;
    }

    public String keyword() {
        return keyword;
    }

    public String label() {
        return label;
    }

    public static Optional<ReportType> fromKeyword(String keyword) {
        for (ReportType type : values()) {
            if (type.keyword.equals(keyword)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
