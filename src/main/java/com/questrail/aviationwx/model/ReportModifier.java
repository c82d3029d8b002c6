package com.questrail.aviationwx.model;

import java.util.Optional;

/**
 * Report status keywords that may follow the report type, station or time groups.
 */
public enum ReportModifier
{
    AMENDED("AMD", "AMENDED"),
    CORRECTED("COR", "CORRECTED"),
    AUTOMATED("AUTO", "AUTOMATED"),
    MISSING("NIL", "NIL (report missing or forecast suspended)"),
    CANCELLED("CNL", "CANCELLED"),
    AMENDMENTS_NOT_SCHEDULED("AMD NOT SKED", "AMD NOT SKED (updates not scheduled)");

    private final String keyword;
    private final String label;

    ReportModifier(String keyword, String label) {
        this.keyword = keyword;
        this.label = label;
    }

    public String keyword() {
        return keyword;
    }

    public String label() {
        return label;
    }

    /**
     * Looks up a single-token keyword. {@link #AMENDMENTS_NOT_SCHEDULED} spans three
     * tokens and is matched by the decoders instead.
     */
    public static Optional<ReportModifier> fromKeyword(String keyword) {
        for (ReportModifier modifier : values()) {
            if (modifier.keyword.equals(keyword)) {
                return Optional.of(modifier);
            }
        }
        return Optional.empty();
    }
}
