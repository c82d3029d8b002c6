package com.questrail.aviationwx.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Cloud amount code of a cloud layer group.
 */
public enum CloudCoverage
{
    FEW("FEW", "Few"),
    SCATTERED("SCT", "Scattered"),
    BROKEN("BKN", "Broken"),
    OVERCAST("OVC", "Overcast"),
    VERTICAL_VISIBILITY("VV", "Vertical visibility");

    private final String code;
    private final String label;

    CloudCoverage(String code, String label) {
        this.code = code;
        this.label = label;
    }

    public String code() {
        return code;
    }

    public String label() {
        return label;
    }

    public static Optional<CloudCoverage> fromCode(String code) {
        return Arrays.stream(values())
                .filter(c -> c.code.equals(code))
                .findFirst();
    }
}
