package com.questrail.aviationwx.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Codes reported in place of cloud layers.
 */
public enum ClearSky
{
    NSC("No significant cloud"),
    SKC("Sky clear"),
    NCD("No cloud detected"),
    CLR("No cloud below 12,000 feet");

    private final String label;

    ClearSky(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Optional<ClearSky> fromCode(String code) {
        return Arrays.stream(values())
                .filter(c -> c.name().equals(code))
                .findFirst();
    }
}
