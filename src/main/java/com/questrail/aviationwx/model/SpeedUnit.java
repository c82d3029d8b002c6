package com.questrail.aviationwx.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Wind speed unit suffix of a wind group.
 */
public enum SpeedUnit
{
    KNOTS("KT", 1.0),
    METERS_PER_SECOND("MPS", 1.94384),
    KILOMETERS_PER_HOUR("KMH", 0.539957);

    private final String suffix;
    private final double knotsPerUnit;

    SpeedUnit(String suffix, double knotsPerUnit) {
        this.suffix = suffix;
        this.knotsPerUnit = knotsPerUnit;
    }

    public String suffix() {
        return suffix;
    }

    /**
     * Converts a speed in this unit to whole knots, rounding half up.
     */
    public int toKnots(int speed) {
        if (this == KNOTS) {
            return speed;
        }
        return (int) Math.round(speed * knotsPerUnit);
    }

    public static Optional<SpeedUnit> fromSuffix(String suffix) {
        return Arrays.stream(values())
                .filter(u -> u.suffix.equals(suffix))
                .findFirst();
    }
}
