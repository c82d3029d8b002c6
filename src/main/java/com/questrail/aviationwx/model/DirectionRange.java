package com.questrail.aviationwx.model;

/**
 * Extremes of a variable wind direction ({@code dddVddd}), clockwise from {@code from} to {@code to}.
 */
public record DirectionRange(int from, int to)
{
    public DirectionRange {
        if (!isValidDegrees(from) || !isValidDegrees(to)) {
            throw new IllegalArgumentException(
                    "direction range must be within 0–360 (was " + from + "V" + to + ")"
            );
        }
    }

    static boolean isValidDegrees(int degrees) {
        return degrees >= 0 && degrees <= 360;
    }
}
