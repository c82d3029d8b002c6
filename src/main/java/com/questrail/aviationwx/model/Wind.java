package com.questrail.aviationwx.model;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Surface wind as reported by a {@code dddff[Gfmfm]KT} group.
 *
 * <p>A variable direction ({@code VRB}) is represented by an empty
 * {@link #directionDegrees()}. Speeds are always held in knots; the encoded
 * unit is retained for diagnostics only.</p>
 *
 * <p>A gust that is not greater than the mean speed is accepted here and
 * reported as a field defect by the decoder.</p>
 *
 * @param directionDegrees true direction 0–360, empty when variable
 * @param speedKnots       mean speed in knots
 * @param gustKnots        gust speed in knots, if reported
 * @param variableBetween  extremes of a {@code dddVddd} direction variation, if reported
 * @param encodedUnit      unit the group was encoded in
 */
public record Wind(
        OptionalInt directionDegrees,
        int speedKnots,
        OptionalInt gustKnots,
        Optional<DirectionRange> variableBetween,
        SpeedUnit encodedUnit
) {
    public Wind {
        Objects.requireNonNull(directionDegrees, "directionDegrees");
        Objects.requireNonNull(gustKnots, "gustKnots");
        Objects.requireNonNull(variableBetween, "variableBetween");
        Objects.requireNonNull(encodedUnit, "encodedUnit");

        if (directionDegrees.isPresent() && !DirectionRange.isValidDegrees(directionDegrees.getAsInt())) {
            throw new IllegalArgumentException("wind direction must be in range 0–360 (was "
                    + directionDegrees.getAsInt() + ")");
        }
        if (speedKnots < 0) {
            throw new IllegalArgumentException("wind speed must be non-negative");
        }
        if (gustKnots.isPresent() && gustKnots.getAsInt() < 0) {
            throw new IllegalArgumentException("gust speed must be non-negative");
        }
    }

    /**
     * Creates a wind from a fixed direction in knots with no gust or variation.
     */
    public static Wind of(int directionDegrees, int speedKnots) {
        return new Wind(OptionalInt.of(directionDegrees), speedKnots, OptionalInt.empty(),
                Optional.empty(), SpeedUnit.KNOTS);
    }

    public boolean isVariable() {
        return directionDegrees.isEmpty();
    }

    public boolean isCalm() {
        return speedKnots == 0 && gustKnots.isEmpty()
                && (directionDegrees.isEmpty() || directionDegrees.getAsInt() == 0);
    }

    /**
     * Returns {@code true} when a gust is present and is not greater than the mean speed.
     */
    public boolean hasGustAnomaly() {
        return gustKnots.isPresent() && gustKnots.getAsInt() <= speedKnots;
    }

    /**
     * Returns a copy of this wind carrying the given direction variation.
     */
    public Wind withVariableBetween(DirectionRange range) {
        return new Wind(directionDegrees, speedKnots, gustKnots, Optional.of(range), encodedUnit);
    }
}
