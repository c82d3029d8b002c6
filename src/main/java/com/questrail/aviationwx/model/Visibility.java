package com.questrail.aviationwx.model;

import java.util.Objects;

/**
 * Prevailing horizontal visibility.
 *
 * <p>
 * Either a measured {@link Distance} in metres or statute miles, possibly
 * open-ended ({@code 9999}, {@code 6+}, {@code P6SM}) or bounded from above
 * ({@code M1/4SM}), or {@link Cavok}.
 * </p>
 */
public sealed interface Visibility permits Visibility.Distance, Visibility.Cavok
{
    /**
     * How a measured value relates to the actual visibility.
     */
    enum Bound
    {
        /** The value is the reported visibility. */
        EXACT,
        /** The value or more, e.g. {@code 9999} (10 km or more) or {@code 6+}. */
        OR_MORE,
        /** Strictly more than the value, e.g. {@code P6SM}. */
        MORE_THAN,
        /** Less than the value, e.g. {@code M1/4SM}. */
        LESS_THAN
    }

    enum DistanceUnit
    {
        METERS,
        STATUTE_MILES
    }

    /**
     * A measured visibility.
     *
     * @param value  numeric value in {@code unit}; never negative
     * @param unit   unit of {@code value}
     * @param bound  relation of the value to the actual visibility
     * @param figure the figure as encoded without qualifiers or unit, e.g. {@code 1 1/2}
     */
    record Distance(double value, DistanceUnit unit, Bound bound, String figure) implements Visibility
    {
        public Distance {
            Objects.requireNonNull(unit, "unit");
            Objects.requireNonNull(bound, "bound");
            Objects.requireNonNull(figure, "figure");
            if (value < 0 || Double.isNaN(value)) {
                throw new IllegalArgumentException("visibility must be non-negative (was " + value + ")");
            }
        }
    }

    /**
     * Ceiling and visibility OK.
     */
    record Cavok() implements Visibility
    {
        public static final Cavok INSTANCE = new Cavok();
    }
}
