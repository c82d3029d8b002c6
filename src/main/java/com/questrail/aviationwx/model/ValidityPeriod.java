package com.questrail.aviationwx.model;

import java.util.Objects;

/**
 * A {@code from}/{@code to} range of a TAF or of one of its change groups.
 *
 * <h2>Ordering invariant</h2>
 * <p>The {@code to} instant must lie strictly after the {@code from} instant on
 * a day x 24-hour timeline. Day numbers are compared as plain digits, with one
 * exception: a {@code to} day numerically smaller than the {@code from} day
 * (e.g. {@code 3118/0106}) is taken to belong to the following month for the
 * purpose of this comparison only. The stored day numbers are never rewritten.</p>
 *
 * @param from start of the period (inclusive)
 * @param to   end of the period
 */
public record ValidityPeriod(DayTime from, DayTime to) implements ChangeWindow
{
    private static final int MONTH_WRAP_MINUTES = 31 * 24 * 60;

    public ValidityPeriod {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");

        int toMinute = to.minuteOfTimeline();
        if (to.day() < from.day()) {
            toMinute += MONTH_WRAP_MINUTES;
        }
        if (toMinute <= from.minuteOfTimeline()) {
            throw new IllegalArgumentException(
                    "Validity period end must be after its start (from=" + from + ", to=" + to + ")"
            );
        }
    }

    @Override
    public DayTime start() {
        return from;
    }

    /**
     * Returns {@code true} if the period starts and ends on different day numbers.
     */
    public boolean crossesDayBoundary() {
        return !from.sameDay(to);
    }
}
