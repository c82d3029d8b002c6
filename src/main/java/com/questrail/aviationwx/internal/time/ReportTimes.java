package com.questrail.aviationwx.internal.time;

import com.questrail.aviationwx.codec.MalformedTimeException;
import com.questrail.aviationwx.model.ChangeWindow;
import com.questrail.aviationwx.model.DayTime;
import com.questrail.aviationwx.model.ValidityPeriod;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ReportTimes
 * -----------------------------------------------------------------------------
 * Conversion between encoded day/hour/minute digit groups and {@link DayTime}
 * values, and their display forms.
 *
 * <p>All values are UTC. No month or year is ever inferred: day numbers are
 * compared and rendered as plain digits.</p>
 */
public final class ReportTimes
{
    private static final Pattern DAY_HOUR_MINUTE = Pattern.compile("(\\d{2})(\\d{2})(\\d{2})");
    private static final Pattern DAY_HOUR = Pattern.compile("(\\d{2})(\\d{2})");
    private static final Pattern VALIDITY = Pattern.compile("(\\d{4})/(\\d{4})");

    /** Label used when a change group carries no period of its own. */
    public static final String PERIOD_NOT_SPECIFIED = "period not specified";

    private ReportTimes() {}

    /**
     * Returns the English ordinal label of a day number, e.g. {@code 1st}, {@code 12th}, {@code 22nd}.
     *
     * @throws IllegalArgumentException if {@code day} is not positive
     */
    public static String ordinalLabel(int day) {
        if (day < 1) {
            throw new IllegalArgumentException("day must be positive (was " + day + ")");
        }
        int lastTwo = day % 100;
        if (lastTwo >= 11 && lastTwo <= 13) {
            return day + "th";
        }
        switch (day % 10) {
            case 1:
                return day + "st";
            case 2:
                return day + "nd";
            case 3:
                return day + "rd";
            default:
                return day + "th";
        }
    }

    /**
     * Parses a {@code DDHHMM} group of exactly six digits. Callers strip the
     * {@code Z} suffix of a {@code DDHHMMZ} token before calling.
     *
     * @throws MalformedTimeException if the group is not exactly six digits or a component is out of range
     */
    public static DayTime parseIssueTime(String token) {
        Objects.requireNonNull(token, "token");
        Matcher m = DAY_HOUR_MINUTE.matcher(token);
        if (!m.matches()) {
            throw new MalformedTimeException("Time group must be 6 digits DDHHMM (was '" + token + "')");
        }
        int day = Integer.parseInt(m.group(1));
        int hour = Integer.parseInt(m.group(2));
        int minute = Integer.parseInt(m.group(3));

        checkDay(day, token);
        if (hour > 23) {
            throw new MalformedTimeException("Hour out of range 00–23 in '" + token + "'");
        }
        if (minute > 59) {
            throw new MalformedTimeException("Minute out of range 00–59 in '" + token + "'");
        }
        return new DayTime(day, hour, minute);
    }

    /**
     * Parses a {@code DDHH} half of a period group. Hour {@code 24} is normalised
     * to hour {@code 00} of the following day number.
     *
     * @throws MalformedTimeException if the group is not four digits or a component is out of range
     */
    public static DayTime parseDayHour(String token) {
        Objects.requireNonNull(token, "token");
        Matcher m = DAY_HOUR.matcher(token);
        if (!m.matches()) {
            throw new MalformedTimeException("Day/hour group must be 4 digits DDHH (was '" + token + "')");
        }
        int day = Integer.parseInt(m.group(1));
        int hour = Integer.parseInt(m.group(2));

        checkDay(day, token);
        if (hour > 24) {
            throw new MalformedTimeException("Hour out of range 00–24 in '" + token + "'");
        }
        if (hour == 24) {
            return DayTime.of(day + 1, 0);
        }
        return DayTime.of(day, hour);
    }

    /**
     * Parses a {@code DDHH/DDHH} validity group.
     *
     * @throws MalformedTimeException if either half is malformed or the end is not after the start
     */
    public static ValidityPeriod parseValidityToken(String token) {
        Objects.requireNonNull(token, "token");
        Matcher m = VALIDITY.matcher(token);
        if (!m.matches()) {
            throw new MalformedTimeException("Validity group must be DDHH/DDHH (was '" + token + "')");
        }
        DayTime from = parseDayHour(m.group(1));
        DayTime to = parseDayHour(m.group(2));
        try {
            return new ValidityPeriod(from, to);
        } catch (IllegalArgumentException e) {
            throw new MalformedTimeException("Validity group '" + token + "' does not end after it starts", e);
        }
    }

    /**
     * Renders the time of day, e.g. {@code 16:50Z}.
     */
    public static String formatTime(DayTime time) {
        return String.format(Locale.ROOT, "%02d:%02dZ", time.hour(), time.minute());
    }

    /**
     * Renders the time of day with its ordinal day, e.g. {@code 18:00Z on 20th}.
     */
    public static String formatInstant(DayTime time) {
        return formatTime(time) + " on " + ordinalLabel(time.day());
    }

    /**
     * Renders a range. Both ends on the same day give {@code 18:00Z to 20:00Z};
     * different days give {@code 20:00Z on 20th to 02:00Z on 21st}.
     */
    public static String formatPeriod(DayTime from, DayTime to) {
        if (from.sameDay(to)) {
            return formatTime(from) + " to " + formatTime(to);
        }
        return formatInstant(from) + " to " + formatInstant(to);
    }

    public static String formatPeriod(ValidityPeriod period) {
        return formatPeriod(period.from(), period.to());
    }

    /**
     * Renders a change-group window: a period as {@link #formatPeriod(ValidityPeriod)},
     * a start instant as {@link #formatInstant(DayTime)}.
     */
    public static String formatWindow(ChangeWindow window) {
        if (window instanceof ValidityPeriod period) {
            return formatPeriod(period);
        }
        return formatInstant(window.start());
    }

    private static void checkDay(int day, String token) {
        if (day < 1 || day > 31) {
            throw new MalformedTimeException("Day out of range 01–31 in '" + token + "'");
        }
    }
}
