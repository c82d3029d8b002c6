package com.questrail.aviationwx.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Strongly typed ICAO aerodrome identifier.
 *
 * <h2>Why this type exists</h2>
 * <p>
 * The station identifier is the identity of every METAR and TAF. Carrying it
 * as a bare {@code String} in the decode and format layers would allow a
 * keyword such as {@code TAF} or {@code AUTO}, or an empty placeholder, to be
 * mistaken for a station. This wrapper makes an invalid station unrepresentable.
 * </p>
 *
 * <h2>Constraints</h2>
 * <ul>
 *   <li>Exactly four characters</li>
 *   <li>Uppercase ASCII letters only ({@code A}–{@code Z})</li>
 * </ul>
 */
public final class StationId
{
    private static final Pattern SHAPE = Pattern.compile("[A-Z]{4}");

    private final String value;

    private StationId(String value) {
        this.value = value;
    }

    /**
     * Creates a {@code StationId} for the given four-letter code.
     *
     * @param value the station code, e.g. {@code EGLL}
     * @return a {@code StationId} instance
     * @throws IllegalArgumentException if the value is not four uppercase letters
     */
    public static StationId of(String value) {
        Objects.requireNonNull(value, "value");
        if (!isValid(value)) {
            throw new IllegalArgumentException(
                    "Station identifier must be exactly 4 uppercase letters (was '" + value + "')"
            );
        }
        return new StationId(value);
    }

    /**
     * Returns {@code true} if the given text has the shape of a station identifier.
     */
    public static boolean isValid(String value) {
        return value != null && SHAPE.matcher(value).matches();
    }

    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StationId that)) return false;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
