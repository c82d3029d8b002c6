package com.questrail.aviationwx.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One present- or forecast-weather group, e.g. {@code -RA}, {@code +TSRA}, {@code VCSH}, {@code NSW}.
 *
 * @param intensity  intensity or proximity qualifier
 * @param descriptor two-letter descriptor ({@code SH}, {@code TS}, {@code FZ}, ...), if any
 * @param phenomena  two-letter phenomenon codes in encoded order; may be empty for
 *                   descriptor-only groups such as {@code VCSH}
 * @param encoded    the group exactly as encoded
 */
public record WeatherPhenomenon(
        Intensity intensity,
        Optional<String> descriptor,
        List<String> phenomena,
        String encoded
) {
    /** Encoded form of "no significant weather". */
    public static final String NO_SIGNIFICANT_WEATHER = "NSW";

    public WeatherPhenomenon {
        Objects.requireNonNull(intensity, "intensity");
        Objects.requireNonNull(descriptor, "descriptor");
        phenomena = List.copyOf(phenomena);
        Objects.requireNonNull(encoded, "encoded");
        if (descriptor.isEmpty() && phenomena.isEmpty()) {
            throw new IllegalArgumentException("weather group carries neither descriptor nor phenomenon: " + encoded);
        }
    }

    public static WeatherPhenomenon noSignificantWeather() {
        return new WeatherPhenomenon(Intensity.MODERATE, Optional.empty(),
                List.of(NO_SIGNIFICANT_WEATHER), NO_SIGNIFICANT_WEATHER);
    }

    public boolean isNoSignificantWeather() {
        return NO_SIGNIFICANT_WEATHER.equals(encoded);
    }

    public enum Intensity
    {
        LIGHT("-"),
        MODERATE(""),
        HEAVY("+"),
        VICINITY("VC");

        private final String prefix;

        Intensity(String prefix) {
            this.prefix = prefix;
        }

        public String prefix() {
            return prefix;
        }

        public static Intensity fromPrefix(String prefix) {
            if (prefix == null || prefix.isEmpty()) {
                return MODERATE;
            }
            for (Intensity i : values()) {
                if (i.prefix.equals(prefix)) {
                    return i;
                }
            }
            throw new IllegalArgumentException("Unknown weather intensity prefix: " + prefix);
        }
    }
}
