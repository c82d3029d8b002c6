package com.questrail.aviationwx.model;

import java.util.Objects;

/**
 * Forecast maximum or minimum temperature of a TAF ({@code TX12/2015Z}, {@code TNM02/2106Z}).
 */
public record TemperatureExtreme(Kind kind, int celsius, DayTime at)
{
    public TemperatureExtreme {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(at, "at");
    }

    public enum Kind
    {
        MAXIMUM("TX", "Maximum"),
        MINIMUM("TN", "Minimum");

        private final String prefix;
        private final String label;

        Kind(String prefix, String label) {
            this.prefix = prefix;
            this.label = label;
        }

        public String prefix() {
            return prefix;
        }

        public String label() {
            return label;
        }
    }
}
