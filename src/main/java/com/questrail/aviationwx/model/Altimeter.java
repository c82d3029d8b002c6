package com.questrail.aviationwx.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Altimeter setting.
 *
 * <ul>
 *   <li>{@code Qnnnn}: hectopascals, {@code value} is the pressure itself</li>
 *   <li>{@code Annnn}: inches of mercury x 100, {@code value} is the encoded figure</li>
 * </ul>
 *
 * @param value encoded numeric value
 * @param unit  unit selected by the encoding prefix
 */
public record Altimeter(int value, PressureUnit unit)
{
    public Altimeter {
        Objects.requireNonNull(unit, "unit");
        if (value < 0) {
            throw new IllegalArgumentException("altimeter value must be non-negative");
        }
    }

    public static Altimeter hectopascals(int value) {
        return new Altimeter(value, PressureUnit.HECTOPASCALS);
    }

    public static Altimeter inchesOfMercuryHundredths(int value) {
        return new Altimeter(value, PressureUnit.INCHES_OF_MERCURY);
    }

    /**
     * Returns the setting in the unit's natural scale, e.g. {@code 1014} or {@code 29.92}.
     */
    public BigDecimal scaledValue() {
        return unit == PressureUnit.INCHES_OF_MERCURY
                ? BigDecimal.valueOf(value, 2)
                : BigDecimal.valueOf(value);
    }

    public enum PressureUnit
    {
        HECTOPASCALS('Q', "hPa"),
        INCHES_OF_MERCURY('A', "inHg");

        private final char prefix;
        private final String symbol;

        PressureUnit(char prefix, String symbol) {
            this.prefix = prefix;
            this.symbol = symbol;
        }

        public char prefix() {
            return prefix;
        }

        public String symbol() {
            return symbol;
        }
    }
}
