package com.questrail.aviationwx.model;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * One cloud layer, e.g. {@code BKN019} or {@code SCT030CB}.
 *
 * @param coverage   cloud amount
 * @param heightFeet base height in feet above aerodrome level, a multiple of 100;
 *                   empty when encoded as {@code ///}
 * @param convective {@code CB}/{@code TCU} suffix, if any
 */
public record CloudLayer(CloudCoverage coverage, OptionalInt heightFeet, Optional<ConvectiveCloud> convective)
{
    public CloudLayer {
        Objects.requireNonNull(coverage, "coverage");
        Objects.requireNonNull(heightFeet, "heightFeet");
        Objects.requireNonNull(convective, "convective");
        if (heightFeet.isPresent()) {
            int feet = heightFeet.getAsInt();
            if (feet < 0 || feet % 100 != 0) {
                throw new IllegalArgumentException("cloud height must be a non-negative multiple of 100 feet (was "
                        + feet + ")");
            }
        }
    }

    public static CloudLayer of(CloudCoverage coverage, int heightFeet) {
        return new CloudLayer(coverage, OptionalInt.of(heightFeet), Optional.empty());
    }

    /**
     * Convective cloud type suffix.
     */
    public enum ConvectiveCloud
    {
        CB("Cumulonimbus"),
        TCU("Towering cumulus");

        private final String label;

        ConvectiveCloud(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }
}
