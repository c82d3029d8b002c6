package com.questrail.aviationwx.config;

import com.questrail.aviationwx.observability.ReportObservabilitySink;
import com.questrail.aviationwx.observability.Slf4jReportObservabilitySink;

import java.time.Clock;
import java.util.Objects;

/**
 * Aggregated configuration for the report decode/format entry point.
 *
 * @param observabilitySink receives decode, defect and error events
 * @param clock             source of event timestamps; never consulted for decoded values
 * @param lineSeparator     separator used when joining rendered lines into one block
 * @param includeRawText    append a {@code Raw:} line to every rendering, not only to defective records
 */
public record AviationWeatherConfig(
    ReportObservabilitySink observabilitySink,
    Clock clock,
    String lineSeparator,
    boolean includeRawText
) {
    public AviationWeatherConfig {
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(lineSeparator, "lineSeparator");
    }

    public static AviationWeatherConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ReportObservabilitySink observabilitySink = new Slf4jReportObservabilitySink();
        private Clock clock = Clock.systemUTC();
        private String lineSeparator = "\n";
        private boolean includeRawText = false;

        public Builder withObservabilitySink(ReportObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withLineSeparator(String lineSeparator) {
            this.lineSeparator = lineSeparator;
            return this;
        }

        public Builder withIncludeRawText(boolean includeRawText) {
            this.includeRawText = includeRawText;
            return this;
        }

        public AviationWeatherConfig build() {
            return new AviationWeatherConfig(observabilitySink, clock, lineSeparator, includeRawText);
        }
    }
}
