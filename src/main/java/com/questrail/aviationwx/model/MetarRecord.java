package com.questrail.aviationwx.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Decoded METAR / SPECI observation.
 *
 * <p>
 * Created fresh by each decode call and immutable afterwards. Only
 * {@link #station()} and {@link #observationTime()} are guaranteed; every other
 * field is optional and absent when its token was missing or malformed.
 * </p>
 *
 * <p>
 * {@link #receiptTime()} is never decoded from the raw text. It is an
 * out-of-band annotation attached by the retrieval layer through
 * {@link #withReceiptTime(Instant)}.
 * </p>
 */
public record MetarRecord(
        ReportType reportType,
        StationId station,
        DayTime observationTime,
        List<ReportModifier> modifiers,
        Optional<Instant> receiptTime,
        Optional<Wind> wind,
        Optional<Visibility> visibility,
        List<WeatherPhenomenon> weather,
        List<CloudLayer> cloudLayers,
        Optional<ClearSky> clearSky,
        Optional<TemperatureDewpoint> temperatureDewpoint,
        Optional<Altimeter> altimeter,
        Optional<String> trend,
        Optional<String> remarks,
        List<FieldDefect> defects,
        String rawText
) implements WeatherReport
{
    public MetarRecord {
        Objects.requireNonNull(reportType, "reportType");
        Objects.requireNonNull(station, "station");
        Objects.requireNonNull(observationTime, "observationTime");
        modifiers = List.copyOf(modifiers);
        Objects.requireNonNull(receiptTime, "receiptTime");
        Objects.requireNonNull(wind, "wind");
        Objects.requireNonNull(visibility, "visibility");
        weather = List.copyOf(weather);
        cloudLayers = List.copyOf(cloudLayers);
        Objects.requireNonNull(clearSky, "clearSky");
        Objects.requireNonNull(temperatureDewpoint, "temperatureDewpoint");
        Objects.requireNonNull(altimeter, "altimeter");
        Objects.requireNonNull(trend, "trend");
        Objects.requireNonNull(remarks, "remarks");
        defects = List.copyOf(defects);
        Objects.requireNonNull(rawText, "rawText");
    }

    /**
     * Returns a copy of this record annotated with the time the report was received.
     */
    public MetarRecord withReceiptTime(Instant receiptTime) {
        return new MetarRecord(reportType, station, observationTime, modifiers,
                Optional.of(receiptTime), wind, visibility, weather, cloudLayers, clearSky,
                temperatureDewpoint, altimeter, trend, remarks, defects, rawText);
    }

    public static Builder builder(StationId station, DayTime observationTime, String rawText) {
        return new Builder(station, observationTime, rawText);
    }

    public static final class Builder {
        private final StationId station;
        private final DayTime observationTime;
        private final String rawText;

        private ReportType reportType = ReportType.ROUTINE;
        private final List<ReportModifier> modifiers = new ArrayList<>();
        private Instant receiptTime;
        private ForecastConditions conditions = ForecastConditions.EMPTY;
        private TemperatureDewpoint temperatureDewpoint;
        private Altimeter altimeter;
        private String trend;
        private String remarks;
        private final List<FieldDefect> defects = new ArrayList<>();

        private Builder(StationId station, DayTime observationTime, String rawText) {
            this.station = Objects.requireNonNull(station, "station");
            this.observationTime = Objects.requireNonNull(observationTime, "observationTime");
            this.rawText = Objects.requireNonNull(rawText, "rawText");
        }

        public Builder withReportType(ReportType reportType) {
            this.reportType = Objects.requireNonNull(reportType, "reportType");
            return this;
        }

        public Builder addModifier(ReportModifier modifier) {
            if (!modifiers.contains(modifier)) {
                modifiers.add(modifier);
            }
            return this;
        }

        public Builder withReceiptTime(Instant receiptTime) {
            this.receiptTime = receiptTime;
            return this;
        }

        /**
         * Copies wind, visibility, weather and cloud fields from a decoded field group.
         */
        public Builder withConditions(ForecastConditions conditions) {
            this.conditions = Objects.requireNonNull(conditions, "conditions");
            return this;
        }

        public Builder withTemperatureDewpoint(TemperatureDewpoint temperatureDewpoint) {
            this.temperatureDewpoint = temperatureDewpoint;
            return this;
        }

        public Builder withAltimeter(Altimeter altimeter) {
            this.altimeter = altimeter;
            return this;
        }

        public Builder withTrend(String trend) {
            this.trend = trend;
            return this;
        }

        public Builder withRemarks(String remarks) {
            this.remarks = remarks;
            return this;
        }

        public Builder addDefects(List<FieldDefect> defects) {
            this.defects.addAll(defects);
            return this;
        }

        public MetarRecord build() {
            return new MetarRecord(
                    reportType,
                    station,
                    observationTime,
                    modifiers,
                    Optional.ofNullable(receiptTime),
                    conditions.wind(),
                    conditions.visibility(),
                    conditions.weather(),
                    conditions.cloudLayers(),
                    conditions.clearSky(),
                    Optional.ofNullable(temperatureDewpoint),
                    Optional.ofNullable(altimeter),
                    Optional.ofNullable(trend),
                    Optional.ofNullable(remarks),
                    defects,
                    rawText
            );
        }
    }
}
