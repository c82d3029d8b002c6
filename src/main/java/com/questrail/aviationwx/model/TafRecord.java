package com.questrail.aviationwx.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Decoded TAF terminal aerodrome forecast.
 *
 * <p>
 * {@link #changeGroups()} preserves encoding order. Later groups refine
 * earlier ones for their own sub-window, so consumers must not reorder them.
 * An empty list is valid: a TAF may consist of a base forecast only.
 * </p>
 *
 * <p>
 * {@link #validity()} is empty only for a NIL forecast ({@link ReportModifier#MISSING}),
 * which carries no validity group and no forecast fields.
 * </p>
 */
public record TafRecord(
        StationId station,
        DayTime issueTime,
        Optional<ValidityPeriod> validity,
        List<ReportModifier> modifiers,
        ForecastConditions baseForecast,
        List<ForecastChangeGroup> changeGroups,
        List<TemperatureExtreme> temperatureExtremes,
        List<Altimeter> pressureForecasts,
        Optional<String> remarks,
        List<FieldDefect> defects,
        String rawText
) implements WeatherReport
{
    public TafRecord {
        Objects.requireNonNull(station, "station");
        Objects.requireNonNull(issueTime, "issueTime");
        Objects.requireNonNull(validity, "validity");
        modifiers = List.copyOf(modifiers);
        if (validity.isEmpty() && !modifiers.contains(ReportModifier.MISSING)) {
            throw new IllegalArgumentException("only a NIL forecast may omit its validity period");
        }
        Objects.requireNonNull(baseForecast, "baseForecast");
        changeGroups = List.copyOf(changeGroups);
        temperatureExtremes = List.copyOf(temperatureExtremes);
        pressureForecasts = List.copyOf(pressureForecasts);
        Objects.requireNonNull(remarks, "remarks");
        defects = List.copyOf(defects);
        Objects.requireNonNull(rawText, "rawText");
    }

    public boolean isNil() {
        return modifiers.contains(ReportModifier.MISSING);
    }

    public static Builder builder(StationId station, DayTime issueTime, ValidityPeriod validity, String rawText) {
        return new Builder(station, issueTime, Objects.requireNonNull(validity, "validity"), rawText);
    }

    /**
     * Starts a NIL forecast: no validity period, modifier {@link ReportModifier#MISSING} already set.
     */
    public static Builder nilBuilder(StationId station, DayTime issueTime, String rawText) {
        return new Builder(station, issueTime, null, rawText).addModifier(ReportModifier.MISSING);
    }

    public static final class Builder {
        private final StationId station;
        private final DayTime issueTime;
        private final ValidityPeriod validity;
        private final String rawText;

        private final List<ReportModifier> modifiers = new ArrayList<>();
        private ForecastConditions baseForecast = ForecastConditions.EMPTY;
        private final List<ForecastChangeGroup> changeGroups = new ArrayList<>();
        private final List<TemperatureExtreme> temperatureExtremes = new ArrayList<>();
        private final List<Altimeter> pressureForecasts = new ArrayList<>();
        private String remarks;
        private final List<FieldDefect> defects = new ArrayList<>();

        private Builder(StationId station, DayTime issueTime, ValidityPeriod validity, String rawText) {
            this.station = Objects.requireNonNull(station, "station");
            this.issueTime = Objects.requireNonNull(issueTime, "issueTime");
            this.validity = validity;
            this.rawText = Objects.requireNonNull(rawText, "rawText");
        }

        public Builder addModifier(ReportModifier modifier) {
            if (!modifiers.contains(modifier)) {
                modifiers.add(modifier);
            }
            return this;
        }

        public Builder withBaseForecast(ForecastConditions baseForecast) {
            this.baseForecast = Objects.requireNonNull(baseForecast, "baseForecast");
            return this;
        }

        public Builder addChangeGroup(ForecastChangeGroup group) {
            changeGroups.add(Objects.requireNonNull(group, "group"));
            return this;
        }

        public Builder addTemperatureExtremes(List<TemperatureExtreme> extremes) {
            temperatureExtremes.addAll(extremes);
            return this;
        }

        public Builder addPressureForecasts(List<Altimeter> pressures) {
            pressureForecasts.addAll(pressures);
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

        public TafRecord build() {
            return new TafRecord(station, issueTime, Optional.ofNullable(validity), modifiers, baseForecast,
                    changeGroups, temperatureExtremes, pressureForecasts, Optional.ofNullable(remarks), defects,
                    rawText);
        }
    }
}
