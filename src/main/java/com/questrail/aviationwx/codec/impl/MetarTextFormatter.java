package com.questrail.aviationwx.codec.impl;

import com.questrail.aviationwx.codec.ReportFormatter;
import com.questrail.aviationwx.internal.time.ReportTimes;
import com.questrail.aviationwx.model.ForecastConditions;
import com.questrail.aviationwx.model.MetarRecord;
import com.questrail.aviationwx.model.ReportModifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * MetarTextFormatter
 * -----------------------------------------------------------------------------
 * Renders a {@link MetarRecord} in a fixed line order:
 *
 * <pre>
 *   Report Type: METAR (routine)
 *   Station: EGMC
 *   Observation Day: 20th
 *   Observation Time: 16:50Z
 *   Wind: 310° at 9 KT (varying between 280° and 360°)
 *   Visibility: 10 km or more
 *   Cloud Layer: Broken at 1900 feet
 *   Temperature/Dewpoint: 3°C / 0°C
 *   Altimeter: 1014 hPa
 * </pre>
 *
 * <p>Absent fields produce no line, except wind and temperature/dewpoint which
 * render {@code not reported}. The observation time is rendered once, as
 * {@code HH:MMZ}.</p>
 */
public final class MetarTextFormatter implements ReportFormatter<MetarRecord>
{
    private final boolean includeRawText;

    public MetarTextFormatter() {
        this(false);
    }

    /**
     * @param includeRawText append the raw line to every rendering, not only to defective records
     */
    public MetarTextFormatter(boolean includeRawText) {
        this.includeRawText = includeRawText;
    }

    @Override
    public List<String> formatLines(MetarRecord report) {
        List<String> lines = new ArrayList<>();

        lines.add("Report Type: " + report.reportType().keyword() + " (" + report.reportType().label() + ")");
        if (!report.modifiers().isEmpty()) {
            lines.add("Report Status: " + report.modifiers().stream()
                    .map(ReportModifier::label)
                    .collect(Collectors.joining(", ")));
        }
        lines.add("Station: " + report.station());
        lines.add("Observation Day: " + ReportTimes.ordinalLabel(report.observationTime().day()));
        lines.add("Observation Time: " + ReportTimes.formatTime(report.observationTime()));
        report.receiptTime().ifPresent(t -> lines.add("Receipt Time: " + t));

        ForecastConditions conditions = new ForecastConditions(
                report.wind(),
                report.visibility(),
                report.weather(),
                report.cloudLayers(),
                report.clearSky(),
                Optional.empty());
        lines.addAll(ConditionLines.lines(conditions, "", true));

        lines.add("Temperature/Dewpoint: " + report.temperatureDewpoint()
                .map(ConditionLines::temperature)
                .orElse(ConditionLines.NOT_REPORTED));
        report.altimeter().ifPresent(a -> lines.add("Altimeter: " + ConditionLines.altimeter(a)));
        report.trend().ifPresent(t -> lines.add("Trend: " + t));
        report.remarks().ifPresent(r -> lines.add("Remarks: " + r));

        if (includeRawText || report.hasDefects()) {
            lines.add("Raw: " + report.rawText());
        }
        return lines;
    }
}
