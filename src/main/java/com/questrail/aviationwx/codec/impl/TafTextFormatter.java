package com.questrail.aviationwx.codec.impl;

import com.questrail.aviationwx.codec.ReportFormatter;
import com.questrail.aviationwx.internal.time.ReportTimes;
import com.questrail.aviationwx.model.Altimeter;
import com.questrail.aviationwx.model.ForecastChangeGroup;
import com.questrail.aviationwx.model.ReportModifier;
import com.questrail.aviationwx.model.TafRecord;
import com.questrail.aviationwx.model.TemperatureExtreme;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * TafTextFormatter
 * -----------------------------------------------------------------------------
 * Renders a {@link TafRecord}:
 *
 * <pre>
 *   Station: EGMC
 *   Issue Date: 20th
 *   Issue Time: 17:01Z
 *   Valid From: 18:00Z on 20th
 *   Valid To: 02:00Z on 21st
 *   BASE FORECAST
 *     Wind: 320° at 12 KT
 *     ...
 *   FORECAST CHANGES
 *   1. PROB30 TEMPORARY 30% 18:00Z to 20:00Z:
 *     Cloud Layer: Broken at 1400 feet
 * </pre>
 *
 * <p>Change groups are listed in encoding order, each with the period parsed
 * from its own tokens. A change group lists only the fields it changes.</p>
 *
 * <p>A NIL forecast has no validity or forecast blocks; its {@code Report Status}
 * line says so.</p>
 */
public final class TafTextFormatter implements ReportFormatter<TafRecord>
{
    private static final String INDENT = "  ";

    private final boolean includeRawText;

    public TafTextFormatter() {
        this(false);
    }

    public TafTextFormatter(boolean includeRawText) {
        this.includeRawText = includeRawText;
    }

    @Override
    public List<String> formatLines(TafRecord report) {
        List<String> lines = new ArrayList<>();

        lines.add("Station: " + report.station());
        if (!report.modifiers().isEmpty()) {
            lines.add("Report Status: " + report.modifiers().stream()
                    .map(ReportModifier::label)
                    .collect(Collectors.joining(", ")));
        }
        lines.add("Issue Date: " + ReportTimes.ordinalLabel(report.issueTime().day()));
        lines.add("Issue Time: " + ReportTimes.formatTime(report.issueTime()));
        report.validity().ifPresent(v -> {
            lines.add("Valid From: " + ReportTimes.formatInstant(v.from()));
            lines.add("Valid To: " + ReportTimes.formatInstant(v.to()));
        });

        if (!report.isNil()) {
            lines.add("BASE FORECAST");
            lines.addAll(ConditionLines.lines(report.baseForecast(), INDENT, true));
        }

        if (!report.changeGroups().isEmpty()) {
            lines.add("FORECAST CHANGES");
            int index = 1;
            for (ForecastChangeGroup group : report.changeGroups()) {
                lines.add(header(index++, group));
                lines.addAll(ConditionLines.lines(group.conditions(), INDENT, false));
            }
        }

        if (!report.temperatureExtremes().isEmpty()) {
            lines.add("TEMPERATURE FORECAST");
            for (TemperatureExtreme extreme : report.temperatureExtremes()) {
                lines.add(INDENT + extreme.kind().label() + ": " + ConditionLines.celsius(extreme.celsius())
                        + " at " + ReportTimes.formatInstant(extreme.at()));
            }
        }

        if (!report.pressureForecasts().isEmpty()) {
            lines.add("PRESSURE FORECAST");
            int index = 1;
            for (Altimeter qnh : report.pressureForecasts()) {
                lines.add(INDENT + index++ + ". QNH: " + ConditionLines.altimeter(qnh));
            }
        }

        report.remarks().ifPresent(r -> lines.add("Remarks: " + r));
        if (includeRawText || report.hasDefects()) {
            lines.add("Raw: " + report.rawText());
        }
        return lines;
    }

    private static String header(int index, ForecastChangeGroup group) {
        StringBuilder sb = new StringBuilder();
        sb.append(index).append(". ").append(group.label());
        group.probabilityPercent().ifPresent(p -> sb.append(' ').append(p).append('%'));
        sb.append(' ')
          .append(group.window().map(ReportTimes::formatWindow).orElse(ReportTimes.PERIOD_NOT_SPECIFIED))
          .append(':');
        return sb.toString();
    }
}
