package com.questrail.aviationwx.codec;

import com.questrail.aviationwx.model.WeatherReport;

import java.util.List;

/**
 * ReportFormatter
 * -----------------------------------------------------------------------------
 * Renders a decoded record as deterministic human-readable lines.
 *
 * <p>Formatting is a pure function of the record: no locale, clock or hidden
 * state is consulted, so formatting the same record twice yields identical
 * output. Implementations never throw for a well-formed record, however many
 * of its optional fields are absent.</p>
 *
 * @param <R> the record type rendered
 */
public interface ReportFormatter<R extends WeatherReport>
{
    /**
     * Renders the record as an ordered list of lines.
     */
    List<String> formatLines(R report);

    /**
     * Renders the record as a single block joined with {@code lineSeparator}.
     */
    default String format(R report, String lineSeparator) {
        return String.join(lineSeparator, formatLines(report));
    }
}
