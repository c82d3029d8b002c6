package com.questrail.aviationwx.codec;

import com.questrail.aviationwx.model.WeatherReport;

/**
 * ReportDecoder
 * -----------------------------------------------------------------------------
 * Text-level decoder for one kind of aviation weather report.
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Scanning the raw line into tokens</li>
 *   <li>Consuming the tokens positionally, keyed on token shape</li>
 *   <li>Constructing an immutable record on success</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Fetching, caching or refreshing reports</li>
 *   <li>Checking meteorological plausibility</li>
 *   <li>Rendering text (see {@link ReportFormatter})</li>
 * </ul>
 *
 * <p>Implementations hold no mutable state and may be shared across threads.</p>
 *
 * @param <R> the record type produced
 */
public interface ReportDecoder<R extends WeatherReport>
{
    /**
     * Decodes a single raw report line.
     *
     * @param rawText the report, optionally prefixed with its type keyword
     * @return the decoded record; never {@code null}
     * @throws EmptyReportException     if the input is blank
     * @throws MissingStationException  if no station identifier is present
     * @throws MissingTimeException     if a mandatory time group is absent
     * @throws MalformedTimeException   if a mandatory time group is malformed
     */
    R decode(String rawText);
}
