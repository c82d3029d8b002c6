package com.questrail.aviationwx;

import com.questrail.aviationwx.codec.ReportDecodeException;
import com.questrail.aviationwx.codec.ReportDecoder;
import com.questrail.aviationwx.codec.ReportFormatter;
import com.questrail.aviationwx.codec.impl.DefaultMetarDecoder;
import com.questrail.aviationwx.codec.impl.DefaultTafDecoder;
import com.questrail.aviationwx.codec.impl.MetarTextFormatter;
import com.questrail.aviationwx.codec.impl.TafTextFormatter;
import com.questrail.aviationwx.config.AviationWeatherConfig;
import com.questrail.aviationwx.model.MetarRecord;
import com.questrail.aviationwx.model.TafRecord;
import com.questrail.aviationwx.model.WeatherReport;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * AviationWeather
 * =============================================================================
 * Entry point wiring the METAR and TAF decoders and formatters to one
 * {@link AviationWeatherConfig}.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Decode raw METAR / SPECI / TAF lines into immutable records</li>
 *   <li>Attach an out-of-band receipt time to a METAR</li>
 *   <li>Render records, or a failed decode, as human-readable text</li>
 * </ul>
 *
 * <h2>What this class does NOT do</h2>
 * <ul>
 *   <li>Fetch, schedule or cache reports</li>
 *   <li>Map record fields onto individually addressable entities</li>
 *   <li>Convert times out of UTC</li>
 * </ul>
 *
 * <p>Instances hold no mutable state and may be shared across threads; every
 * call is independent.</p>
 */
public final class AviationWeather
{
    /** Library version, informational only. */
    public static final String VERSION = "1.0.0";

    private final AviationWeatherConfig config;
    private final ReportDecoder<MetarRecord> metarDecoder;
    private final ReportDecoder<TafRecord> tafDecoder;
    private final ReportFormatter<MetarRecord> metarFormatter;
    private final ReportFormatter<TafRecord> tafFormatter;

    public AviationWeather(AviationWeatherConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.metarDecoder = new DefaultMetarDecoder(config.observabilitySink(), config.clock());
        this.tafDecoder = new DefaultTafDecoder(config.observabilitySink(), config.clock());
        this.metarFormatter = new MetarTextFormatter(config.includeRawText());
        this.tafFormatter = new TafTextFormatter(config.includeRawText());
    }

    /**
     * Creates an instance with {@link AviationWeatherConfig#defaults()}.
     */
    public static AviationWeather create() {
        return new AviationWeather(AviationWeatherConfig.defaults());
    }

    public AviationWeatherConfig config() {
        return config;
    }

    /**
     * Decodes a METAR or SPECI line.
     *
     * @throws ReportDecodeException if the line is empty or lacks its station or observation time
     */
    public MetarRecord parseMetar(String rawText) {
        return metarDecoder.decode(rawText);
    }

    /**
     * Decodes a METAR or SPECI line and annotates it with the time it was received.
     */
    public MetarRecord parseMetar(String rawText, Instant receiptTime) {
        Objects.requireNonNull(receiptTime, "receiptTime");
        return metarDecoder.decode(rawText).withReceiptTime(receiptTime);
    }

    /**
     * Decodes a TAF line.
     *
     * @throws ReportDecodeException if the line is empty or lacks its station, issue time or validity
     */
    public TafRecord parseTaf(String rawText) {
        return tafDecoder.decode(rawText);
    }

    public List<String> formatLines(WeatherReport report) {
        Objects.requireNonNull(report, "report");
        if (report instanceof MetarRecord metar) {
            return metarFormatter.formatLines(metar);
        }
        return tafFormatter.formatLines((TafRecord) report);
    }

    /**
     * Renders a record as one block joined with the configured line separator.
     */
    public String format(WeatherReport report) {
        return String.join(config.lineSeparator(), formatLines(report));
    }

    /**
     * Renders the unavailable state of a report that could not be decoded,
     * keeping the raw text available for manual reading.
     */
    public List<String> describeFailureLines(String rawText, ReportDecodeException failure) {
        Objects.requireNonNull(failure, "failure");
        String raw = (rawText == null) ? "" : rawText.strip();
        return List.of(
                "Report unavailable: " + failure.getMessage(),
                "Raw: " + raw
        );
    }

    public String describeFailure(String rawText, ReportDecodeException failure) {
        return String.join(config.lineSeparator(), describeFailureLines(rawText, failure));
    }
}
