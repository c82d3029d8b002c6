package com.questrail.aviationwx.codec.impl;

import com.questrail.aviationwx.codec.ReportDecodeException;
import com.questrail.aviationwx.codec.ReportDecoder;
import com.questrail.aviationwx.internal.scan.ReportScanner;
import com.questrail.aviationwx.internal.scan.ReportToken;
import com.questrail.aviationwx.internal.scan.TokenCursor;
import com.questrail.aviationwx.internal.scan.TokenShape;
import com.questrail.aviationwx.model.DayTime;
import com.questrail.aviationwx.model.MetarRecord;
import com.questrail.aviationwx.model.ReportModifier;
import com.questrail.aviationwx.model.ReportType;
import com.questrail.aviationwx.model.StationId;
import com.questrail.aviationwx.observability.NullObservabilitySink;
import com.questrail.aviationwx.observability.ReportDecodedEvent;
import com.questrail.aviationwx.observability.ReportErrorEvent;
import com.questrail.aviationwx.observability.ReportKind;
import com.questrail.aviationwx.observability.ReportObservabilitySink;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * DefaultMetarDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link ReportDecoder} for METAR and SPECI reports.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Optional {@code METAR} / {@code SPECI} keyword (routine if absent)</li>
 *   <li>Report modifiers, station, observation time, report modifiers</li>
 *   <li>The shared field group: wind, visibility, weather, clouds, temperature, altimeter</li>
 *   <li>Trend ({@code NOSIG}, {@code BECMG ...}, {@code TEMPO ...}) kept verbatim</li>
 *   <li>Remarks after {@code RMK} kept verbatim</li>
 * </ol>
 *
 * <p>Only station and observation time are mandatory. Every other field that
 * is absent or malformed is left unset and listed in the record's defects.</p>
 */
public final class DefaultMetarDecoder implements ReportDecoder<MetarRecord>
{
    private static final FieldGroupDecoder FIELDS = new FieldGroupDecoder(FieldGroupDecoder.Mode.OBSERVATION);

    private final ReportObservabilitySink sink;
    private final Clock clock;

    public DefaultMetarDecoder() {
        this(NullObservabilitySink.INSTANCE, Clock.systemUTC());
    }

    public DefaultMetarDecoder(ReportObservabilitySink sink, Clock clock) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public MetarRecord decode(String rawText)
    {
        try {
            return decodeTokens(rawText, ReportScanner.scan(rawText));
        }
        catch (ReportDecodeException e) {
            sink.onError(new ReportErrorEvent(clock.instant(), ReportKind.METAR, rawText, e.getMessage(), e));
            throw e;
        }
    }

    private MetarRecord decodeTokens(String rawText, List<ReportToken> tokens) {
        TokenCursor cursor = new TokenCursor(tokens);

        // 1) Report type keyword
        ReportType reportType = ReportType.ROUTINE;
        if (cursor.peek().is(TokenShape.REPORT_TYPE)) {
            Optional<ReportType> keyword = ReportType.fromKeyword(cursor.peek().text());
            if (keyword.isPresent()) {
                reportType = keyword.get();
                cursor.next();
            }
        }

        // 2) Identity groups
        List<ReportModifier> modifiers = new ArrayList<>();
        ReportHeaders.consumeModifiers(cursor, modifiers::add);
        StationId station = ReportHeaders.consumeStation(cursor);
        DayTime observationTime = ReportHeaders.consumeDayTime(cursor, station, "observation time");
        ReportHeaders.consumeModifiers(cursor, modifiers::add);

        // 3) Body
        DefectLog defects = new DefectLog(ReportKind.METAR, sink, clock);
        FieldGroupDecoder.FieldGroup body = new FieldGroupDecoder.FieldGroup();
        FIELDS.decodeInto(cursor, body, defects, DefaultMetarDecoder::endsBody);

        MetarRecord.Builder builder = MetarRecord.builder(station, observationTime, rawText)
                .withReportType(reportType)
                .withConditions(body.toConditions())
                .withTemperatureDewpoint(body.temperatureDewpoint())
                .withAltimeter(body.altimeter());
        modifiers.forEach(builder::addModifier);

        // 4) Trend
        if (cursor.hasNext() && !cursor.peek().is(TokenShape.REMARKS)) {
            List<String> trend = new ArrayList<>();
            while (cursor.hasNext() && !cursor.peek().is(TokenShape.REMARKS)) {
                trend.add(cursor.next().text());
            }
            builder.withTrend(String.join(" ", trend));
        }

        // 5) Remarks
        if (cursor.hasNext()) {
            cursor.next();
            String remarks = cursor.drainText();
            if (!remarks.isEmpty()) {
                builder.withRemarks(remarks);
            }
        }

        MetarRecord record = builder.addDefects(defects.defects()).build();
        sink.onReportDecoded(new ReportDecodedEvent(
                clock.instant(), ReportKind.METAR, station, tokens.size(), defects.size()));
        return record;
    }

    private static boolean endsBody(TokenCursor cursor) {
        ReportToken next = cursor.peek();
        return next.is(TokenShape.REMARKS)
                || next.is(TokenShape.CHANGE_INDICATOR)
                || next.is(TokenShape.NO_SIGNIFICANT_CHANGE);
    }
}
