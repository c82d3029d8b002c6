package com.questrail.aviationwx.codec.impl;

import com.questrail.aviationwx.codec.MalformedTimeException;
import com.questrail.aviationwx.codec.MissingTimeException;
import com.questrail.aviationwx.codec.ReportDecodeException;
import com.questrail.aviationwx.codec.ReportDecoder;
import com.questrail.aviationwx.internal.scan.ReportScanner;
import com.questrail.aviationwx.internal.scan.ReportToken;
import com.questrail.aviationwx.internal.scan.TokenCursor;
import com.questrail.aviationwx.internal.scan.TokenShape;
import com.questrail.aviationwx.internal.time.ReportTimes;
import com.questrail.aviationwx.model.ChangeKind;
import com.questrail.aviationwx.model.ChangeWindow;
import com.questrail.aviationwx.model.DayTime;
import com.questrail.aviationwx.model.ForecastChangeGroup;
import com.questrail.aviationwx.model.ReportModifier;
import com.questrail.aviationwx.model.StartInstant;
import com.questrail.aviationwx.model.StationId;
import com.questrail.aviationwx.model.TafRecord;
import com.questrail.aviationwx.model.ValidityPeriod;
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
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * DefaultTafDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link ReportDecoder} for TAF forecasts.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Optional {@code TAF} keyword, never mistaken for the station</li>
 *   <li>Station, issue time and overall validity period (all mandatory, except
 *       that a {@code NIL} forecast ends after its issue time)</li>
 *   <li>The base forecast field group</li>
 *   <li>Zero or more change groups, each opened by an introducer:
 *     <ul>
 *       <li>{@code FMDDHHMM}</li>
 *       <li>{@code BECMG DDHH/DDHH}</li>
 *       <li>{@code TEMPO DDHH/DDHH}</li>
 *       <li>{@code PROB30|PROB40 TEMPO DDHH/DDHH}</li>
 *     </ul>
 *   </li>
 *   <li>Remarks after {@code RMK}</li>
 * </ol>
 *
 * <p><strong>Change-group periods.</strong> Each group stores the window
 * parsed from its own tokens. The overall validity is never substituted. A
 * group whose period is missing or malformed keeps an empty window and a
 * field defect is recorded.</p>
 *
 * <p>A {@code PROB} token that does not introduce a group is reported as a
 * defect and the fields after it stay with the current group (or the base
 * forecast).</p>
 */
public final class DefaultTafDecoder implements ReportDecoder<TafRecord>
{
    private static final FieldGroupDecoder FIELDS = new FieldGroupDecoder(FieldGroupDecoder.Mode.FORECAST);
    private static final Pattern PERIOD_LIKE = Pattern.compile("\\d+/\\d+");
    private static final String TAF_KEYWORD = "TAF";
    private static final String TEMPO = "TEMPO";

    private final ReportObservabilitySink sink;
    private final Clock clock;

    public DefaultTafDecoder() {
        this(NullObservabilitySink.INSTANCE, Clock.systemUTC());
    }

    public DefaultTafDecoder(ReportObservabilitySink sink, Clock clock) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public TafRecord decode(String rawText)
    {
        try {
            return decodeTokens(rawText, ReportScanner.scan(rawText));
        }
        catch (ReportDecodeException e) {
            sink.onError(new ReportErrorEvent(clock.instant(), ReportKind.TAF, rawText, e.getMessage(), e));
            throw e;
        }
    }

    private TafRecord decodeTokens(String rawText, List<ReportToken> tokens) {
        TokenCursor cursor = new TokenCursor(tokens);

        if (TAF_KEYWORD.equals(cursor.peek().text())) {
            cursor.next();
        }

        // 1) Identity groups
        List<ReportModifier> modifiers = new ArrayList<>();
        ReportHeaders.consumeModifiers(cursor, modifiers::add);
        StationId station = ReportHeaders.consumeStation(cursor);
        DayTime issueTime = ReportHeaders.consumeDayTime(cursor, station, "issue time");
        ReportHeaders.consumeModifiers(cursor, modifiers::add);
        boolean endsAfterIssueTime = !cursor.hasNext() || cursor.peek().is(TokenShape.REMARKS);
        if (modifiers.contains(ReportModifier.MISSING) && endsAfterIssueTime) {
            return decodeNil(cursor, rawText, tokens.size(), station, issueTime, modifiers);
        }
        ValidityPeriod validity = consumeValidity(cursor, station);
        ReportHeaders.consumeModifiers(cursor, modifiers::add);

        TafRecord.Builder builder = TafRecord.builder(station, issueTime, validity, rawText);
        modifiers.forEach(builder::addModifier);
        DefectLog defects = new DefectLog(ReportKind.TAF, sink, clock);

        // 2) Base forecast
        FieldGroupDecoder.FieldGroup base = new FieldGroupDecoder.FieldGroup();
        FIELDS.decodeInto(cursor, base, defects, DefaultTafDecoder::endsGroup);
        builder.withBaseForecast(base.toConditions());
        collectForecastExtras(builder, base);

        // 3) Change groups, in encounter order
        while (cursor.hasNext() && !cursor.peek().is(TokenShape.REMARKS)) {
            ReportToken introducer = cursor.next();
            ChangeKind kind;
            OptionalInt probability = OptionalInt.empty();
            Optional<ChangeWindow> window;

            if (introducer.is(TokenShape.FROM_TIME)) {
                kind = ChangeKind.FROM;
                window = parseFromTime(introducer, defects);
            } else if (introducer.is(TokenShape.PROBABILITY)) {
                kind = ChangeKind.PROBABLE_TEMPORARY;
                probability = OptionalInt.of(Integer.parseInt(introducer.text().substring(4)));
                cursor.next(); // TEMPO
                window = consumeGroupPeriod(cursor, introducer.text() + " " + TEMPO, defects);
            } else {
                kind = TEMPO.equals(introducer.text()) ? ChangeKind.TEMPORARY : ChangeKind.BECOMING;
                window = consumeGroupPeriod(cursor, introducer.text(), defects);
            }

            FieldGroupDecoder.FieldGroup fields = new FieldGroupDecoder.FieldGroup();
            FIELDS.decodeInto(cursor, fields, defects, DefaultTafDecoder::endsGroup);
            builder.addChangeGroup(new ForecastChangeGroup(kind, probability, window, fields.toConditions()));
            collectForecastExtras(builder, fields);
        }

        // 4) Remarks
        consumeRemarks(cursor, builder);

        TafRecord record = builder.addDefects(defects.defects()).build();
        sink.onReportDecoded(new ReportDecodedEvent(
                clock.instant(), ReportKind.TAF, station, tokens.size(), defects.size()));
        return record;
    }

    /**
     * A NIL forecast: the issue time is the last group before any remarks.
     */
    private TafRecord decodeNil(TokenCursor cursor, String rawText, int tokenCount, StationId station,
                                DayTime issueTime, List<ReportModifier> modifiers) {
        TafRecord.Builder builder = TafRecord.nilBuilder(station, issueTime, rawText);
        modifiers.forEach(builder::addModifier);
        consumeRemarks(cursor, builder);

        TafRecord record = builder.build();
        sink.onReportDecoded(new ReportDecodedEvent(clock.instant(), ReportKind.TAF, station, tokenCount, 0));
        return record;
    }

    private static void collectForecastExtras(TafRecord.Builder builder, FieldGroupDecoder.FieldGroup fields) {
        builder.addTemperatureExtremes(fields.temperatureExtremes())
               .addPressureForecasts(fields.pressureForecasts());
        fields.modifiers().forEach(builder::addModifier);
    }

    private static void consumeRemarks(TokenCursor cursor, TafRecord.Builder builder) {
        if (cursor.hasNext()) {
            cursor.next();
            String remarks = cursor.drainText();
            if (!remarks.isEmpty()) {
                builder.withRemarks(remarks);
            }
        }
    }

    private static ValidityPeriod consumeValidity(TokenCursor cursor, StationId station) {
        if (!cursor.hasNext()) {
            throw new MissingTimeException("Report for " + station + " ends before the validity period");
        }
        ReportToken token = cursor.peek();
        if (token.matches(TokenShape.PERIOD)) {
            cursor.next();
            return ReportTimes.parseValidityToken(token.text());
        }
        if (PERIOD_LIKE.matcher(token.text()).matches()) {
            throw new MalformedTimeException("Validity period must be DDHH/DDHH (was '" + token.text() + "')");
        }
        throw new MissingTimeException(
                "No validity period after the issue time of " + station + ", found '" + token.text() + "'");
    }

    private static Optional<ChangeWindow> parseFromTime(ReportToken token, DefectLog defects) {
        try {
            return Optional.of(new StartInstant(ReportTimes.parseIssueTime(token.text().substring(2))));
        }
        catch (MalformedTimeException e) {
            defects.record("change group", token.text(), e.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<ChangeWindow> consumeGroupPeriod(TokenCursor cursor, String introducer,
                                                             DefectLog defects) {
        if (!cursor.nextMatches(TokenShape.PERIOD)) {
            defects.record("change group", introducer, "no DDHH/DDHH period after the introducer");
            return Optional.empty();
        }
        String period = cursor.next().text();
        try {
            return Optional.of(ReportTimes.parseValidityToken(period));
        }
        catch (MalformedTimeException e) {
            defects.record("change group", introducer + " " + period, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * True when the cursor sits on a change-group introducer or on {@code RMK}.
     */
    static boolean endsGroup(TokenCursor cursor) {
        ReportToken next = cursor.peek();
        switch (next.shape()) {
            case FROM_TIME, CHANGE_INDICATOR, REMARKS:
                return true;
            case PROBABILITY:
                boolean percentAllowed = "PROB30".equals(next.text()) || "PROB40".equals(next.text());
                return percentAllowed
                        && cursor.nextMatches(1, TokenShape.CHANGE_INDICATOR)
                        && TEMPO.equals(cursor.peek(1).text());
            default:
                return false;
        }
    }
}
