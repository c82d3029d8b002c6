package com.questrail.aviationwx.codec.impl;

import com.questrail.aviationwx.codec.MalformedTimeException;
import com.questrail.aviationwx.codec.MissingStationException;
import com.questrail.aviationwx.codec.MissingTimeException;
import com.questrail.aviationwx.internal.scan.ReportToken;
import com.questrail.aviationwx.internal.scan.TokenCursor;
import com.questrail.aviationwx.internal.scan.TokenShape;
import com.questrail.aviationwx.internal.time.ReportTimes;
import com.questrail.aviationwx.model.DayTime;
import com.questrail.aviationwx.model.ReportModifier;
import com.questrail.aviationwx.model.StationId;

import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Identity-group steps shared by the METAR and TAF grammars: modifiers,
 * station and the primary time group. Failures here are fatal.
 */
final class ReportHeaders
{
    private static final Pattern TIME_LIKE = Pattern.compile("\\d+Z?");
    private static final String AMENDED_KEYWORD = "AMD";
    private static final String NOT_KEYWORD = "NOT";
    private static final String SKED_KEYWORD = "SKED";

    private ReportHeaders() {}

    /**
     * Consumes any run of {@code AMD}/{@code COR}/{@code AUTO}/{@code NIL}/{@code CNL} tokens,
     * including the three-token {@code AMD NOT SKED}.
     */
    static void consumeModifiers(TokenCursor cursor, Consumer<ReportModifier> sink) {
        while (cursor.hasNext() && cursor.peek().is(TokenShape.MODIFIER)) {
            sink.accept(consumeModifier(cursor));
        }
    }

    /**
     * Consumes the modifier under the cursor. {@code AMD} directly followed by
     * {@code NOT SKED} is read as one {@link ReportModifier#AMENDMENTS_NOT_SCHEDULED}.
     */
    static ReportModifier consumeModifier(TokenCursor cursor) {
        return consumeModifier(cursor, cursor.next());
    }

    /**
     * As {@link #consumeModifier(TokenCursor)}, for a modifier token the caller already consumed.
     */
    static ReportModifier consumeModifier(TokenCursor cursor, ReportToken token) {
        if (AMENDED_KEYWORD.equals(token.text())
                && cursor.hasNext(2)
                && NOT_KEYWORD.equals(cursor.peek().text())
                && SKED_KEYWORD.equals(cursor.peek(1).text())) {
            cursor.next();
            cursor.next();
            return ReportModifier.AMENDMENTS_NOT_SCHEDULED;
        }
        return ReportModifier.fromKeyword(token.text()).orElseThrow();
    }

    static StationId consumeStation(TokenCursor cursor) {
        if (!cursor.hasNext()) {
            throw new MissingStationException("Report ends before the station identifier");
        }
        ReportToken token = cursor.peek();
        if (!token.matches(TokenShape.STATION)) {
            throw new MissingStationException(
                    "Expected a 4-letter station identifier, found '" + token.text() + "'");
        }
        cursor.next();
        return StationId.of(token.text());
    }

    /**
     * Consumes the {@code DDHHMMZ} group following the station.
     *
     * @param what name of the time group for messages, e.g. {@code observation time}
     */
    static DayTime consumeDayTime(TokenCursor cursor, StationId station, String what) {
        if (!cursor.hasNext()) {
            throw new MissingTimeException("Report for " + station + " ends before the " + what);
        }
        ReportToken token = cursor.peek();
        if (token.matches(TokenShape.DAY_TIME)) {
            cursor.next();
            String digits = token.text().substring(0, token.text().length() - 1);
            return ReportTimes.parseIssueTime(digits);
        }
        if (TIME_LIKE.matcher(token.text()).matches() && token.text().endsWith("Z")) {
            throw new MalformedTimeException(
                    "The " + what + " must be DDHHMMZ (was '" + token.text() + "')");
        }
        throw new MissingTimeException(
                "No " + what + " after station " + station + ", found '" + token.text() + "'");
    }
}
