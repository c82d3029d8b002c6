package com.questrail.aviationwx.internal.scan;

import java.util.regex.Pattern;

/**
 * TokenShape
 * -----------------------------------------------------------------------------
 * Lexical shapes of report tokens.
 *
 * <p>Each constant carries the full-match pattern of its shape. A token's
 * primary shape is the <em>first</em> constant in declaration order whose
 * pattern matches; fixed keywords are therefore declared before the letter
 * and digit shapes they would otherwise collide with ({@code AUTO} before
 * {@link #STATION}, {@code TSRA} as {@link #WEATHER} rather than a station).</p>
 *
 * <p>Decoders that expect a specific group at a specific point of the grammar
 * test the token against that shape directly with {@link #matches(String)}
 * instead of relying on the primary classification.</p>
 */
public enum TokenShape
{
    REPORT_TYPE("METAR|SPECI|TAF"),
    MODIFIER("AMD|COR|AUTO|NIL|CNL"),
    CHANGE_INDICATOR("BECMG|TEMPO"),
    FROM_TIME("FM\\d{6}"),
    PROBABILITY("PROB\\d{2}"),
    NO_SIGNIFICANT_CHANGE("NOSIG"),
    REMARKS("RMK"),
    CAVOK("CAVOK"),
    CLEAR_SKY("NSC|SKC|NCD|CLR"),
    NO_SIGNIFICANT_WEATHER("NSW"),
    DAY_TIME("\\d{6}Z"),
    PERIOD("\\d{4}/\\d{4}"),
    WIND("(\\d{3}|VRB)\\d{2,3}(G\\d{2,3})?(KT|MPS|KMH)"),
    WIND_VARIATION("\\d{3}V\\d{3}"),
    WIND_SHEAR("WS\\d{3}/\\d{3}\\d{2,3}(G\\d{2,3})?(KT|MPS|KMH)"),
    VISIBILITY("\\d{4}|\\d{1,2}\\+|[PM]?\\d{1,2}SM|[PM]?\\d/\\d{1,2}SM"),
    WHOLE_NUMBER("\\d{1,2}"),
    CLOUD("(FEW|SCT|BKN|OVC|VV)(\\d{3}|///)(CB|TCU)?"),
    TEMPERATURE("M?\\d{2}/M?\\d{2}"),
    TEMPERATURE_EXTREME("T[XN]M?\\d{2}/\\d{4}Z"),
    ALTIMETER("[QA]\\d{4}"),
    PRESSURE_FORECAST("QNH\\d{4}INS"),
    WEATHER("(\\+|-|VC)?(MI|BC|PR|DR|BL|SH|TS|FZ)?(DZ|RA|SN|SG|IC|PL|GR|GS|UP|BR|FG|FU|VA|DU|SA|HZ|PY|PO|SQ|FC|SS|DS)+"
            + "|(\\+|-|VC)?(TS|SH)"),
    STATION("[A-Z]{4}"),
    UNKNOWN(null);

    private final Pattern pattern;

    TokenShape(String regex) {
        this.pattern = (regex == null) ? null : Pattern.compile(regex);
    }

    /**
     * Returns {@code true} if the whole of {@code text} has this shape.
     * {@link #UNKNOWN} matches nothing.
     */
    public boolean matches(String text) {
        return pattern != null && text != null && pattern.matcher(text).matches();
    }

    /**
     * Returns the primary shape of {@code text}.
     */
    public static TokenShape classify(String text) {
        for (TokenShape shape : values()) {
            if (shape.matches(text)) {
                return shape;
            }
        }
        return UNKNOWN;
    }
}
