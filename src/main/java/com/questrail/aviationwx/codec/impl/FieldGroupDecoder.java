package com.questrail.aviationwx.codec.impl;

import com.questrail.aviationwx.codec.MalformedFieldException;
import com.questrail.aviationwx.codec.MalformedTimeException;
import com.questrail.aviationwx.internal.scan.ReportToken;
import com.questrail.aviationwx.internal.scan.TokenCursor;
import com.questrail.aviationwx.internal.scan.TokenShape;
import com.questrail.aviationwx.internal.time.ReportTimes;
import com.questrail.aviationwx.model.Altimeter;
import com.questrail.aviationwx.model.ClearSky;
import com.questrail.aviationwx.model.CloudCoverage;
import com.questrail.aviationwx.model.CloudLayer;
import com.questrail.aviationwx.model.DirectionRange;
import com.questrail.aviationwx.model.ForecastConditions;
import com.questrail.aviationwx.model.ReportModifier;
import com.questrail.aviationwx.model.SpeedUnit;
import com.questrail.aviationwx.model.TemperatureDewpoint;
import com.questrail.aviationwx.model.TemperatureExtreme;
import com.questrail.aviationwx.model.Visibility;
import com.questrail.aviationwx.model.WeatherPhenomenon;
import com.questrail.aviationwx.model.Wind;
import com.questrail.aviationwx.model.WindShear;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * FieldGroupDecoder
 * -----------------------------------------------------------------------------
 * Recursive-descent sub-grammar for the wind / visibility / weather / cloud
 * field group shared by a METAR body, a TAF base forecast and every TAF
 * change group.
 *
 * <p>Tokens are dispatched on their {@link TokenShape}, never on their index,
 * so optional groups (gust, direction variation, several cloud layers) may
 * appear or disappear without shifting the meaning of the rest.</p>
 *
 * <p>Every token consumed here either lands in a field or is recorded as a
 * defect. Decoding stops at the first token accepted by the caller's boundary
 * predicate, or at end of input.</p>
 */
final class FieldGroupDecoder
{
    /**
     * Which groups are legal in the field group being decoded.
     */
    enum Mode
    {
        /** METAR body: temperature/dewpoint and altimeter allowed. */
        OBSERVATION,
        /** TAF base or change group: temperature extremes, wind shear, QNH forecasts allowed. */
        FORECAST
    }

    private static final Pattern WIND = Pattern.compile(
            "(\\d{3}|VRB)(\\d{2,3})(?:G(\\d{2,3}))?(KT|MPS|KMH)");
    private static final Pattern WIND_VARIATION = Pattern.compile("(\\d{3})V(\\d{3})");
    private static final Pattern WIND_SHEAR = Pattern.compile("WS(\\d{3})/(.+)");
    private static final Pattern CLOUD = Pattern.compile("(FEW|SCT|BKN|OVC|VV)(\\d{3}|///)(CB|TCU)?");
    private static final Pattern WEATHER_PARTS = Pattern.compile(
            "(\\+|-|VC)?(MI|BC|PR|DR|BL|SH|TS|FZ)?((?:[A-Z]{2})*)");
    private static final Pattern TEMPERATURE = Pattern.compile("(M)?(\\d{2})/(M)?(\\d{2})");
    private static final Pattern PRESSURE_FORECAST = Pattern.compile("QNH(\\d{4})INS");
    private static final Pattern TEMPERATURE_EXTREME = Pattern.compile("T([XN])(M)?(\\d{2})/(\\d{4})Z");
    private static final Pattern STATUTE_MILES = Pattern.compile("([PM])?(?:(\\d{1,2})|(\\d)/(\\d{1,2}))SM");
    private static final Pattern STATUTE_FRACTION = Pattern.compile("\\d/\\d{1,2}SM");
    private static final Pattern WIND_GUESS = Pattern.compile(".*(KT|MPS|KMH)");
    private static final Pattern CLOUD_GUESS = Pattern.compile("(FEW|SCT|BKN|OVC|VV).*");
    private static final Pattern ALTIMETER_GUESS = Pattern.compile("[QA]\\d+");
    private static final Pattern TEMPERATURE_GUESS = Pattern.compile("M?\\d+/M?\\d*");

    private final Mode mode;

    FieldGroupDecoder(Mode mode) {
        this.mode = mode;
    }

    /**
     * Mutable accumulator for one field group. Lives for a single decode call.
     */
    static final class FieldGroup
    {
        private Wind wind;
        private Visibility visibility;
        private final List<WeatherPhenomenon> weather = new ArrayList<>();
        private final List<CloudLayer> cloudLayers = new ArrayList<>();
        private ClearSky clearSky;
        private WindShear windShear;
        private TemperatureDewpoint temperatureDewpoint;
        private Altimeter altimeter;
        private final List<TemperatureExtreme> temperatureExtremes = new ArrayList<>();
        private final List<Altimeter> pressureForecasts = new ArrayList<>();
        private final List<ReportModifier> modifiers = new ArrayList<>();

        ForecastConditions toConditions() {
            return new ForecastConditions(
                    Optional.ofNullable(wind),
                    Optional.ofNullable(visibility),
                    weather,
                    cloudLayers,
                    Optional.ofNullable(clearSky),
                    Optional.ofNullable(windShear)
            );
        }

        TemperatureDewpoint temperatureDewpoint() {
            return temperatureDewpoint;
        }

        Altimeter altimeter() {
            return altimeter;
        }

        List<TemperatureExtreme> temperatureExtremes() {
            return temperatureExtremes;
        }

        List<Altimeter> pressureForecasts() {
            return pressureForecasts;
        }

        /** Report status keywords found among the fields, e.g. a trailing {@code AMD NOT SKED}. */
        List<ReportModifier> modifiers() {
            return modifiers;
        }
    }

    /**
     * Consumes tokens into {@code group} until {@code boundary} accepts the
     * cursor or input runs out.
     */
    void decodeInto(TokenCursor cursor, FieldGroup group, DefectLog defects, Predicate<TokenCursor> boundary) {
        while (cursor.hasNext() && !boundary.test(cursor)) {
            ReportToken token = cursor.next();
            try {
                dispatch(token, cursor, group, defects);
            }
            catch (MalformedFieldException e) {
                defects.record(e);
            }
        }
    }

    private void dispatch(ReportToken token, TokenCursor cursor, FieldGroup group, DefectLog defects) {
        String text = token.text();

        switch (token.shape()) {
            case WIND -> {
                Wind wind = parseWind(text, "wind");
                if (cursor.nextMatches(TokenShape.WIND_VARIATION)) {
                    wind = withVariation(wind, cursor.next().text(), defects);
                }
                if (group.wind != null) {
                    throw duplicate("wind", text);
                }
                if (wind.hasGustAnomaly()) {
                    defects.record("wind", text, "gust is not greater than the mean speed");
                }
                group.wind = wind;
            }
            case WIND_VARIATION -> throw new MalformedFieldException("wind variation", text,
                    "direction variation without a preceding wind group");
            case VISIBILITY -> setVisibility(group, parseVisibility(text), text);
            case WHOLE_NUMBER -> {
                if (cursor.hasNext() && STATUTE_FRACTION.matcher(cursor.peek().text()).matches()) {
                    String fraction = cursor.next().text();
                    String combined = text + " " + fraction;
                    setVisibility(group, parseMixedMiles(text, fraction, combined), combined);
                } else {
                    throw new MalformedFieldException("visibility", text, "whole number without a fraction of a statute mile");
                }
            }
            case CAVOK -> setVisibility(group, Visibility.Cavok.INSTANCE, text);
            case WEATHER -> group.weather.add(parseWeather(text));
            case NO_SIGNIFICANT_WEATHER -> group.weather.add(WeatherPhenomenon.noSignificantWeather());
            case CLOUD -> group.cloudLayers.add(parseCloud(text));
            case CLEAR_SKY -> {
                if (group.clearSky != null) {
                    throw duplicate("clear sky", text);
                }
                group.clearSky = ClearSky.fromCode(text).orElseThrow();
            }
            case TEMPERATURE -> {
                requireMode(Mode.OBSERVATION, "temperature", text);
                if (group.temperatureDewpoint != null) {
                    throw duplicate("temperature", text);
                }
                group.temperatureDewpoint = parseTemperature(text);
            }
            case ALTIMETER -> {
                requireMode(Mode.OBSERVATION, "altimeter", text);
                if (group.altimeter != null) {
                    throw duplicate("altimeter", text);
                }
                group.altimeter = parseAltimeter(text);
            }
            case TEMPERATURE_EXTREME -> {
                requireMode(Mode.FORECAST, "temperature forecast", text);
                group.temperatureExtremes.add(parseTemperatureExtreme(text));
            }
            case PRESSURE_FORECAST -> {
                requireMode(Mode.FORECAST, "pressure forecast", text);
                group.pressureForecasts.add(parsePressureForecast(text));
            }
            case WIND_SHEAR -> {
                requireMode(Mode.FORECAST, "wind shear", text);
                if (group.windShear != null) {
                    throw duplicate("wind shear", text);
                }
                group.windShear = parseWindShear(text);
            }
            case PROBABILITY -> {
                // Only PROB30/PROB40 directly followed by TEMPO opens a group; anything
                // else is reported and its fields stay with the current group.
                if (cursor.nextMatches(TokenShape.PERIOD)) {
                    String period = cursor.next().text();
                    throw new MalformedFieldException("change group", text + " " + period,
                            "probability not followed by TEMPO");
                }
                throw new MalformedFieldException("change group", text, "probability not followed by TEMPO");
            }
            case PERIOD -> throw new MalformedFieldException("change group", text,
                    "period without a change-group introducer");
            case MODIFIER -> {
                if (mode != Mode.FORECAST || !"AMD".equals(text)) {
                    throw new MalformedFieldException("modifier", text, "report status keyword out of place");
                }
                ReportModifier modifier = ReportHeaders.consumeModifier(cursor, token);
                if (modifier != ReportModifier.AMENDMENTS_NOT_SCHEDULED) {
                    throw new MalformedFieldException("modifier", text, "report status keyword out of place");
                }
                group.modifiers.add(modifier);
            }
            default -> throw unrecognized(text);
        }
    }

    // ------------------------------------------------------------------------
    // Wind
    // ------------------------------------------------------------------------

    static Wind parseWind(String text, String field) {
        Matcher m = WIND.matcher(text);
        if (!m.matches()) {
            throw new MalformedFieldException(field, text, "expected dddff[Gfmfm]KT");
        }
        SpeedUnit unit = SpeedUnit.fromSuffix(m.group(4)).orElseThrow();

        OptionalInt direction = OptionalInt.empty();
        if (!"VRB".equals(m.group(1))) {
            int degrees = Integer.parseInt(m.group(1));
            if (degrees > 360) {
                throw new MalformedFieldException(field, text, "direction " + degrees + " exceeds 360 degrees");
            }
            direction = OptionalInt.of(degrees);
        }

        int speed = unit.toKnots(Integer.parseInt(m.group(2)));
        OptionalInt gust = (m.group(3) == null)
                ? OptionalInt.empty()
                : OptionalInt.of(unit.toKnots(Integer.parseInt(m.group(3))));

        return new Wind(direction, speed, gust, Optional.empty(), unit);
    }

    private static Wind withVariation(Wind wind, String text, DefectLog defects) {
        Matcher m = WIND_VARIATION.matcher(text);
        if (!m.matches()) {
            defects.record("wind variation", text, "expected dddVddd");
            return wind;
        }
        int from = Integer.parseInt(m.group(1));
        int to = Integer.parseInt(m.group(2));
        try {
            return wind.withVariableBetween(new DirectionRange(from, to));
        }
        catch (IllegalArgumentException e) {
            defects.record("wind variation", text, "direction exceeds 360 degrees");
            return wind;
        }
    }

    private static WindShear parseWindShear(String text) {
        Matcher m = WIND_SHEAR.matcher(text);
        if (!m.matches()) {
            throw new MalformedFieldException("wind shear", text, "expected WShhh/dddffKT");
        }
        int heightFeet = Integer.parseInt(m.group(1)) * 100;
        Wind wind = parseWind(m.group(2), "wind shear");
        return new WindShear(heightFeet, wind);
    }

    // ------------------------------------------------------------------------
    // Visibility
    // ------------------------------------------------------------------------

    private static void setVisibility(FieldGroup group, Visibility visibility, String text) {
        if (group.visibility != null) {
            throw duplicate("visibility", text);
        }
        group.visibility = visibility;
    }

    private static Visibility parseVisibility(String text) {
        if (text.endsWith("SM")) {
            return parseStatuteMiles(text);
        }
        if (text.endsWith("+")) {
            String figure = text.substring(0, text.length() - 1);
            return new Visibility.Distance(Integer.parseInt(figure), Visibility.DistanceUnit.STATUTE_MILES,
                    Visibility.Bound.OR_MORE, figure);
        }
        int meters = Integer.parseInt(text);
        if (meters == 9999) {
            return new Visibility.Distance(10_000, Visibility.DistanceUnit.METERS, Visibility.Bound.OR_MORE, text);
        }
        return new Visibility.Distance(meters, Visibility.DistanceUnit.METERS, Visibility.Bound.EXACT, text);
    }

    private static Visibility parseStatuteMiles(String text) {
        Matcher m = STATUTE_MILES.matcher(text);
        if (!m.matches()) {
            throw new MalformedFieldException("visibility", text, "expected statute-mile visibility");
        }
        Visibility.Bound bound = Visibility.Bound.EXACT;
        if ("P".equals(m.group(1))) {
            bound = Visibility.Bound.MORE_THAN;
        } else if ("M".equals(m.group(1))) {
            bound = Visibility.Bound.LESS_THAN;
        }

        if (m.group(2) != null) {
            return new Visibility.Distance(Integer.parseInt(m.group(2)), Visibility.DistanceUnit.STATUTE_MILES,
                    bound, m.group(2));
        }
        String figure = m.group(3) + "/" + m.group(4);
        return new Visibility.Distance(fraction(m.group(3), m.group(4), text), Visibility.DistanceUnit.STATUTE_MILES,
                bound, figure);
    }

    private static Visibility parseMixedMiles(String whole, String fractionToken, String combined) {
        String fraction = fractionToken.substring(0, fractionToken.length() - 2);
        int slash = fraction.indexOf('/');
        double value = Integer.parseInt(whole)
                + fraction(fraction.substring(0, slash), fraction.substring(slash + 1), combined);
        return new Visibility.Distance(value, Visibility.DistanceUnit.STATUTE_MILES, Visibility.Bound.EXACT,
                whole + " " + fraction);
    }

    private static double fraction(String numerator, String denominator, String text) {
        int d = Integer.parseInt(denominator);
        if (d == 0) {
            throw new MalformedFieldException("visibility", text, "zero denominator");
        }
        return Integer.parseInt(numerator) / (double) d;
    }

    // ------------------------------------------------------------------------
    // Weather and clouds
    // ------------------------------------------------------------------------

    private static WeatherPhenomenon parseWeather(String text) {
        Matcher m = WEATHER_PARTS.matcher(text);
        if (!m.matches()) {
            throw new MalformedFieldException("weather", text, "expected [intensity][descriptor]phenomenon");
        }
        List<String> phenomena = new ArrayList<>();
        String codes = m.group(3);
        for (int i = 0; i < codes.length(); i += 2) {
            phenomena.add(codes.substring(i, i + 2));
        }
        return new WeatherPhenomenon(
                WeatherPhenomenon.Intensity.fromPrefix(m.group(1)),
                Optional.ofNullable(m.group(2)),
                phenomena,
                text
        );
    }

    private static CloudLayer parseCloud(String text) {
        Matcher m = CLOUD.matcher(text);
        if (!m.matches()) {
            throw new MalformedFieldException("cloud", text, "expected {FEW|SCT|BKN|OVC|VV}hhh");
        }
        CloudCoverage coverage = CloudCoverage.fromCode(m.group(1)).orElseThrow();
        OptionalInt height = "///".equals(m.group(2))
                ? OptionalInt.empty()
                : OptionalInt.of(Integer.parseInt(m.group(2)) * 100);
        Optional<CloudLayer.ConvectiveCloud> convective = Optional.ofNullable(m.group(3))
                .map(CloudLayer.ConvectiveCloud::valueOf);
        return new CloudLayer(coverage, height, convective);
    }

    // ------------------------------------------------------------------------
    // Temperature and pressure
    // ------------------------------------------------------------------------

    private static TemperatureDewpoint parseTemperature(String text) {
        Matcher m = TEMPERATURE.matcher(text);
        if (!m.matches()) {
            throw new MalformedFieldException("temperature", text, "expected [M]TT/[M]TdTd");
        }
        return new TemperatureDewpoint(signed(m.group(1), m.group(2)), signed(m.group(3), m.group(4)));
    }

    private static Altimeter parseAltimeter(String text) {
        int value = Integer.parseInt(text.substring(1));
        return text.charAt(0) == Altimeter.PressureUnit.HECTOPASCALS.prefix()
                ? Altimeter.hectopascals(value)
                : Altimeter.inchesOfMercuryHundredths(value);
    }

    private static Altimeter parsePressureForecast(String text) {
        Matcher m = PRESSURE_FORECAST.matcher(text);
        if (!m.matches()) {
            throw new MalformedFieldException("pressure forecast", text, "expected QNHnnnnINS");
        }
        return Altimeter.inchesOfMercuryHundredths(Integer.parseInt(m.group(1)));
    }

    private static TemperatureExtreme parseTemperatureExtreme(String text) {
        Matcher m = TEMPERATURE_EXTREME.matcher(text);
        if (!m.matches()) {
            throw new MalformedFieldException("temperature forecast", text, "expected TX|TN[M]TT/DDHHZ");
        }
        TemperatureExtreme.Kind kind = "X".equals(m.group(1))
                ? TemperatureExtreme.Kind.MAXIMUM
                : TemperatureExtreme.Kind.MINIMUM;
        try {
            return new TemperatureExtreme(kind, signed(m.group(2), m.group(3)), ReportTimes.parseDayHour(m.group(4)));
        }
        catch (MalformedTimeException e) {
            throw new MalformedFieldException("temperature forecast", text, e.getMessage(), e);
        }
    }

    private static int signed(String minus, String digits) {
        int value = Integer.parseInt(digits);
        return (minus != null) ? -value : value;
    }

    // ------------------------------------------------------------------------
    // Failures
    // ------------------------------------------------------------------------

    private void requireMode(Mode required, String field, String text) {
        if (mode != required) {
            throw new MalformedFieldException(field, text,
                    "not expected in " + (mode == Mode.OBSERVATION ? "an observation" : "a forecast"));
        }
    }

    private static MalformedFieldException duplicate(String field, String text) {
        return new MalformedFieldException(field, text, "duplicate " + field + " group ignored");
    }

    /**
     * Names the field a malformed token was most likely meant for, so that the
     * defect reads "wind 'XXXKT'" rather than a bare "unrecognized".
     */
    private static MalformedFieldException unrecognized(String text) {
        if (WIND_GUESS.matcher(text).matches()) {
            return new MalformedFieldException("wind", text, "expected dddff[Gfmfm]KT");
        }
        if (CLOUD_GUESS.matcher(text).matches()) {
            return new MalformedFieldException("cloud", text, "expected {FEW|SCT|BKN|OVC|VV}hhh");
        }
        if (ALTIMETER_GUESS.matcher(text).matches()) {
            return new MalformedFieldException("altimeter", text, "expected Qnnnn or Annnn");
        }
        if (text.endsWith("SM")) {
            return new MalformedFieldException("visibility", text, "expected statute-mile visibility");
        }
        if (TEMPERATURE_GUESS.matcher(text).matches()) {
            return new MalformedFieldException("temperature", text, "expected [M]TT/[M]TdTd");
        }
        return new MalformedFieldException("unrecognized", text, "group not recognized");
    }
}
