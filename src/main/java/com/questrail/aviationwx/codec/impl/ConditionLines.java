package com.questrail.aviationwx.codec.impl;

import com.questrail.aviationwx.model.Altimeter;
import com.questrail.aviationwx.model.CloudLayer;
import com.questrail.aviationwx.model.ForecastConditions;
import com.questrail.aviationwx.model.TemperatureDewpoint;
import com.questrail.aviationwx.model.Visibility;
import com.questrail.aviationwx.model.WeatherPhenomenon;
import com.questrail.aviationwx.model.Wind;
import com.questrail.aviationwx.model.WindShear;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Display text of the individual fields shared by the METAR and TAF formatters.
 */
final class ConditionLines
{
    static final String NOT_REPORTED = "not reported";

    private static final String DEGREE = "\u00B0";

    private static final Map<String, String> WEATHER_CODES = Map.ofEntries(
            Map.entry("DZ", "Drizzle"),
            Map.entry("RA", "Rain"),
            Map.entry("SN", "Snow"),
            Map.entry("SG", "Snow Grains"),
            Map.entry("IC", "Ice Crystals"),
            Map.entry("PL", "Ice Pellets"),
            Map.entry("GR", "Hail"),
            Map.entry("GS", "Small Hail/Snow Pellets"),
            Map.entry("UP", "Unknown Precipitation"),
            Map.entry("BR", "Mist"),
            Map.entry("FG", "Fog"),
            Map.entry("FU", "Smoke"),
            Map.entry("VA", "Volcanic Ash"),
            Map.entry("DU", "Dust"),
            Map.entry("SA", "Sand"),
            Map.entry("HZ", "Haze"),
            Map.entry("PY", "Spray"),
            Map.entry("PO", "Dust/Sand Whirls"),
            Map.entry("SQ", "Squall"),
            Map.entry("FC", "Funnel Cloud"),
            Map.entry("SS", "Sandstorm"),
            Map.entry("DS", "Duststorm"),
            Map.entry("MI", "Shallow"),
            Map.entry("BC", "Patches"),
            Map.entry("PR", "Partial"),
            Map.entry("DR", "Drifting"),
            Map.entry("BL", "Blowing"),
            Map.entry("SH", "Showers"),
            Map.entry("TS", "Thunderstorm"),
            Map.entry("FZ", "Freezing")
    );

    private ConditionLines() {}

    /**
     * Renders the wind / visibility / weather / cloud lines of a field group.
     *
     * @param indent       prefix for every line
     * @param windRequired render {@code Wind: not reported} when the wind is absent
     */
    static List<String> lines(ForecastConditions conditions, String indent, boolean windRequired) {
        List<String> lines = new ArrayList<>();

        if (conditions.wind().isPresent()) {
            lines.add(indent + "Wind: " + wind(conditions.wind().get()));
        } else if (windRequired) {
            lines.add(indent + "Wind: " + NOT_REPORTED);
        }
        conditions.visibility().ifPresent(v -> lines.add(indent + "Visibility: " + visibility(v)));
        if (!conditions.weather().isEmpty()) {
            lines.add(indent + "Weather: " + weather(conditions.weather()));
        }
        for (CloudLayer layer : conditions.cloudLayers()) {
            lines.add(indent + "Cloud Layer: " + cloud(layer));
        }
        conditions.clearSky().ifPresent(c -> lines.add(indent + "Clouds: " + c.label()));
        conditions.windShear().ifPresent(ws -> lines.add(indent + "Wind Shear: " + windShear(ws)));
        return lines;
    }

    static String wind(Wind wind) {
        if (wind.isCalm()) {
            return "Calm";
        }
        StringBuilder sb = new StringBuilder();
        if (wind.isVariable()) {
            sb.append("Variable at ").append(wind.speedKnots()).append(" KT");
        } else {
            sb.append(degrees(wind.directionDegrees().getAsInt()))
              .append(" at ").append(wind.speedKnots()).append(" KT");
        }
        wind.gustKnots().ifPresent(g -> sb.append(" gusting to ").append(g).append(" KT"));
        wind.variableBetween().ifPresent(r -> sb.append(" (varying between ")
                .append(degrees(r.from())).append(" and ").append(degrees(r.to())).append(')'));
        return sb.toString();
    }

    static String visibility(Visibility visibility) {
        if (visibility instanceof Visibility.Cavok) {
            return "CAVOK (ceiling and visibility OK)";
        }
        Visibility.Distance d = (Visibility.Distance) visibility;

        if (d.unit() == Visibility.DistanceUnit.METERS) {
            int meters = (int) d.value();
            if (d.bound() == Visibility.Bound.OR_MORE && meters >= 1000 && meters % 1000 == 0) {
                return (meters / 1000) + " km or more";
            }
            return withBound(meters + " meters", d.bound());
        }
        String unit = (d.value() == 1.0) ? " statute mile" : " statute miles";
        return withBound(d.figure() + unit, d.bound());
    }

    private static String withBound(String distance, Visibility.Bound bound) {
        switch (bound) {
            case OR_MORE:
                return distance + " or more";
            case MORE_THAN:
                return "more than " + distance;
            case LESS_THAN:
                return "less than " + distance;
            default:
                return distance;
        }
    }

    static String weather(List<WeatherPhenomenon> weather) {
        return weather.stream()
                .map(ConditionLines::describe)
                .collect(Collectors.joining(", "));
    }

    private static String describe(WeatherPhenomenon wx) {
        if (wx.isNoSignificantWeather()) {
            return "No significant weather";
        }
        List<String> parts = new ArrayList<>();
        switch (wx.intensity()) {
            case LIGHT -> parts.add("Light");
            case HEAVY -> parts.add("Heavy");
            case VICINITY -> parts.add("In the vicinity");
            default -> { }
        }
        wx.descriptor().ifPresent(d -> parts.add(WEATHER_CODES.getOrDefault(d, d)));
        for (String code : wx.phenomena()) {
            parts.add(WEATHER_CODES.getOrDefault(code, code));
        }
        return String.join(" ", parts);
    }

    static String cloud(CloudLayer layer) {
        StringBuilder sb = new StringBuilder(layer.coverage().label());
        if (layer.heightFeet().isPresent()) {
            sb.append(" at ").append(layer.heightFeet().getAsInt()).append(" feet");
        } else {
            sb.append(" at unknown height");
        }
        layer.convective().ifPresent(c -> sb.append(" (").append(c.label()).append(')'));
        return sb.toString();
    }

    static String windShear(WindShear shear) {
        return "at " + shear.heightFeet() + " feet, " + wind(shear.wind());
    }

    static String temperature(TemperatureDewpoint td) {
        return celsius(td.temperatureCelsius()) + " / " + celsius(td.dewpointCelsius());
    }

    static String celsius(int value) {
        return value + DEGREE + "C";
    }

    static String altimeter(Altimeter altimeter) {
        return altimeter.scaledValue().toPlainString() + " " + altimeter.unit().symbol();
    }

    private static String degrees(int value) {
        return String.format(Locale.ROOT, "%03d", value) + DEGREE;
    }
}
