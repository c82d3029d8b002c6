package com.questrail.aviationwx.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The wind / visibility / weather / cloud field group of a TAF base forecast or change group.
 *
 * <p>For a change group every absent field means "unchanged from the base forecast".</p>
 */
public record ForecastConditions(
        Optional<Wind> wind,
        Optional<Visibility> visibility,
        List<WeatherPhenomenon> weather,
        List<CloudLayer> cloudLayers,
        Optional<ClearSky> clearSky,
        Optional<WindShear> windShear
) {
    public static final ForecastConditions EMPTY = new ForecastConditions(
            Optional.empty(), Optional.empty(), List.of(), List.of(), Optional.empty(), Optional.empty());

    public ForecastConditions {
        Objects.requireNonNull(wind, "wind");
        Objects.requireNonNull(visibility, "visibility");
        weather = List.copyOf(weather);
        cloudLayers = List.copyOf(cloudLayers);
        Objects.requireNonNull(clearSky, "clearSky");
        Objects.requireNonNull(windShear, "windShear");
    }
}
