package com.questrail.aviationwx.model;

/**
 * Air temperature and dewpoint in whole degrees Celsius ({@code TT/TdTd}, {@code M} marks negatives).
 */
public record TemperatureDewpoint(int temperatureCelsius, int dewpointCelsius)
{
}
