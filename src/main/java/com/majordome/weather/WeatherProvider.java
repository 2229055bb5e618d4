package com.majordome.weather;

import com.majordome.context.WeatherSummary;

import java.util.Optional;

/**
 * Supplies a one-day forecast summary for a coordinate.
 * Failures are reported as an empty result, never as an exception.
 */
public interface WeatherProvider {

    /**
     * Fetch today's forecast.
     *
     * @param latitude  Latitude in degrees
     * @param longitude Longitude in degrees
     * @return Forecast summary, or empty when unavailable
     */
    Optional<WeatherSummary> fetchDailySummary(double latitude, double longitude);
}
