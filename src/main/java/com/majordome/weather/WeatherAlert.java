package com.majordome.weather;

/**
 * An advisory derived from the day's forecast.
 *
 * @param code    Advisory kind
 * @param message What the household should do
 */
public record WeatherAlert(
        AlertCode code,
        String message
) {
}
