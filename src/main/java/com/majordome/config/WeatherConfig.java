package com.majordome.config;

/**
 * Weather thresholds and forecast provider settings.
 *
 * @param rainThresholdMm   Raining when precipitation is above this
 * @param windThresholdKmh  Windy when max wind is above this
 * @param frostThresholdC   Freezing when min temperature is below this
 * @param baseUrl           Forecast endpoint
 * @param timeoutSeconds    Connect and request timeout
 * @param frostAlertC       Frost alert when min temperature is at or below this
 * @param windAlertKmh      Wind alert when max wind is at or above this
 * @param rainAlertMm       Heavy rain alert when precipitation is at or above this
 * @param heatAlertC        Heat alert when max temperature is at or above this
 */
public record WeatherConfig(
        double rainThresholdMm,
        double windThresholdKmh,
        double frostThresholdC,
        String baseUrl,
        int timeoutSeconds,
        double frostAlertC,
        double windAlertKmh,
        double rainAlertMm,
        double heatAlertC
) {
    public static final String DEFAULT_BASE_URL = "https://api.open-meteo.com/v1/forecast";

    public static WeatherConfig defaults() {
        return new WeatherConfig(2.0, 50.0, 2.0, DEFAULT_BASE_URL, 5, 0.0, 60.0, 10.0, 28.0);
    }
}
