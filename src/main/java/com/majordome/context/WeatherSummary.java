package com.majordome.context;

/**
 * One-day forecast summary for the household location.
 * Any value may be null when the provider did not report it.
 *
 * @param minTempC        Minimum temperature in Celsius
 * @param maxTempC        Maximum temperature in Celsius
 * @param maxWindKmh      Maximum wind speed in km/h
 * @param precipitationMm Precipitation sum in millimetres
 */
public record WeatherSummary(
        Double minTempC,
        Double maxTempC,
        Double maxWindKmh,
        Double precipitationMm
) {
    /**
     * Human-readable one-line summary.
     */
    public String describe() {
        return "Tmin=" + minTempC + "°C, Tmax=" + maxTempC + "°C, "
                + "max wind=" + maxWindKmh + " km/h, rain=" + precipitationMm + " mm.";
    }
}
