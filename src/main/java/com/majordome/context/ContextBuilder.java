package com.majordome.context;

import java.time.Instant;

/**
 * Assembles the evaluation context from the current instant and an optional forecast.
 * Never fails on missing weather: absent values degrade to fair weather.
 */
public interface ContextBuilder {

    String NO_WEATHER = "weather unavailable";

    /**
     * Build the context for an instant.
     *
     * @param now     Evaluation instant
     * @param weather Forecast summary, or null when unavailable
     * @return Evaluation context in the household's local calendar
     */
    EnvironmentContext build(Instant now, WeatherSummary weather);

    /**
     * Build a fair-weather context for an instant.
     */
    default EnvironmentContext build(Instant now) {
        return build(now, null);
    }
}
