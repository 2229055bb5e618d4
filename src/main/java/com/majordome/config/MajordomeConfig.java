package com.majordome.config;

/**
 * Root configuration for Majordome.
 *
 * @param household   Household location and time zone
 * @param weather     Weather thresholds and provider settings
 * @param ranking     Ranking window
 * @param catalogPath Household description to import at startup, may be null
 */
public record MajordomeConfig(
        HouseholdConfig household,
        WeatherConfig weather,
        RankingConfig ranking,
        String catalogPath
) {
    /**
     * Create a minimal configuration for testing.
     */
    public static MajordomeConfig minimal() {
        return new MajordomeConfig(
                HouseholdConfig.defaults(),
                WeatherConfig.defaults(),
                RankingConfig.defaults(),
                null
        );
    }
}
