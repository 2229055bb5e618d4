package com.majordome.context;

/**
 * Weather flags and local calendar fields of one evaluation instant.
 * Derived, never stored.
 *
 * @param raining      Precipitation above the rain threshold
 * @param windy        Wind above the wind threshold
 * @param freezing     Minimum temperature below the frost threshold
 * @param weather      Descriptive weather text
 * @param weekdayIndex 0 = Monday .. 6 = Sunday
 * @param hourOfDay    Local hour, 0..23
 * @param month        Local month, 1..12
 */
public record EnvironmentContext(
        boolean raining,
        boolean windy,
        boolean freezing,
        String weather,
        int weekdayIndex,
        int hourOfDay,
        int month
) {
    public EnvironmentContext {
        if (weekdayIndex < 0 || weekdayIndex > 6) {
            throw new IllegalArgumentException("weekdayIndex must be within 0..6: " + weekdayIndex);
        }
        if (hourOfDay < 0 || hourOfDay > 23) {
            throw new IllegalArgumentException("hourOfDay must be within 0..23: " + hourOfDay);
        }
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("month must be within 1..12: " + month);
        }
    }
}
