package com.majordome.core;

import com.majordome.weather.WeatherAlert;

import java.util.List;

/**
 * Weather advisories for the household.
 *
 * @param city   Household city
 * @param alerts Advisories for today, possibly empty
 * @param info   Forecast summary, or why no forecast is available
 */
public record AlertReport(
        String city,
        List<WeatherAlert> alerts,
        String info
) {
}
