package com.majordome.weather;

import com.majordome.config.WeatherConfig;
import com.majordome.context.WeatherSummary;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a forecast into household advisories. Thresholds are inclusive.
 */
public class WeatherAlertAdvisor {

    private final WeatherConfig config;

    public WeatherAlertAdvisor(WeatherConfig config) {
        this.config = config;
    }

    public List<WeatherAlert> advise(WeatherSummary weather) {
        List<WeatherAlert> alerts = new ArrayList<>();
        if (weather == null) {
            return alerts;
        }

        if (weather.minTempC() != null && weather.minTempC() <= config.frostAlertC()) {
            alerts.add(new WeatherAlert(AlertCode.FROST,
                    "Bring in or protect frost-sensitive plants."));
        }
        if (weather.maxWindKmh() != null && weather.maxWindKmh() >= config.windAlertKmh()) {
            alerts.add(new WeatherAlert(AlertCode.WIND,
                    "Stow anything loose in the garden and put the car in the garage."));
        }
        if (weather.precipitationMm() != null && weather.precipitationMm() >= config.rainAlertMm()) {
            alerts.add(new WeatherAlert(AlertCode.HEAVY_RAIN,
                    "Check the gutters and avoid hanging laundry outside."));
        }
        if (weather.maxTempC() != null && weather.maxTempC() >= config.heatAlertC()) {
            alerts.add(new WeatherAlert(AlertCode.HEAT,
                    "Close sun-exposed shutters in the afternoon to keep the house cool."));
        }
        return alerts;
    }
}
