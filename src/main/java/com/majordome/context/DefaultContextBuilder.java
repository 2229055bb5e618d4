package com.majordome.context;

import com.majordome.config.WeatherConfig;
import com.majordome.task.Weekdays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Default implementation of ContextBuilder.
 * Thresholds are strict: rain above 2 mm, wind above 50 km/h, minimum below 2 °C with the defaults.
 */
public class DefaultContextBuilder implements ContextBuilder {

    private static final Logger log = LoggerFactory.getLogger(DefaultContextBuilder.class);

    private final ZoneId zone;
    private final WeatherConfig thresholds;

    public DefaultContextBuilder(ZoneId zone, WeatherConfig thresholds) {
        this.zone = Objects.requireNonNull(zone, "zone cannot be null");
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds cannot be null");
    }

    @Override
    public EnvironmentContext build(Instant now, WeatherSummary weather) {
        ZonedDateTime local = now.atZone(zone);
        int weekdayIndex = Weekdays.index(local.getDayOfWeek());

        if (weather == null) {
            log.debug("No weather summary for {}, assuming fair weather", local);
            return new EnvironmentContext(false, false, false, NO_WEATHER,
                    weekdayIndex, local.getHour(), local.getMonthValue());
        }

        boolean raining = valueOr(weather.precipitationMm(), 0.0) > thresholds.rainThresholdMm();
        boolean windy = valueOr(weather.maxWindKmh(), 0.0) > thresholds.windThresholdKmh();
        boolean freezing = weather.minTempC() != null && weather.minTempC() < thresholds.frostThresholdC();

        EnvironmentContext context = new EnvironmentContext(raining, windy, freezing, weather.describe(),
                weekdayIndex, local.getHour(), local.getMonthValue());
        log.debug("Built context {} from {}", context, weather);
        return context;
    }

    private static double valueOr(Double value, double fallback) {
        return value != null ? value : fallback;
    }
}
