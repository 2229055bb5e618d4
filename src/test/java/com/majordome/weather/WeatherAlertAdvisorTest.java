package com.majordome.weather;

import com.majordome.config.WeatherConfig;
import com.majordome.context.WeatherSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class WeatherAlertAdvisorTest {

    private final WeatherAlertAdvisor advisor = new WeatherAlertAdvisor(WeatherConfig.defaults());

    @Test
    @DisplayName("Mild weather raises no alert")
    void mildWeather() {
        assertTrue(advisor.advise(new WeatherSummary(8.0, 18.0, 20.0, 1.0)).isEmpty());
    }

    @Test
    @DisplayName("Thresholds are inclusive")
    void inclusiveThresholds() {
        List<AlertCode> codes = codes(new WeatherSummary(0.0, 28.0, 60.0, 10.0));

        assertEquals(List.of(AlertCode.FROST, AlertCode.WIND, AlertCode.HEAVY_RAIN, AlertCode.HEAT), codes);
    }

    @Test
    @DisplayName("Just below thresholds raises nothing")
    void belowThresholds() {
        assertTrue(codes(new WeatherSummary(0.1, 27.9, 59.9, 9.9)).isEmpty());
    }

    @Test
    @DisplayName("Missing values and missing summary raise nothing")
    void missingValues() {
        assertTrue(codes(new WeatherSummary(null, null, null, null)).isEmpty());
        assertTrue(advisor.advise(null).isEmpty());
    }

    private List<AlertCode> codes(WeatherSummary weather) {
        return advisor.advise(weather).stream().map(WeatherAlert::code).collect(Collectors.toList());
    }
}
