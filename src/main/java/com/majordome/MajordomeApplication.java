package com.majordome;

import com.majordome.core.AlertReport;
import com.majordome.core.HouseholdAdvisor;
import com.majordome.core.TaskSuggestion;
import com.majordome.spring.EnableMajordome;
import com.majordome.weather.WeatherAlert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.List;

/**
 * Example Spring Boot application printing what the household should do now.
 */
@SpringBootApplication
@EnableMajordome
public class MajordomeApplication {

    private static final Logger log = LoggerFactory.getLogger(MajordomeApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(MajordomeApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(HouseholdAdvisor advisor) {
        return args -> {
            log.info("=== Majordome ===");
            log.info("Context: {}", advisor.currentContext());

            List<TaskSuggestion> suggestions = advisor.suggestions();
            log.info("{} tasks need attention now", suggestions.size());
            for (TaskSuggestion suggestion : suggestions) {
                log.info("[{}] {} / {}: {} ({})", suggestion.score(), suggestion.roomName(),
                        suggestion.taskName(), suggestion.reason(), suggestion.nextDue());
            }

            AlertReport report = advisor.alerts();
            log.info("Weather in {}: {}", report.city(), report.info());
            for (WeatherAlert alert : report.alerts()) {
                log.info("Alert {}: {}", alert.code(), alert.message());
            }
        };
    }
}
