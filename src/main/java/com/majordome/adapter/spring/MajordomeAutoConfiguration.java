package com.majordome.adapter.spring;

import com.majordome.catalog.CatalogLoader;
import com.majordome.config.ConfigLoader;
import com.majordome.config.MajordomeConfig;
import com.majordome.context.ContextBuilder;
import com.majordome.context.DefaultContextBuilder;
import com.majordome.core.DefaultHouseholdAdvisor;
import com.majordome.core.HouseholdAdvisor;
import com.majordome.policy.DefaultEligibilityEvaluator;
import com.majordome.policy.EligibilityEvaluator;
import com.majordome.policy.EnglishReasonFormatter;
import com.majordome.policy.ReasonFormatter;
import com.majordome.ranking.DefaultRanker;
import com.majordome.ranking.Ranker;
import com.majordome.repository.InMemoryTaskRepository;
import com.majordome.repository.TaskRepository;
import com.majordome.weather.OpenMeteoWeatherProvider;
import com.majordome.weather.WeatherProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring Boot auto-configuration for Majordome.
 */
@Configuration
@ConditionalOnProperty(prefix = "majordome", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(MajordomeProperties.class)
public class MajordomeAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(MajordomeAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public MajordomeConfig majordomeConfig(MajordomeProperties properties) {
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock majordomeClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskRepository taskRepository(MajordomeConfig config, Clock clock) {
        InMemoryTaskRepository repository = new InMemoryTaskRepository(clock, config.household().zone());
        if (config.catalogPath() != null) {
            new CatalogLoader(repository).load(config.catalogPath());
        } else {
            log.info("No household description configured, starting with an empty catalog");
        }
        return repository;
    }

    @Bean
    @ConditionalOnMissingBean
    public WeatherProvider weatherProvider(MajordomeConfig config) {
        return new OpenMeteoWeatherProvider(config.weather(), config.household().zone());
    }

    @Bean
    @ConditionalOnMissingBean
    public ContextBuilder contextBuilder(MajordomeConfig config) {
        return new DefaultContextBuilder(config.household().zone(), config.weather());
    }

    @Bean
    @ConditionalOnMissingBean
    public EligibilityEvaluator eligibilityEvaluator() {
        return new DefaultEligibilityEvaluator();
    }

    @Bean
    @ConditionalOnMissingBean
    public Ranker ranker(EligibilityEvaluator evaluator) {
        return new DefaultRanker(evaluator);
    }

    @Bean
    @ConditionalOnMissingBean
    public ReasonFormatter reasonFormatter() {
        return EnglishReasonFormatter.INSTANCE;
    }

    @Bean
    @ConditionalOnMissingBean
    public HouseholdAdvisor householdAdvisor(MajordomeConfig config,
                                             TaskRepository repository,
                                             WeatherProvider weatherProvider,
                                             ContextBuilder contextBuilder,
                                             Ranker ranker,
                                             ReasonFormatter reasonFormatter,
                                             Clock clock) {
        log.info("Creating HouseholdAdvisor for '{}'", config.household().city());
        return new DefaultHouseholdAdvisor(config, repository, weatherProvider, contextBuilder,
                ranker, reasonFormatter, clock);
    }
}
