package com.majordome.core;

import com.majordome.config.HouseholdConfig;
import com.majordome.config.MajordomeConfig;
import com.majordome.context.ContextBuilder;
import com.majordome.context.EnvironmentContext;
import com.majordome.context.WeatherSummary;
import com.majordome.exception.MajordomeException;
import com.majordome.exception.RepositoryException;
import com.majordome.policy.ReasonFormatter;
import com.majordome.ranking.RankedItem;
import com.majordome.ranking.Ranker;
import com.majordome.repository.CompletionRecord;
import com.majordome.repository.TaskRepository;
import com.majordome.task.Room;
import com.majordome.task.TaskSnapshot;
import com.majordome.weather.WeatherAlertAdvisor;
import com.majordome.weather.WeatherProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Default implementation of HouseholdAdvisor.
 * Fetches the catalog and the weather, builds the context and hands both to the ranker.
 */
public class DefaultHouseholdAdvisor implements HouseholdAdvisor {

    private static final Logger log = LoggerFactory.getLogger(DefaultHouseholdAdvisor.class);

    private final MajordomeConfig config;
    private final TaskRepository repository;
    private final WeatherProvider weatherProvider;
    private final ContextBuilder contextBuilder;
    private final Ranker ranker;
    private final ReasonFormatter formatter;
    private final WeatherAlertAdvisor alertAdvisor;
    private final Clock clock;

    public DefaultHouseholdAdvisor(MajordomeConfig config,
                                   TaskRepository repository,
                                   WeatherProvider weatherProvider,
                                   ContextBuilder contextBuilder,
                                   Ranker ranker,
                                   ReasonFormatter formatter,
                                   Clock clock) {
        this.config = config;
        this.repository = repository;
        this.weatherProvider = weatherProvider;
        this.contextBuilder = contextBuilder;
        this.ranker = ranker;
        this.formatter = formatter;
        this.alertAdvisor = new WeatherAlertAdvisor(config.weather());
        this.clock = clock;

        log.info("HouseholdAdvisor initialized for '{}' ({})",
                config.household().city(), config.household().zone());
    }

    @Override
    public List<TaskSuggestion> suggestions() {
        List<TaskSnapshot> catalog = readCatalog(repository::fetchCatalog);
        return render(ranker.rank(catalog, currentContext(), config.ranking().defaultLimit()));
    }

    @Override
    public List<TaskSuggestion> suggestions(String roomName) {
        List<TaskSnapshot> catalog = readCatalog(() -> repository.fetchRoom(roomName));
        return render(ranker.rank(catalog, currentContext(), null));
    }

    @Override
    public List<TaskSuggestion> catalog() {
        List<TaskSnapshot> catalog = readCatalog(repository::fetchCatalog);
        return render(ranker.audit(catalog, currentContext()));
    }

    @Override
    public CompletionRecord recordCompletion(long taskId, String performer, String comment) {
        return repository.recordCompletion(taskId, performer, comment);
    }

    @Override
    public CompletionRecord recordCompletion(String roomName, String taskName, String performer, String comment) {
        return repository.recordCompletion(roomName, taskName, performer, comment);
    }

    @Override
    public void setActive(long taskId, boolean active) {
        repository.setActive(taskId, active);
    }

    @Override
    public List<Room> rooms() {
        return readCatalog(repository::rooms);
    }

    @Override
    public AlertReport alerts() {
        HouseholdConfig household = config.household();
        if (!household.hasCoordinates()) {
            return new AlertReport(household.city(), List.of(),
                    "Coordinates missing from the household configuration, cannot fetch the weather.");
        }
        Optional<WeatherSummary> weather = fetchWeather();
        if (weather.isEmpty()) {
            return new AlertReport(household.city(), List.of(), "Weather unavailable.");
        }
        return new AlertReport(household.city(), alertAdvisor.advise(weather.get()), weather.get().describe());
    }

    @Override
    public EnvironmentContext currentContext() {
        return contextBuilder.build(clock.instant(), fetchWeather().orElse(null));
    }

    private Optional<WeatherSummary> fetchWeather() {
        HouseholdConfig household = config.household();
        if (!household.hasCoordinates()) {
            log.debug("No household coordinates, skipping weather lookup");
            return Optional.empty();
        }
        try {
            return weatherProvider.fetchDailySummary(household.latitude(), household.longitude());
        } catch (RuntimeException e) {
            log.warn("Weather provider failed, assuming fair weather", e);
            return Optional.empty();
        }
    }

    private <T> T readCatalog(Supplier<T> read) {
        try {
            return read.get();
        } catch (MajordomeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RepositoryException("Failed to read the task catalog", e);
        }
    }

    private List<TaskSuggestion> render(List<RankedItem> items) {
        return items.stream()
                .map(item -> TaskSuggestion.from(item, formatter))
                .collect(Collectors.toList());
    }
}
