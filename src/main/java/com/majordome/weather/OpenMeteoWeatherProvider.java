package com.majordome.weather;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.majordome.config.WeatherConfig;
import com.majordome.context.WeatherSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Optional;

/**
 * WeatherProvider backed by the Open-Meteo daily forecast API.
 *
 * <p>One request per call, bounded by the configured timeout. Any failure
 * (transport, non-2xx status, unparseable body) is logged and yields an empty result,
 * so callers fall back to fair weather.
 */
public class OpenMeteoWeatherProvider implements WeatherProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenMeteoWeatherProvider.class);

    static final String DAILY_FIELDS =
            "temperature_2m_min,temperature_2m_max,windspeed_10m_max,precipitation_sum";

    private final String baseUrl;
    private final ZoneId zone;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public OpenMeteoWeatherProvider(WeatherConfig config, ZoneId zone) {
        this.baseUrl = config.baseUrl();
        this.zone = zone;
        this.timeout = Duration.ofSeconds(config.timeoutSeconds());
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public Optional<WeatherSummary> fetchDailySummary(double latitude, double longitude) {
        URI uri = forecastUri(latitude, longitude);
        try {
            HttpRequest request = HttpRequest.newBuilder(uri)
                    .timeout(timeout)
                    .header("Accept", "application/json")
                    .GET()
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                log.warn("Weather request {} failed with HTTP {}", uri, response.statusCode());
                return Optional.empty();
            }
            return parse(response.body());
        } catch (IOException e) {
            log.warn("Weather request {} failed: {}", uri, e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Weather request {} interrupted", uri);
            return Optional.empty();
        }
    }

    URI forecastUri(double latitude, double longitude) {
        String query = "latitude=" + format(latitude)
                + "&longitude=" + format(longitude)
                + "&daily=" + encode(DAILY_FIELDS)
                + "&forecast_days=1"
                + "&timezone=" + encode(zone.getId());
        return URI.create(baseUrl + "?" + query);
    }

    /**
     * Parse the first day of an Open-Meteo daily forecast body.
     */
    Optional<WeatherSummary> parse(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            log.warn("Unparseable weather response: {}", e.getMessage());
            return Optional.empty();
        }

        JsonNode daily = root != null ? root.get("daily") : null;
        if (daily == null || !daily.isObject()) {
            log.warn("Weather response has no daily section");
            return Optional.empty();
        }

        WeatherSummary summary = new WeatherSummary(
                firstValue(daily, "temperature_2m_min"),
                firstValue(daily, "temperature_2m_max"),
                firstValue(daily, "windspeed_10m_max"),
                firstValue(daily, "precipitation_sum"));
        log.debug("Fetched weather: {}", summary);
        return Optional.of(summary);
    }

    private static Double firstValue(JsonNode daily, String field) {
        JsonNode values = daily.get(field);
        if (values == null || !values.isArray() || values.isEmpty()) {
            return null;
        }
        JsonNode first = values.get(0);
        return first.isNumber() ? first.asDouble() : null;
    }

    private static String format(double coordinate) {
        return String.format(Locale.ROOT, "%.4f", coordinate);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
