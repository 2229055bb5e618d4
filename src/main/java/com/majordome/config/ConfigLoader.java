package com.majordome.config;

import com.majordome.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Map;

/**
 * Loads Majordome configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static MajordomeConfig load(String path) {
        log.info("Loading Majordome configuration from: {}", path);

        try (InputStream inputStream = open(path)) {
            return parseYaml(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Open a path, resolving the classpath: prefix.
     */
    public static InputStream open(String path) throws IOException {
        return getResource(path).getInputStream();
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    static MajordomeConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(inputStream);

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // Sections may sit under a 'majordome' key or at the root
        Map<String, Object> majordome = root.containsKey("majordome")
                ? (Map<String, Object>) root.get("majordome")
                : root;

        HouseholdConfig household = parseHousehold((Map<String, Object>) majordome.get("household"));
        WeatherConfig weather = parseWeather((Map<String, Object>) majordome.get("weather"));
        RankingConfig ranking = parseRanking((Map<String, Object>) majordome.get("ranking"));

        Map<String, Object> catalog = (Map<String, Object>) majordome.get("catalog");
        String catalogPath = catalog != null ? getString(catalog, "path", null) : null;

        MajordomeConfig config = new MajordomeConfig(household, weather, ranking, catalogPath);

        log.info("Loaded Majordome configuration: household '{}' ({}), coordinates {}, default limit {}, catalog {}",
                household.city(), household.zone(), household.hasCoordinates() ? "set" : "missing",
                ranking.defaultLimit(), catalogPath != null ? catalogPath : "none");

        return config;
    }

    private static HouseholdConfig parseHousehold(Map<String, Object> map) {
        if (map == null) {
            log.warn("No household section configured, weather lookups are disabled");
            return HouseholdConfig.defaults();
        }
        String city = getString(map, "city", "Unknown");
        Double latitude = getDouble(map, "latitude");
        Double longitude = getDouble(map, "longitude");
        String zoneId = getString(map, "zone-id", HouseholdConfig.DEFAULT_ZONE.getId());

        ZoneId zone;
        try {
            zone = ZoneId.of(zoneId);
        } catch (DateTimeException e) {
            throw new ConfigurationException("Invalid household zone-id: '" + zoneId + "'", e);
        }

        if (latitude != null && (latitude < -90 || latitude > 90)) {
            throw new ConfigurationException("Household latitude out of range: " + latitude);
        }
        if (longitude != null && (longitude < -180 || longitude > 180)) {
            throw new ConfigurationException("Household longitude out of range: " + longitude);
        }
        return new HouseholdConfig(city, latitude, longitude, zone);
    }

    private static WeatherConfig parseWeather(Map<String, Object> map) {
        WeatherConfig defaults = WeatherConfig.defaults();
        if (map == null) {
            return defaults;
        }
        int timeoutSeconds = getInt(map, "timeout-seconds", defaults.timeoutSeconds());
        if (timeoutSeconds <= 0) {
            throw new ConfigurationException("weather.timeout-seconds must be positive: " + timeoutSeconds);
        }
        return new WeatherConfig(
                getDouble(map, "rain-threshold-mm", defaults.rainThresholdMm()),
                getDouble(map, "wind-threshold-kmh", defaults.windThresholdKmh()),
                getDouble(map, "frost-threshold-c", defaults.frostThresholdC()),
                getString(map, "base-url", defaults.baseUrl()),
                timeoutSeconds,
                getDouble(map, "frost-alert-c", defaults.frostAlertC()),
                getDouble(map, "wind-alert-kmh", defaults.windAlertKmh()),
                getDouble(map, "rain-alert-mm", defaults.rainAlertMm()),
                getDouble(map, "heat-alert-c", defaults.heatAlertC())
        );
    }

    private static RankingConfig parseRanking(Map<String, Object> map) {
        if (map == null) {
            return RankingConfig.defaults();
        }
        int limit = getInt(map, "default-limit", RankingConfig.defaults().defaultLimit());
        if (limit <= 0) {
            throw new ConfigurationException("ranking.default-limit must be positive: " + limit);
        }
        return new RankingConfig(limit);
    }

    // Helper methods

    static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer: " + value, e);
        }
    }

    static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Double value = getDouble(map, key);
        return value != null ? value : defaultValue;
    }

    static Double getDouble(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) return null;
        if (value instanceof Number) return ((Number) value).doubleValue();
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be a number: " + value, e);
        }
    }
}
