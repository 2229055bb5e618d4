package com.majordome.catalog;

import com.majordome.config.ConfigLoader;
import com.majordome.exception.ConfigurationException;
import com.majordome.exception.InvalidTaskException;
import com.majordome.repository.TaskRepository;
import com.majordome.task.Frequency;
import com.majordome.task.Room;
import com.majordome.task.Task;
import com.majordome.task.TaskCategory;
import com.majordome.task.TaskRule;
import com.majordome.task.Weekdays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.time.DayOfWeek;
import java.util.List;
import java.util.Map;

/**
 * Imports a household description (members, rooms and their task zones) from YAML.
 * <p>
 * Imports are upserts: rooms match by name, tasks by room and name.
 * The active flag of an existing task only changes when the description sets it explicitly.
 * Entries without a name are skipped.
 */
public class CatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(CatalogLoader.class);

    static final int DEFAULT_HYGIENE_PRIORITY = 3;

    private final TaskRepository repository;

    public CatalogLoader(TaskRepository repository) {
        this.repository = repository;
    }

    /**
     * Import a description from a path.
     * Supports classpath: prefix for classpath resources.
     */
    public CatalogImportResult load(String path) {
        log.info("Importing household description from: {}", path);
        try (InputStream inputStream = ConfigLoader.open(path)) {
            return load(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read household description from: " + path, e);
        }
    }

    @SuppressWarnings("unchecked")
    public CatalogImportResult load(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(inputStream);
        if (root == null) {
            throw new ConfigurationException("Household description is empty");
        }

        int members = 0;
        List<Map<String, Object>> memberList = (List<Map<String, Object>>) root.get("members");
        if (memberList != null) {
            for (Map<String, Object> member : memberList) {
                String name = getString(member, "name", null);
                if (name == null || name.isBlank()) continue;
                repository.saveMember(name);
                members++;
            }
        }

        int rooms = 0;
        int tasks = 0;
        List<Map<String, Object>> roomList = (List<Map<String, Object>>) root.get("rooms");
        if (roomList != null) {
            for (Map<String, Object> roomMap : roomList) {
                String roomName = getString(roomMap, "name", null);
                if (roomName == null || roomName.isBlank()) continue;

                Room room = repository.saveRoom(new Room(0, roomName,
                        getInteger(roomMap, "area-m2"),
                        getString(roomMap, "floor", null),
                        getString(roomMap, "exposure", null),
                        getString(roomMap, "floor-type", null)));
                rooms++;

                List<Map<String, Object>> zones = (List<Map<String, Object>>) roomMap.get("zones");
                if (zones == null) continue;
                for (Map<String, Object> zone : zones) {
                    if (importZone(room, zone)) {
                        tasks++;
                    }
                }
            }
        }

        CatalogImportResult result = new CatalogImportResult(members, rooms, tasks);
        log.info("Imported household description: {} members, {} rooms, {} tasks",
                result.members(), result.rooms(), result.tasks());
        return result;
    }

    @SuppressWarnings("unchecked")
    private boolean importZone(Room room, Map<String, Object> zone) {
        String name = getString(zone, "name", null);
        if (name == null || name.isBlank()) {
            return false;
        }

        try {
            Integer interval = Frequency.resolveInterval(
                    getString(zone, "frequency", null), getInteger(zone, "interval-days"));
            String categoryToken = getString(zone, "category", null);
            TaskCategory category = categoryToken != null
                    ? TaskCategory.parse(categoryToken)
                    : TaskDefaults.category(name);

            Task draft = Task.builder()
                    .name(name)
                    .room(room.id(), room.name())
                    .recurrenceIntervalDays(interval)
                    .hygienePriority(getInt(zone, "hygiene-priority", DEFAULT_HYGIENE_PRIORITY))
                    .avoidRain(getBoolean(zone, "avoid-rain", false))
                    .avoidWind(getBoolean(zone, "avoid-wind", false))
                    .avoidSnow(getBoolean(zone, "avoid-snow", false))
                    .avoidFrost(getBoolean(zone, "avoid-frost", false))
                    .avoidNight(getBoolean(zone, "avoid-night", TaskDefaults.avoidNight(room.name(), name)))
                    .category(category)
                    .build();

            TaskRule stored = repository.findTask(room.name(), name)
                    .map(Task::rule)
                    .orElse(TaskRule.DEFAULT);
            TaskRule rule = parseRule((Map<String, Object>) zone.get("rule"), stored.active());
            Task task = repository.saveTask(draft, rule);
            log.debug("Imported task {} '{}' in '{}' (interval {}, category {})",
                    task.id(), task.name(), room.name(), interval, category);
            return true;
        } catch (InvalidTaskException e) {
            throw new ConfigurationException("Invalid zone '" + name + "' in room '" + room.name()
                    + "': " + e.getMessage(), e);
        }
    }

    /**
     * Parse a zone rule. A missing {@code active} key keeps the stored flag, so re-importing
     * never wakes a completed one-off task.
     */
    private TaskRule parseRule(Map<String, Object> map, boolean storedActive) {
        if (map == null) {
            return null;
        }
        String weekdayToken = getString(map, "target-weekday", null);
        DayOfWeek weekday = weekdayToken != null ? Weekdays.parse(weekdayToken) : null;
        return new TaskRule(
                getInt(map, "priority-base", TaskRule.DEFAULT_PRIORITY_BASE),
                weekday,
                getBoolean(map, "active", storedActive));
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static Integer getInteger(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) return null;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer: " + value, e);
        }
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Integer value = getInteger(map, key);
        return value != null ? value : defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }
}
