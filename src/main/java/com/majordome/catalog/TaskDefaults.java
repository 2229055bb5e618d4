package com.majordome.catalog;

import com.majordome.task.TaskCategory;

import java.util.List;
import java.util.Locale;

/**
 * Defaults inferred from room and task names when a household description leaves them out.
 * Only used at import time; evaluation never looks at names.
 */
public final class TaskDefaults {

    private static final List<String> TRASH_KEYWORDS = List.of(
            "trash", "garbage", "rubbish", "recycl", "waste",
            "poubell", "ordure", "dechet", "déchet");

    private static final List<String> NIGHT_AVOID_KEYWORDS = List.of(
            "window", "garden", "terrace", "garage",
            "vitre", "fenetr", "fenêtre", "jardin", "terrasse");

    private static final List<String> OUTDOOR_ROOM_KEYWORDS = List.of(
            "exterior", "outdoor", "outside", "garden", "terrace", "garage",
            "extérieur", "exter", "jardin", "terrasse");

    private static final List<String> WATERING_KEYWORDS = List.of("watering", "arros");

    private static final List<String> MOWING_KEYWORDS = List.of("mow", "lawn", "tond", "pelouse", "gazon");

    private TaskDefaults() {
    }

    /**
     * Whether a task should avoid the night.
     * Trash runs never do; anything in an outdoor room, or touching windows and outdoor areas, does.
     */
    public static boolean avoidNight(String roomName, String taskName) {
        String room = normalize(roomName);
        String task = normalize(taskName);
        if (containsAny(task, TRASH_KEYWORDS)) {
            return false;
        }
        if (containsAny(room, OUTDOOR_ROOM_KEYWORDS)) {
            return true;
        }
        return containsAny(task, NIGHT_AVOID_KEYWORDS);
    }

    /**
     * Category inferred from the task name.
     */
    public static TaskCategory category(String taskName) {
        String task = normalize(taskName);
        if (containsAny(task, WATERING_KEYWORDS)) {
            return TaskCategory.WATERING;
        }
        if (containsAny(task, MOWING_KEYWORDS)) {
            return TaskCategory.MOWING;
        }
        return TaskCategory.OTHER;
    }

    private static String normalize(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    private static boolean containsAny(String value, List<String> keywords) {
        for (String keyword : keywords) {
            if (value.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
