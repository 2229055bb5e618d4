package com.majordome.task;

import com.majordome.exception.InvalidTaskException;

import java.util.Locale;

/**
 * Category tag set when a task is created.
 * Seasonal gates look at the category, never at the task's display name.
 */
public enum TaskCategory {
    WATERING,
    MOWING,
    OTHER;

    /**
     * Whether the task is outdoor garden work that stops during winter.
     */
    public boolean isSeasonalGardenWork() {
        return this == WATERING || this == MOWING;
    }

    /**
     * Parse a category token (case-insensitive). Blank means {@link #OTHER}.
     *
     * @throws InvalidTaskException if the token names no category
     */
    public static TaskCategory parse(String token) {
        if (token == null || token.isBlank()) {
            return OTHER;
        }
        try {
            return valueOf(token.trim().toUpperCase(Locale.ROOT).replace("-", "_"));
        } catch (IllegalArgumentException e) {
            throw new InvalidTaskException("Unknown task category: '" + token + "'", e);
        }
    }
}
