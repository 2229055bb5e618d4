package com.majordome.task;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Named recurrence frequencies accepted in a household description.
 * Each maps to an interval in days; {@link #OCCASIONAL} marks a one-off task.
 */
public enum Frequency {
    DAILY(1, "daily", "quotidienne"),
    SEVERAL_TIMES_A_WEEK(3, "several-times-a-week", "plurihebdomadaire"),
    WEEKLY(7, "weekly", "hebdomadaire"),
    FORTNIGHTLY(14, "fortnightly", "bimensuelle"),
    MONTHLY(30, "monthly", "mensuelle"),
    SEASONAL(90, "seasonal", "saisonniere"),
    OCCASIONAL(null, "occasional", "occasionnelle");

    private final Integer intervalDays;
    private final List<String> tokens;

    Frequency(Integer intervalDays, String... tokens) {
        this.intervalDays = intervalDays;
        this.tokens = List.of(tokens);
    }

    /**
     * Interval in days, empty for a one-off frequency.
     */
    public Optional<Integer> intervalDays() {
        return Optional.ofNullable(intervalDays);
    }

    /**
     * Look up a frequency by token or enum name (case-insensitive).
     */
    public static Optional<Frequency> fromToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        String normalized = token.trim().toLowerCase(Locale.ROOT);
        for (Frequency frequency : values()) {
            if (frequency.tokens.contains(normalized)
                    || frequency.name().equalsIgnoreCase(normalized.replace("-", "_"))) {
                return Optional.of(frequency);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolve the recurrence interval of a task.
     * An explicit interval wins; otherwise the frequency decides. Unknown or missing
     * frequencies resolve to a one-off task (null).
     *
     * @param frequencyToken  Frequency token, may be null
     * @param explicitInterval Interval given directly, may be null
     * @return Interval in days, or null for a one-off task
     */
    public static Integer resolveInterval(String frequencyToken, Integer explicitInterval) {
        if (explicitInterval != null) {
            return explicitInterval;
        }
        return fromToken(frequencyToken)
                .flatMap(Frequency::intervalDays)
                .orElse(null);
    }
}
