package com.majordome.task;

import com.majordome.exception.InvalidTaskException;

import java.time.DayOfWeek;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Weekday helpers: token parsing and the 0=Monday..6=Sunday index used by contexts.
 */
public final class Weekdays {

    private static final Map<String, DayOfWeek> TOKENS = new HashMap<>();

    static {
        for (DayOfWeek day : DayOfWeek.values()) {
            String english = day.name().toLowerCase(Locale.ROOT);
            TOKENS.put(english, day);
            TOKENS.put(english.substring(0, 3), day);
        }
        TOKENS.put("lundi", DayOfWeek.MONDAY);
        TOKENS.put("mardi", DayOfWeek.TUESDAY);
        TOKENS.put("mercredi", DayOfWeek.WEDNESDAY);
        TOKENS.put("jeudi", DayOfWeek.THURSDAY);
        TOKENS.put("vendredi", DayOfWeek.FRIDAY);
        TOKENS.put("samedi", DayOfWeek.SATURDAY);
        TOKENS.put("dimanche", DayOfWeek.SUNDAY);
    }

    private Weekdays() {
    }

    /**
     * Parse a weekday token such as "friday", "fri" or "vendredi" (case-insensitive).
     *
     * @throws InvalidTaskException if the token is not a weekday
     */
    public static DayOfWeek parse(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTaskException("Weekday token cannot be blank");
        }
        DayOfWeek day = TOKENS.get(token.trim().toLowerCase(Locale.ROOT));
        if (day == null) {
            throw new InvalidTaskException("Malformed weekday token: '" + token + "'");
        }
        return day;
    }

    /**
     * 0 = Monday .. 6 = Sunday.
     */
    public static int index(DayOfWeek day) {
        return day.getValue() - 1;
    }

    /**
     * Days from {@code currentIndex} until the next occurrence of {@code target}.
     * A zero delta wraps to a full week.
     */
    public static int daysUntil(DayOfWeek target, int currentIndex) {
        int delta = Math.floorMod(index(target) - currentIndex, 7);
        return delta == 0 ? 7 : delta;
    }

    /**
     * Lower-case English name, e.g. "friday".
     */
    public static String displayName(DayOfWeek day) {
        return day.name().toLowerCase(Locale.ROOT);
    }
}
