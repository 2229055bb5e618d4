package com.majordome.task;

import com.majordome.exception.InvalidTaskException;

import java.time.DayOfWeek;

/**
 * Immutable snapshot of a household task with its rule already resolved.
 * <p>
 * Validation happens here, so the evaluator only ever sees well-formed tasks:
 * the recurrence interval and hygiene priority cannot be negative and the name cannot be blank.
 * <p>
 * The {@code active} flag has two roles. For a one-off task it is the awake/asleep flag:
 * completing the task puts it to sleep and only an explicit reactivation wakes it.
 * For a recurring task it simply enables or disables the task.
 *
 * @param id                     Task identifier
 * @param name                   Display name
 * @param roomId                 Owning room identifier
 * @param roomName               Owning room name (used for tie-breaking only)
 * @param recurrenceIntervalDays Interval in days; null or 0 marks a one-off task
 * @param hygienePriority        Hygiene priority, 1-5 by convention
 * @param priorityBase           Rule base priority (50 when no rule exists)
 * @param avoidRain              Defer while raining
 * @param avoidWind              Defer while windy
 * @param avoidSnow              Stored, gates nothing
 * @param avoidFrost             Defer on frost risk and, for garden work, during winter
 * @param avoidNight             Defer between 20:00 and 07:00
 * @param category               Category tag set at creation
 * @param targetWeekday          Weekday pin, or null
 * @param active                 Awake/asleep flag
 */
public record Task(
        long id,
        String name,
        long roomId,
        String roomName,
        Integer recurrenceIntervalDays,
        int hygienePriority,
        int priorityBase,
        boolean avoidRain,
        boolean avoidWind,
        boolean avoidSnow,
        boolean avoidFrost,
        boolean avoidNight,
        TaskCategory category,
        DayOfWeek targetWeekday,
        boolean active
) {
    public Task {
        if (name == null || name.isBlank()) {
            throw new InvalidTaskException("Task " + id + " must have a name");
        }
        if (recurrenceIntervalDays != null && recurrenceIntervalDays < 0) {
            throw new InvalidTaskException("Task '" + name + "' has a negative recurrence interval: "
                    + recurrenceIntervalDays);
        }
        if (hygienePriority < 0) {
            throw new InvalidTaskException("Task '" + name + "' has a negative hygiene priority: "
                    + hygienePriority);
        }
        if (roomName == null) {
            roomName = "";
        }
        if (category == null) {
            category = TaskCategory.OTHER;
        }
    }

    /**
     * One-off tasks have no interval (null or 0).
     */
    public boolean isOneOff() {
        return recurrenceIntervalDays == null || recurrenceIntervalDays == 0;
    }

    /**
     * The rule part of this task.
     */
    public TaskRule rule() {
        return new TaskRule(priorityBase, targetWeekday, active);
    }

    /**
     * Copy of this task with the given rule applied.
     */
    public Task withRule(TaskRule rule) {
        return toBuilder()
                .priorityBase(rule.priorityBase())
                .targetWeekday(rule.targetWeekday())
                .active(rule.active())
                .build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .room(roomId, roomName)
                .recurrenceIntervalDays(recurrenceIntervalDays)
                .hygienePriority(hygienePriority)
                .priorityBase(priorityBase)
                .avoidRain(avoidRain)
                .avoidWind(avoidWind)
                .avoidSnow(avoidSnow)
                .avoidFrost(avoidFrost)
                .avoidNight(avoidNight)
                .category(category)
                .targetWeekday(targetWeekday)
                .active(active);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for Task. Rule fields start at {@link TaskRule#DEFAULT}.
     */
    public static class Builder {
        private long id;
        private String name;
        private long roomId;
        private String roomName;
        private Integer recurrenceIntervalDays;
        private int hygienePriority;
        private int priorityBase = TaskRule.DEFAULT_PRIORITY_BASE;
        private boolean avoidRain;
        private boolean avoidWind;
        private boolean avoidSnow;
        private boolean avoidFrost;
        private boolean avoidNight;
        private TaskCategory category = TaskCategory.OTHER;
        private DayOfWeek targetWeekday;
        private boolean active = true;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder room(long roomId, String roomName) {
            this.roomId = roomId;
            this.roomName = roomName;
            return this;
        }

        public Builder recurrenceIntervalDays(Integer recurrenceIntervalDays) {
            this.recurrenceIntervalDays = recurrenceIntervalDays;
            return this;
        }

        public Builder hygienePriority(int hygienePriority) {
            this.hygienePriority = hygienePriority;
            return this;
        }

        public Builder priorityBase(int priorityBase) {
            this.priorityBase = priorityBase;
            return this;
        }

        public Builder avoidRain(boolean avoidRain) {
            this.avoidRain = avoidRain;
            return this;
        }

        public Builder avoidWind(boolean avoidWind) {
            this.avoidWind = avoidWind;
            return this;
        }

        public Builder avoidSnow(boolean avoidSnow) {
            this.avoidSnow = avoidSnow;
            return this;
        }

        public Builder avoidFrost(boolean avoidFrost) {
            this.avoidFrost = avoidFrost;
            return this;
        }

        public Builder avoidNight(boolean avoidNight) {
            this.avoidNight = avoidNight;
            return this;
        }

        public Builder category(TaskCategory category) {
            this.category = category;
            return this;
        }

        public Builder targetWeekday(DayOfWeek targetWeekday) {
            this.targetWeekday = targetWeekday;
            return this;
        }

        /**
         * Pin to a weekday given as a token ("friday", "vendredi").
         * A null token clears the pin.
         */
        public Builder targetWeekdayToken(String token) {
            this.targetWeekday = token == null ? null : Weekdays.parse(token);
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Task build() {
            return new Task(id, name, roomId, roomName, recurrenceIntervalDays, hygienePriority,
                    priorityBase, avoidRain, avoidWind, avoidSnow, avoidFrost, avoidNight,
                    category, targetWeekday, active);
        }
    }
}
