package com.majordome.policy;

import com.majordome.context.EnvironmentContext;
import com.majordome.task.Task;
import com.majordome.task.Weekdays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.util.Set;

/**
 * Default implementation of EligibilityEvaluator.
 * <p>
 * Runs a fixed decision sequence; the first step that decides wins:
 * <ol>
 *   <li>sleep gate (inactive task)</li>
 *   <li>night gate (20:00 - 07:00)</li>
 *   <li>winter gate (Dec - Feb, garden work that avoids frost)</li>
 *   <li>weather gates: rain, then wind, then frost</li>
 *   <li>weekday pin (fixed score 1000 on the pinned day)</li>
 *   <li>one-off scoring</li>
 *   <li>recurring scoring by overdue delay</li>
 * </ol>
 */
public class DefaultEligibilityEvaluator implements EligibilityEvaluator {

    private static final Logger log = LoggerFactory.getLogger(DefaultEligibilityEvaluator.class);

    public static final int WEEKDAY_PIN_SCORE = 1000;
    public static final int REACTIVATED_SCORE = 900;
    public static final int HYGIENE_WEIGHT = 10;
    public static final int DELAY_WEIGHT = 5;

    /** Elapsed days assumed for a recurring task with no recorded completion. */
    public static final int NEVER_DONE_ELAPSED_DAYS = 999;

    static final int NIGHT_START_HOUR = 20;
    static final int NIGHT_END_HOUR = 7;

    private static final Set<Integer> WINTER_MONTHS = Set.of(12, 1, 2);

    @Override
    public Verdict evaluate(Task task, Integer daysSinceLastCompletion, EnvironmentContext context) {
        Verdict verdict = decide(task, daysSinceLastCompletion, context);
        log.debug("Task {} '{}': visible={}, score={}, reason={}",
                task.id(), task.name(), verdict.visible(), verdict.score(), verdict.reason());
        return verdict;
    }

    private Verdict decide(Task task, Integer daysSince, EnvironmentContext context) {
        if (!task.active()) {
            return Verdict.hidden(Reason.of(ReasonCode.DORMANT), NextDue.ON_DEMAND);
        }

        if (task.avoidNight() && isNight(context.hourOfDay())) {
            return Verdict.hidden(Reason.of(ReasonCode.NIGHT), NextDue.TOMORROW_MORNING);
        }

        if (WINTER_MONTHS.contains(context.month())
                && task.avoidFrost()
                && task.category().isSeasonalGardenWork()) {
            return Verdict.hidden(Reason.of(ReasonCode.WINTER), NextDue.NEXT_SPRING);
        }

        if (task.avoidRain() && context.raining()) {
            return Verdict.hidden(Reason.of(ReasonCode.RAIN), NextDue.WHEN_CLEAR);
        }
        if (task.avoidWind() && context.windy()) {
            return Verdict.hidden(Reason.of(ReasonCode.WIND), NextDue.WHEN_CLEAR);
        }
        if (task.avoidFrost() && context.freezing()) {
            return Verdict.hidden(Reason.of(ReasonCode.FROST), NextDue.WHEN_CLEAR);
        }

        if (task.targetWeekday() != null) {
            return pinnedVerdict(task.targetWeekday(), context.weekdayIndex());
        }

        if (task.isOneOff()) {
            return oneOffVerdict(task, daysSince);
        }
        return recurringVerdict(task, daysSince);
    }

    private static boolean isNight(int hour) {
        return hour >= NIGHT_START_HOUR || hour < NIGHT_END_HOUR;
    }

    private Verdict pinnedVerdict(DayOfWeek target, int weekdayIndex) {
        if (Weekdays.index(target) != weekdayIndex) {
            return Verdict.hidden(Reason.scheduledFor(target),
                    NextDue.inDays(Weekdays.daysUntil(target, weekdayIndex)));
        }
        return Verdict.visible(WEEKDAY_PIN_SCORE, Reason.of(ReasonCode.WEEKDAY_MATCH), NextDue.TODAY);
    }

    private Verdict oneOffVerdict(Task task, Integer daysSince) {
        if (daysSince == null) {
            return Verdict.visible(baseScore(task), Reason.of(ReasonCode.NEVER_DONE),
                    NextDue.AS_SOON_AS_POSSIBLE);
        }
        // Completed once but awake again: only a manual reactivation produces this state
        return Verdict.visible(REACTIVATED_SCORE, Reason.of(ReasonCode.REACTIVATED), NextDue.NOW);
    }

    private Verdict recurringVerdict(Task task, Integer daysSince) {
        int interval = task.recurrenceIntervalDays();
        if (interval <= 0) {
            throw new IllegalStateException("Recurring task " + task.id() + " has interval " + interval);
        }

        if (daysSince != null && daysSince == 0) {
            return Verdict.hidden(Reason.of(ReasonCode.DONE_TODAY), NextDue.inDays(interval));
        }

        int elapsed = daysSince != null ? daysSince : NEVER_DONE_ELAPSED_DAYS;
        int delay = elapsed - interval;

        if (delay < 0) {
            return Verdict.hidden(Reason.of(ReasonCode.NOT_YET_DUE), NextDue.inDays(-delay));
        }
        // Overflow throws ArithmeticException
        int score = Math.addExact(baseScore(task), Math.multiplyExact(delay, DELAY_WEIGHT));
        return Verdict.visible(score, Reason.overdue(delay), NextDue.NOW);
    }

    private static int baseScore(Task task) {
        return Math.addExact(task.priorityBase(), Math.multiplyExact(task.hygienePriority(), HYGIENE_WEIGHT));
    }
}
