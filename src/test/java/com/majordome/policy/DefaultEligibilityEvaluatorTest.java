package com.majordome.policy;

import com.majordome.context.EnvironmentContext;
import com.majordome.task.Task;
import com.majordome.task.TaskCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.DayOfWeek;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the eligibility decision sequence:
 * - Sleep, night, winter and weather gates
 * - Weekday pin
 * - One-off and recurring scoring
 */
class DefaultEligibilityEvaluatorTest {

    private static final int MONDAY = 0;
    private static final int THURSDAY = 3;
    private static final int FRIDAY = 4;

    private EligibilityEvaluator evaluator;
    private ReasonFormatter formatter;

    @BeforeEach
    void setUp() {
        evaluator = new DefaultEligibilityEvaluator();
        formatter = EnglishReasonFormatter.INSTANCE;
    }

    // =====================================================================
    // Gates
    // =====================================================================

    @Test
    @DisplayName("Inactive task is dormant whatever its history")
    void inactiveTaskIsDormant() {
        Task task = recurring(7).active(false).build();

        Verdict verdict = evaluator.evaluate(task, 30, daytime());

        assertFalse(verdict.visible());
        assertEquals(ReasonCode.DORMANT, verdict.code());
        assertEquals("dormant one-off task", formatter.format(verdict.reason()));
        assertEquals("on demand", formatter.format(verdict.nextDue()));
    }

    @ParameterizedTest
    @DisplayName("Night gate hides night-averse tasks between 20:00 and 07:00")
    @CsvSource({
            "20, false",
            "23, false",
            "0, false",
            "6, false",
            "7, true",
            "12, true",
            "19, true"
    })
    void nightGate(int hour, boolean expectedVisible) {
        Task task = recurring(7).avoidNight(true).build();

        Verdict verdict = evaluator.evaluate(task, 10, context(MONDAY, hour, 6));

        assertEquals(expectedVisible, verdict.visible());
        if (!expectedVisible) {
            assertEquals(ReasonCode.NIGHT, verdict.code());
            assertEquals("deferred: nighttime", formatter.format(verdict.reason()));
            assertEquals("tomorrow morning", formatter.format(verdict.nextDue()));
        }
    }

    @Test
    @DisplayName("Night does not matter to tasks that do not avoid it")
    void nightIgnoredWithoutFlag() {
        Task task = recurring(7).build();

        assertTrue(evaluator.evaluate(task, 10, context(MONDAY, 23, 6)).visible());
    }

    @ParameterizedTest
    @DisplayName("Winter gate hides frost-averse garden work from December to February")
    @ValueSource(ints = {12, 1, 2})
    void winterGateHidesGardenWork(int month) {
        Task watering = recurring(2).category(TaskCategory.WATERING).avoidFrost(true).build();
        Task mowing = recurring(14).category(TaskCategory.MOWING).avoidFrost(true).build();

        Verdict wateringVerdict = evaluator.evaluate(watering, 5, context(MONDAY, 10, month));
        Verdict mowingVerdict = evaluator.evaluate(mowing, 20, context(MONDAY, 10, month));

        assertEquals(ReasonCode.WINTER, wateringVerdict.code());
        assertEquals(ReasonCode.WINTER, mowingVerdict.code());
        assertEquals("deferred: winter season", formatter.format(wateringVerdict.reason()));
        assertEquals("next spring", formatter.format(wateringVerdict.nextDue()));
    }

    @Test
    @DisplayName("Winter gate needs the frost flag and a garden category")
    void winterGateNeedsFlagAndCategory() {
        Task wateringWithoutFrost = recurring(2).category(TaskCategory.WATERING).build();
        Task otherWithFrost = recurring(2).category(TaskCategory.OTHER).avoidFrost(true).build();

        assertTrue(evaluator.evaluate(wateringWithoutFrost, 5, context(MONDAY, 10, 1)).visible());
        assertTrue(evaluator.evaluate(otherWithFrost, 5, context(MONDAY, 10, 1)).visible());
    }

    @Test
    @DisplayName("Garden work is visible outside winter")
    void gardenWorkVisibleInMarch() {
        Task watering = recurring(2).category(TaskCategory.WATERING).avoidFrost(true).build();

        assertTrue(evaluator.evaluate(watering, 5, context(MONDAY, 10, 3)).visible());
    }

    @Test
    @DisplayName("Rain hides rain-averse task regardless of score inputs")
    void rainGate() {
        Task task = recurring(7).hygienePriority(5).priorityBase(90).avoidRain(true).build();

        Verdict verdict = evaluator.evaluate(task, null, withWeather(daytime(), true, false, false));

        assertFalse(verdict.visible());
        assertEquals(ReasonCode.RAIN, verdict.code());
        assertEquals("deferred: raining", formatter.format(verdict.reason()));
        assertEquals("as soon as it clears", formatter.format(verdict.nextDue()));
    }

    @Test
    @DisplayName("Wind hides wind-averse task")
    void windGate() {
        Task task = recurring(7).avoidWind(true).build();

        Verdict verdict = evaluator.evaluate(task, 10, withWeather(daytime(), false, true, false));

        assertEquals(ReasonCode.WIND, verdict.code());
        assertEquals("deferred: too windy", formatter.format(verdict.reason()));
    }

    @Test
    @DisplayName("Frost risk hides frost-averse task")
    void frostGate() {
        Task task = recurring(7).avoidFrost(true).build();

        Verdict verdict = evaluator.evaluate(task, 10, withWeather(daytime(), false, false, true));

        assertEquals(ReasonCode.FROST, verdict.code());
        assertEquals("deferred: frost risk", formatter.format(verdict.reason()));
    }

    @Test
    @DisplayName("First matching weather gate wins: rain before wind before frost")
    void weatherGateOrder() {
        Task task = recurring(7).avoidRain(true).avoidWind(true).avoidFrost(true).build();

        assertEquals(ReasonCode.RAIN,
                evaluator.evaluate(task, 10, withWeather(daytime(), true, true, true)).code());
        assertEquals(ReasonCode.WIND,
                evaluator.evaluate(task, 10, withWeather(daytime(), false, true, true)).code());
        assertEquals(ReasonCode.FROST,
                evaluator.evaluate(task, 10, withWeather(daytime(), false, false, true)).code());
    }

    @Test
    @DisplayName("Bad weather does not matter to tasks without the matching flag")
    void weatherIgnoredWithoutFlags() {
        Task task = recurring(7).build();

        assertTrue(evaluator.evaluate(task, 10, withWeather(daytime(), true, true, true)).visible());
    }

    @Test
    @DisplayName("Sleep gate comes before the night gate")
    void sleepBeforeNight() {
        Task task = oneOff().avoidNight(true).active(false).build();

        assertEquals(ReasonCode.DORMANT, evaluator.evaluate(task, 3, context(MONDAY, 23, 6)).code());
    }

    // =====================================================================
    // Weekday pin
    // =====================================================================

    @Test
    @DisplayName("Pinned task on its weekday scores 1000")
    void pinnedTaskOnItsDay() {
        Task task = recurring(7).targetWeekdayToken("friday").build();

        Verdict verdict = evaluator.evaluate(task, 2, context(FRIDAY, 10, 3));

        assertTrue(verdict.visible());
        assertEquals(1000, verdict.score());
        assertEquals(ReasonCode.WEEKDAY_MATCH, verdict.code());
        assertEquals("today is the day", formatter.format(verdict.reason()));
        assertEquals("today", formatter.format(verdict.nextDue()));
    }

    @Test
    @DisplayName("Pinned task on another weekday waits for its day")
    void pinnedTaskOnAnotherDay() {
        Task task = recurring(7).targetWeekdayToken("friday").build();

        Verdict verdict = evaluator.evaluate(task, 30, context(THURSDAY, 10, 3));

        assertFalse(verdict.visible());
        assertEquals(ReasonCode.WRONG_WEEKDAY, verdict.code());
        assertEquals(DayOfWeek.FRIDAY, verdict.reason().weekday());
        assertEquals("scheduled for friday", formatter.format(verdict.reason()));
        assertEquals("in 1 days", formatter.format(verdict.nextDue()));
    }

    @ParameterizedTest
    @DisplayName("Days until the pinned weekday wrap around the week")
    @CsvSource({
            "MONDAY, 1, 6",
            "MONDAY, 6, 1",
            "SUNDAY, 0, 6",
            "WEDNESDAY, 4, 5",
            "SATURDAY, 4, 1"
    })
    void daysUntilPinnedWeekday(DayOfWeek target, int todayIndex, int expectedDays) {
        Task task = oneOff().targetWeekday(target).build();

        Verdict verdict = evaluator.evaluate(task, null, context(todayIndex, 10, 3));

        assertEquals(NextDue.inDays(expectedDays), verdict.nextDue());
    }

    @Test
    @DisplayName("Weekday pin takes precedence over interval scoring")
    void pinOverridesInterval() {
        Task task = recurring(7).targetWeekday(DayOfWeek.FRIDAY).build();

        // Done today, would be hidden by the recurring branch
        Verdict verdict = evaluator.evaluate(task, 0, context(FRIDAY, 10, 3));

        assertTrue(verdict.visible());
        assertEquals(1000, verdict.score());
    }

    @Test
    @DisplayName("Weather gates still apply to pinned tasks")
    void weatherGateBeforePin() {
        Task task = recurring(7).targetWeekday(DayOfWeek.FRIDAY).avoidRain(true).build();

        Verdict verdict = evaluator.evaluate(task, 10, withWeather(context(FRIDAY, 10, 3), true, false, false));

        assertEquals(ReasonCode.RAIN, verdict.code());
    }

    // =====================================================================
    // One-off scoring
    // =====================================================================

    @Test
    @DisplayName("Never-done one-off task scores base plus hygiene x 10")
    void neverDoneOneOff() {
        Task task = oneOff().priorityBase(50).hygienePriority(3).build();

        Verdict verdict = evaluator.evaluate(task, null, daytime());

        assertTrue(verdict.visible());
        assertEquals(80, verdict.score());
        assertEquals(ReasonCode.NEVER_DONE, verdict.code());
        assertEquals("never done (one-off)", formatter.format(verdict.reason()));
        assertEquals("as soon as possible", formatter.format(verdict.nextDue()));
    }

    @Test
    @DisplayName("Interval 0 counts as a one-off task")
    void zeroIntervalIsOneOff() {
        Task task = recurring(0).priorityBase(40).hygienePriority(2).build();

        Verdict verdict = evaluator.evaluate(task, null, daytime());

        assertEquals(ReasonCode.NEVER_DONE, verdict.code());
        assertEquals(60, verdict.score());
    }

    @Test
    @DisplayName("Completed one-off task still active is surfaced as reactivated, not as done today")
    void completedActiveOneOffIsReactivated() {
        Task task = oneOff().hygienePriority(4).build();

        Verdict verdict = evaluator.evaluate(task, 0, daytime());

        assertTrue(verdict.visible());
        assertEquals(900, verdict.score());
        assertEquals(ReasonCode.REACTIVATED, verdict.code());
        assertEquals("reactivated one-off task", formatter.format(verdict.reason()));
    }

    // =====================================================================
    // Recurring scoring
    // =====================================================================

    @Test
    @DisplayName("Never-done recurring task is overdue since the sentinel")
    void neverDoneRecurring() {
        Task task = recurring(7).hygienePriority(4).priorityBase(50).build();

        Verdict verdict = evaluator.evaluate(task, null, daytime());

        assertTrue(verdict.visible());
        assertEquals(5050, verdict.score());
        assertEquals(Reason.overdue(992), verdict.reason());
        assertEquals("overdue by 992 days", formatter.format(verdict.reason()));
        assertEquals("now", formatter.format(verdict.nextDue()));
    }

    @Test
    @DisplayName("Recurring task done today is hidden until its next period")
    void doneToday() {
        Task task = recurring(7).build();

        Verdict verdict = evaluator.evaluate(task, 0, daytime());

        assertFalse(verdict.visible());
        assertEquals(ReasonCode.DONE_TODAY, verdict.code());
        assertEquals("already done today", formatter.format(verdict.reason()));
        assertEquals("in 7 days", formatter.format(verdict.nextDue()));
    }

    @Test
    @DisplayName("Delay 0 is visible, delay -1 is not")
    void dueBoundary() {
        Task task = recurring(7).hygienePriority(2).priorityBase(50).build();

        Verdict due = evaluator.evaluate(task, 7, daytime());
        Verdict early = evaluator.evaluate(task, 6, daytime());

        assertTrue(due.visible());
        assertEquals(70, due.score());
        assertEquals("overdue by 0 days", formatter.format(due.reason()));

        assertFalse(early.visible());
        assertEquals(ReasonCode.NOT_YET_DUE, early.code());
        assertEquals("not yet due", formatter.format(early.reason()));
        assertEquals("in 1 days", formatter.format(early.nextDue()));
    }

    @ParameterizedTest
    @DisplayName("Each extra overdue day adds 5 to the score")
    @ValueSource(ints = {1, 2, 10, 100})
    void scoreGrowsWithBacklog(int extraDays) {
        Task task = recurring(14).hygienePriority(3).build();

        int atInterval = evaluator.evaluate(task, 14, daytime()).score();
        int later = evaluator.evaluate(task, 14 + extraDays, daytime()).score();

        assertEquals(5 * extraDays, later - atInterval);
    }

    @Test
    @DisplayName("Score overflow fails instead of wrapping negative")
    void scoreOverflowFails() {
        Task task = recurring(7).hygienePriority(3).build();

        assertThrows(ArithmeticException.class,
                () -> evaluator.evaluate(task, Integer.MAX_VALUE, daytime()));
    }

    @Test
    @DisplayName("Same task and context always give the same verdict")
    void evaluationIsIdempotent() {
        Task task = recurring(3).hygienePriority(4).avoidRain(true).build();
        EnvironmentContext context = daytime();

        assertEquals(evaluator.evaluate(task, 5, context), evaluator.evaluate(task, 5, context));
        assertEquals(evaluator.evaluate(task, null, context), evaluator.evaluate(task, null, context));
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    private static Task.Builder recurring(int interval) {
        return Task.builder()
                .id(1)
                .name("Task")
                .room(1, "Room")
                .recurrenceIntervalDays(interval);
    }

    private static Task.Builder oneOff() {
        return Task.builder()
                .id(2)
                .name("One-off")
                .room(1, "Room");
    }

    private static EnvironmentContext daytime() {
        return context(MONDAY, 10, 6);
    }

    private static EnvironmentContext withWeather(EnvironmentContext base, boolean raining, boolean windy,
                                                  boolean freezing) {
        return new EnvironmentContext(raining, windy, freezing, base.weather(),
                base.weekdayIndex(), base.hourOfDay(), base.month());
    }

    private static EnvironmentContext context(int weekdayIndex, int hour, int month) {
        return new EnvironmentContext(false, false, false, "test", weekdayIndex, hour, month);
    }
}
