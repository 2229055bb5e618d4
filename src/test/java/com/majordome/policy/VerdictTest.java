package com.majordome.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.DayOfWeek;

import static org.junit.jupiter.api.Assertions.*;

class VerdictTest {

    // =====================================================================
    // Visibility must agree with the reason
    // =====================================================================

    @Test
    @DisplayName("Visible verdicts need a surfacing reason")
    void visibleNeedsSurfacingReason() {
        assertThrows(IllegalArgumentException.class,
                () -> Verdict.visible(120, Reason.of(ReasonCode.RAIN), NextDue.NOW));
        assertTrue(Verdict.visible(120, Reason.overdue(3), NextDue.NOW).visible());
    }

    @Test
    @DisplayName("Hidden verdicts cannot carry a surfacing reason")
    void hiddenRejectsSurfacingReason() {
        assertThrows(IllegalArgumentException.class,
                () -> Verdict.hidden(Reason.of(ReasonCode.NEVER_DONE), NextDue.AS_SOON_AS_POSSIBLE));

        Verdict hidden = Verdict.hidden(Reason.of(ReasonCode.DONE_TODAY), NextDue.inDays(7));
        assertFalse(hidden.visible());
        assertEquals(0, hidden.score());
    }

    // =====================================================================
    // Parameterized reasons
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Parameterized codes cannot be built without their parameters")
    @EnumSource(value = ReasonCode.class, names = {"OVERDUE", "WRONG_WEEKDAY"})
    void parameterizedCodesNeedFactories(ReasonCode code) {
        assertThrows(IllegalArgumentException.class, () -> Reason.of(code));
    }

    @Test
    @DisplayName("A wrong-weekday reason always names its weekday")
    void wrongWeekdayNeedsWeekday() {
        assertThrows(IllegalArgumentException.class,
                () -> new Reason(ReasonCode.WRONG_WEEKDAY, 0, null));
        assertEquals(DayOfWeek.TUESDAY, Reason.scheduledFor(DayOfWeek.TUESDAY).weekday());
    }
}
