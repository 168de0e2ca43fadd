package org.Aayush.tempo.core.time;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("TimeSpan Tests")
class TimeSpanTest {

    @Test
    @DisplayName("Zero-amount unit still counts as present")
    void testZeroAmountIsPresent() {
        TimeSpan span = TimeSpan.days(0);
        assertTrue(span.has(TimeSpan.Unit.DAYS));
        assertEquals(0L, span.amount(TimeSpan.Unit.DAYS));
        assertTrue(span.isVariableLength());
        assertFalse(TimeSpan.empty().has(TimeSpan.Unit.DAYS));
    }

    @Test
    @DisplayName("Hours, minutes and seconds fold into fixed seconds")
    void testFixedSeconds() {
        TimeSpan span = TimeSpan.hours(2).and(TimeSpan.Unit.MINUTES, 3).and(TimeSpan.Unit.SECONDS, 4);
        assertEquals(7_384L, span.fixedSeconds());
        assertFalse(span.isVariableLength());
    }

    @Test
    @DisplayName("Calendar units are ignored by fixed seconds")
    void testFixedSecondsIgnoresCalendarUnits() {
        TimeSpan span = TimeSpan.days(3).and(TimeSpan.Unit.HOURS, 1);
        assertEquals(3_600L, span.fixedSeconds());
        assertTrue(span.isVariableLength());
    }

    @Test
    @DisplayName("and() accumulates into an existing unit")
    void testAndAccumulates() {
        TimeSpan span = TimeSpan.minutes(10).and(TimeSpan.Unit.MINUTES, 5);
        assertEquals(15L, span.amount(TimeSpan.Unit.MINUTES));
    }

    @Test
    @DisplayName("plus() merges unit-wise")
    void testPlusMerges() {
        TimeSpan merged = TimeSpan.months(1).and(TimeSpan.Unit.HOURS, 2).plus(TimeSpan.hours(3));
        assertEquals(1L, merged.amount(TimeSpan.Unit.MONTHS));
        assertEquals(5L, merged.amount(TimeSpan.Unit.HOURS));
    }

    @Test
    @DisplayName("negated() flips signs and keeps units present")
    void testNegated() {
        TimeSpan span = TimeSpan.years(1).and(TimeSpan.Unit.DAYS, 0).and(TimeSpan.Unit.SECONDS, -5);
        TimeSpan negated = span.negated();
        assertEquals(-1L, negated.amount(TimeSpan.Unit.YEARS));
        assertTrue(negated.has(TimeSpan.Unit.DAYS));
        assertEquals(5L, negated.amount(TimeSpan.Unit.SECONDS));
        assertEquals(span, negated.negated());
    }

    @Test
    @DisplayName("Parts are ordered from largest unit to smallest")
    void testPartsOrder() {
        TimeSpan span = TimeSpan.seconds(1).and(TimeSpan.Unit.YEARS, 1).and(TimeSpan.Unit.HOURS, 1);
        assertEquals(
                List.of(TimeSpan.Unit.YEARS, TimeSpan.Unit.HOURS, TimeSpan.Unit.SECONDS),
                List.copyOf(span.parts().keySet())
        );
        assertThrows(UnsupportedOperationException.class, () -> span.parts().clear());
    }

    @Test
    @DisplayName("Equality depends on presence, not only magnitude")
    void testEqualityUsesPresence() {
        assertEquals(TimeSpan.hours(1), TimeSpan.hours(1));
        assertNotEquals(TimeSpan.hours(1), TimeSpan.hours(1).and(TimeSpan.Unit.DAYS, 0));
        assertEquals(TimeSpan.hours(1).hashCode(), TimeSpan.of(TimeSpan.Unit.HOURS, 1).hashCode());
    }

    @Test
    @DisplayName("toString renders a readable sentence")
    void testToString() {
        assertEquals("0 seconds", TimeSpan.empty().toString());
        assertEquals("1 day", TimeSpan.days(1).toString());
        assertEquals("1 day and 2 hours", TimeSpan.days(1).and(TimeSpan.Unit.HOURS, 2).toString());
        assertEquals(
                "2 years, 1 month and 30 seconds",
                TimeSpan.years(2).and(TimeSpan.Unit.MONTHS, 1).and(TimeSpan.Unit.SECONDS, 30).toString()
        );
    }

    @Test
    @DisplayName("Null unit is rejected")
    void testNullUnitRejected() {
        assertThrows(NullPointerException.class, () -> TimeSpan.empty().and(null, 1));
    }
}
