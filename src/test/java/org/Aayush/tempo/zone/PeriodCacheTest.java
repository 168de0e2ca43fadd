package org.Aayush.tempo.zone;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.zone.ZoneOffsetTransition;
import java.time.zone.ZoneRules;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("PeriodCache Tests")
class PeriodCacheTest {
    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    private static Function<Instant, Period> factoryFor(ZoneId zoneId) {
        ZoneRules rules = zoneId.getRules();
        return utc -> {
            ZoneOffsetTransition previous = rules.previousTransition(utc.plusSeconds(1));
            ZoneOffsetTransition next = rules.nextTransition(utc);
            return Period.of(
                    rules.getOffset(utc).getTotalSeconds(),
                    rules.isDaylightSavings(utc) ? "DST" : "STD",
                    rules.isDaylightSavings(utc),
                    previous == null ? null : previous.getInstant(),
                    next == null ? null : next.getInstant()
            );
        };
    }

    @Test
    @DisplayName("Cache rejects null zone id, null factory and empty capacity")
    void testCacheRejectsInvalidArguments() {
        assertThrows(NullPointerException.class, () -> new PeriodCache(null, factoryFor(ZoneOffset.UTC)));
        assertThrows(NullPointerException.class, () -> new PeriodCache(ZoneOffset.UTC, null));
        assertThrows(IllegalArgumentException.class, () -> new PeriodCache(ZoneOffset.UTC, factoryFor(ZoneOffset.UTC), 0));
    }

    @Test
    @DisplayName("UTC cache always returns zero offset")
    void testUtcPeriodCache() {
        PeriodCache cache = new PeriodCache(ZoneOffset.UTC, factoryFor(ZoneOffset.UTC));
        assertEquals(0, cache.period(Instant.EPOCH).getUtcOffsetSeconds());
        assertEquals(0, cache.period(Instant.ofEpochSecond(1_700_000_000L)).getUtcOffsetSeconds());
        assertEquals(2, cache.cachedDays());
    }

    @Test
    @DisplayName("America/New_York spring-forward day splits into two windows")
    void testSpringForwardPeriodChange() {
        PeriodCache cache = new PeriodCache(NEW_YORK, factoryFor(NEW_YORK));

        Instant before = ZonedDateTime.of(2014, 3, 9, 1, 59, 59, 0, NEW_YORK).toInstant();
        Instant after = ZonedDateTime.of(2014, 3, 9, 3, 0, 0, 0, NEW_YORK).toInstant();
        Instant transition = Instant.parse("2014-03-09T07:00:00Z");

        Period standard = cache.period(before);
        Period daylight = cache.period(after);

        assertEquals(-18_000, standard.getUtcOffsetSeconds());
        assertEquals(transition, standard.getValidUntil());
        assertEquals(-14_400, daylight.getUtcOffsetSeconds());
        assertEquals(transition, daylight.getValidFrom());
        assertEquals(1, cache.cachedDays());
    }

    @Test
    @DisplayName("America/New_York fall-back day splits into two windows")
    void testFallBackPeriodChange() {
        PeriodCache cache = new PeriodCache(NEW_YORK, factoryFor(NEW_YORK));

        Instant transition = Instant.parse("2014-11-02T06:00:00Z");

        assertTrue(cache.period(transition.minusSeconds(1)).isDst());
        assertFalse(cache.period(transition).isDst());
        assertEquals(-18_000, cache.period(transition).getUtcOffsetSeconds());
        assertEquals(transition, cache.period(transition).getValidFrom());
    }

    @Test
    @DisplayName("Same offset in different winters gives different periods")
    void testWindowsDistinguishSameOffset() {
        PeriodCache cache = new PeriodCache(NEW_YORK, factoryFor(NEW_YORK));

        Period january = cache.period(Instant.parse("2014-01-02T06:30:00Z"));
        Period november = cache.period(Instant.parse("2014-11-02T06:30:00Z"));

        assertEquals(january.getUtcOffsetSeconds(), november.getUtcOffsetSeconds());
        assertNotEquals(january, november);
    }

    @Test
    @DisplayName("Lookups on the same day reuse one entry and build periods once per window")
    void testEntryReused() {
        AtomicInteger builds = new AtomicInteger();
        Function<Instant, Period> base = factoryFor(NEW_YORK);
        PeriodCache cache = new PeriodCache(NEW_YORK, utc -> {
            builds.incrementAndGet();
            return base.apply(utc);
        });

        Instant morning = Instant.parse("2007-02-10T08:00:00Z");
        Period first = cache.period(morning);
        Period second = cache.period(morning.plusSeconds(3_600));

        assertSame(first, second);
        assertEquals(1, cache.cachedDays());
        assertEquals(1, builds.get());
    }

    @Test
    @DisplayName("Least recently used day is evicted at capacity")
    void testEvictsLeastRecentlyUsedDay() {
        AtomicInteger builds = new AtomicInteger();
        Function<Instant, Period> base = factoryFor(NEW_YORK);
        PeriodCache cache = new PeriodCache(NEW_YORK, utc -> {
            builds.incrementAndGet();
            return base.apply(utc);
        }, 2);

        Instant dayOne = Instant.parse("2007-02-10T12:00:00Z");
        Instant dayTwo = dayOne.plusSeconds(86_400);
        Instant dayThree = dayTwo.plusSeconds(86_400);

        cache.period(dayOne);
        cache.period(dayTwo);
        cache.period(dayOne);
        cache.period(dayThree);
        assertEquals(2, cache.cachedDays());
        assertEquals(3, builds.get());

        cache.period(dayOne);
        assertEquals(3, builds.get());
        cache.period(dayTwo);
        assertEquals(4, builds.get());
        assertEquals(2, cache.maxCachedDays());
    }

    @Test
    @DisplayName("Factory failures propagate instead of being replaced")
    void testFactoryFailurePropagates() {
        PeriodCache cache = new PeriodCache(NEW_YORK, utc -> {
            throw new DateTimeException("no abbreviation for " + utc);
        });

        DateTimeException ex = assertThrows(DateTimeException.class, () -> cache.period(Instant.EPOCH));
        assertEquals("no abbreviation for 1970-01-01T00:00:00Z", ex.getMessage());
        assertEquals(0, cache.cachedDays());
    }

    @Test
    @DisplayName("Fixed-offset zone remains stable across distant instants")
    void testFixedOffsetZoneStable() {
        ZoneOffset offset = ZoneOffset.ofHoursMinutes(5, 30);
        PeriodCache cache = new PeriodCache(offset, factoryFor(offset));
        Period early = cache.period(Instant.parse("1900-01-01T00:00:00Z"));
        Period late = cache.period(Instant.parse("2400-01-01T00:00:00Z"));
        assertEquals(19_800, early.getUtcOffsetSeconds());
        assertEquals(early, late);
    }
}
