package org.Aayush.tempo.zone;

import it.unimi.dsi.fastutil.longs.Long2ObjectLinkedOpenHashMap;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Bounded cache of zone periods keyed by UTC epoch-day.
 *
 * <p>The factory must return the period whose window contains the requested instant. A day's
 * entry holds every period overlapping that day, found by following each window's end to the
 * next period, so transition days are answered without walking the zone rules again. The
 * least recently used day is evicted once {@link #maxCachedDays()} days are held.</p>
 */
public final class PeriodCache {
    public static final int DEFAULT_MAX_CACHED_DAYS = 1_024;

    private static final long SECONDS_PER_DAY = 86_400L;
    private static final int MAX_PERIODS_PER_DAY = 8;

    private final ZoneId zoneId;
    private final Function<Instant, Period> periodFactory;
    private final int maxCachedDays;
    private final Long2ObjectLinkedOpenHashMap<Period[]> periodsByEpochDay = new Long2ObjectLinkedOpenHashMap<>();

    public PeriodCache(ZoneId zoneId, Function<Instant, Period> periodFactory) {
        this(zoneId, periodFactory, DEFAULT_MAX_CACHED_DAYS);
    }

    /**
     * Creates cache for one zone id.
     *
     * @param zoneId zone id whose periods are cached.
     * @param periodFactory builds the period observed at a given instant.
     * @param maxCachedDays number of days kept before eviction.
     */
    public PeriodCache(ZoneId zoneId, Function<Instant, Period> periodFactory, int maxCachedDays) {
        this.zoneId = Objects.requireNonNull(zoneId, "zoneId");
        this.periodFactory = Objects.requireNonNull(periodFactory, "periodFactory");
        if (maxCachedDays <= 0) {
            throw new IllegalArgumentException("maxCachedDays must be > 0");
        }
        this.maxCachedDays = maxCachedDays;
    }

    /**
     * Returns the period observed at the provided instant.
     *
     * @param utc UTC instant.
     * @return observed period.
     */
    public Period period(Instant utc) {
        Objects.requireNonNull(utc, "utc");
        long epochDay = Math.floorDiv(utc.getEpochSecond(), SECONDS_PER_DAY);
        Period[] periods;
        synchronized (periodsByEpochDay) {
            periods = periodsByEpochDay.getAndMoveToFirst(epochDay);
        }
        if (periods == null) {
            periods = periodsOfDay(epochDay);
            synchronized (periodsByEpochDay) {
                periodsByEpochDay.putAndMoveToFirst(epochDay, periods);
                if (periodsByEpochDay.size() > maxCachedDays) {
                    periodsByEpochDay.removeLast();
                }
            }
        }
        for (Period period : periods) {
            if (period.contains(utc)) {
                return period;
            }
        }
        return periods[periods.length - 1];
    }

    /**
     * Returns the number of days currently cached.
     */
    public int cachedDays() {
        synchronized (periodsByEpochDay) {
            return periodsByEpochDay.size();
        }
    }

    public int maxCachedDays() {
        return maxCachedDays;
    }

    public ZoneId zoneId() {
        return zoneId;
    }

    private Period[] periodsOfDay(long epochDay) {
        long dayStart = Math.max(epochDay * SECONDS_PER_DAY, Instant.MIN.getEpochSecond());
        long dayEnd = Math.min(dayStart + SECONDS_PER_DAY, Instant.MAX.getEpochSecond());

        List<Period> periods = new ArrayList<>(2);
        Period current = periodFactory.apply(Instant.ofEpochSecond(dayStart));
        periods.add(current);
        while (current.getValidUntil() != null
                && current.getValidUntil().getEpochSecond() < dayEnd
                && periods.size() < MAX_PERIODS_PER_DAY) {
            current = periodFactory.apply(current.getValidUntil());
            periods.add(current);
        }
        return periods.toArray(new Period[0]);
    }
}
