package org.Aayush.tempo.core.time;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Immutable sparse quantity of time expressed in calendar and clock units.
 *
 * <p>A unit is part of the span as soon as it is given, even with a zero amount. Presence
 * (not magnitude) decides whether the span is calendar-variable, see {@link DurationClassifier}.</p>
 */
public final class TimeSpan {

    /**
     * Units a span can be expressed in, largest first.
     */
    @Getter
    @Accessors(fluent = true)
    @RequiredArgsConstructor
    public enum Unit {
        YEARS(true, "year"),
        MONTHS(true, "month"),
        WEEKS(true, "week"),
        DAYS(true, "day"),
        HOURS(false, "hour"),
        MINUTES(false, "minute"),
        SECONDS(false, "second");

        /** True when the real-time length of one unit depends on calendar context. */
        private final boolean variableLength;
        /** Singular display name. */
        private final String displayName;
    }

    private static final TimeSpan EMPTY = new TimeSpan(new EnumMap<>(Unit.class));

    private final EnumMap<Unit, Long> parts;

    private TimeSpan(EnumMap<Unit, Long> parts) {
        this.parts = parts;
    }

    /**
     * Returns the span without any unit.
     */
    public static TimeSpan empty() {
        return EMPTY;
    }

    /**
     * Creates a single-unit span.
     *
     * @param unit span unit.
     * @param amount signed amount of {@code unit}.
     * @return new span.
     */
    public static TimeSpan of(Unit unit, long amount) {
        return EMPTY.and(unit, amount);
    }

    public static TimeSpan years(long amount) {
        return of(Unit.YEARS, amount);
    }

    public static TimeSpan months(long amount) {
        return of(Unit.MONTHS, amount);
    }

    public static TimeSpan weeks(long amount) {
        return of(Unit.WEEKS, amount);
    }

    public static TimeSpan days(long amount) {
        return of(Unit.DAYS, amount);
    }

    public static TimeSpan hours(long amount) {
        return of(Unit.HOURS, amount);
    }

    public static TimeSpan minutes(long amount) {
        return of(Unit.MINUTES, amount);
    }

    public static TimeSpan seconds(long amount) {
        return of(Unit.SECONDS, amount);
    }

    /**
     * Returns a span with {@code amount} added to {@code unit}; the unit becomes present.
     */
    public TimeSpan and(Unit unit, long amount) {
        Objects.requireNonNull(unit, "unit");
        EnumMap<Unit, Long> merged = new EnumMap<>(Unit.class);
        merged.putAll(parts);
        merged.merge(unit, amount, Math::addExact);
        return new TimeSpan(merged);
    }

    /**
     * Returns the unit-wise sum of both spans.
     */
    public TimeSpan plus(TimeSpan other) {
        Objects.requireNonNull(other, "other");
        EnumMap<Unit, Long> merged = new EnumMap<>(Unit.class);
        merged.putAll(parts);
        for (Map.Entry<Unit, Long> entry : other.parts.entrySet()) {
            merged.merge(entry.getKey(), entry.getValue(), Math::addExact);
        }
        return new TimeSpan(merged);
    }

    /**
     * Returns the span with every amount negated; present units stay present.
     */
    public TimeSpan negated() {
        EnumMap<Unit, Long> negated = new EnumMap<>(Unit.class);
        for (Map.Entry<Unit, Long> entry : parts.entrySet()) {
            negated.put(entry.getKey(), Math.negateExact(entry.getValue()));
        }
        return new TimeSpan(negated);
    }

    /**
     * Returns the amount of one unit, {@code 0} when absent.
     */
    public long amount(Unit unit) {
        Long amount = parts.get(unit);
        return amount == null ? 0L : amount;
    }

    /**
     * Returns whether the unit was given explicitly.
     */
    public boolean has(Unit unit) {
        return parts.containsKey(unit);
    }

    /**
     * Returns the present units with their amounts, largest unit first.
     */
    public Map<Unit, Long> parts() {
        return Collections.unmodifiableMap(parts);
    }

    /**
     * Returns whether any calendar-variable unit is present.
     */
    public boolean isVariableLength() {
        return DurationClassifier.isVariableLength(this);
    }

    /**
     * Returns hours, minutes and seconds folded into seconds; calendar units are ignored.
     */
    public long fixedSeconds() {
        long seconds = amount(Unit.SECONDS);
        seconds = Math.addExact(seconds, Math.multiplyExact(amount(Unit.MINUTES), TimeUtils.SECONDS_PER_MINUTE));
        return Math.addExact(seconds, Math.multiplyExact(amount(Unit.HOURS), TimeUtils.SECONDS_PER_HOUR));
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TimeSpan)) {
            return false;
        }
        return parts.equals(((TimeSpan) other).parts);
    }

    @Override
    public int hashCode() {
        return parts.hashCode();
    }

    /**
     * Renders the span like {@code 1 day and 2 hours}.
     */
    @Override
    public String toString() {
        if (parts.isEmpty()) {
            return "0 seconds";
        }
        StringJoiner joiner = new StringJoiner(", ");
        int index = 0;
        int size = parts.size();
        StringBuilder last = new StringBuilder();
        for (Map.Entry<Unit, Long> entry : parts.entrySet()) {
            long amount = entry.getValue();
            String rendered = amount + " " + entry.getKey().displayName() + (Math.abs(amount) == 1 ? "" : "s");
            if (size > 1 && index == size - 1) {
                last.append(rendered);
            } else {
                joiner.add(rendered);
            }
            index++;
        }
        return last.length() == 0 ? joiner.toString() : joiner + " and " + last;
    }
}
