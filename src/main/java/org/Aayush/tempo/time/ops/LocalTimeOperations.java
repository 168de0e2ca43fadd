package org.Aayush.tempo.time.ops;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Immutable registry of the local-time operations a zoned time forwards to its wall clock.
 *
 * <p>Weeks start on Monday. End-of-period operations land on the last representable
 * nanosecond of the period.</p>
 */
public final class LocalTimeOperations {
    public static final String YEAR = "year";
    public static final String MONTH = "month";
    public static final String DAY = "day";
    public static final String HOUR = "hour";
    public static final String MINUTE = "minute";
    public static final String SECOND = "second";
    public static final String NANOSECOND = "nanosecond";
    public static final String DAY_OF_WEEK = "day_of_week";
    public static final String DAY_OF_YEAR = "day_of_year";
    public static final String LEAP_YEAR = "leap_year";
    public static final String TO_DATE = "to_date";
    public static final String BEGINNING_OF_DAY = "beginning_of_day";
    public static final String MIDDLE_OF_DAY = "middle_of_day";
    public static final String END_OF_DAY = "end_of_day";
    public static final String BEGINNING_OF_HOUR = "beginning_of_hour";
    public static final String END_OF_HOUR = "end_of_hour";
    public static final String BEGINNING_OF_MINUTE = "beginning_of_minute";
    public static final String END_OF_MINUTE = "end_of_minute";
    public static final String BEGINNING_OF_WEEK = "beginning_of_week";
    public static final String END_OF_WEEK = "end_of_week";
    public static final String BEGINNING_OF_MONTH = "beginning_of_month";
    public static final String END_OF_MONTH = "end_of_month";
    public static final String BEGINNING_OF_QUARTER = "beginning_of_quarter";
    public static final String END_OF_QUARTER = "end_of_quarter";
    public static final String BEGINNING_OF_YEAR = "beginning_of_year";
    public static final String END_OF_YEAR = "end_of_year";
    public static final String TOMORROW = "tomorrow";
    public static final String YESTERDAY = "yesterday";
    public static final String ALL_DAY = "all_day";
    public static final String ALL_WEEK = "all_week";
    public static final String ALL_MONTH = "all_month";
    public static final String ALL_QUARTER = "all_quarter";
    public static final String ALL_YEAR = "all_year";

    private static final LocalTimeOperations DEFAULT = new LocalTimeOperations();

    private final Map<String, LocalTimeOperation> operationsById;

    /**
     * Creates a registry with built-in operations only.
     */
    public LocalTimeOperations() {
        this.operationsById = Map.copyOf(materialize(defaultOperations()));
    }

    /**
     * Creates a registry by merging built-ins with custom operations.
     *
     * <p>Custom operation ids override built-ins when ids collide.</p>
     */
    public LocalTimeOperations(Collection<? extends LocalTimeOperation> customOperations) {
        this.operationsById = Map.copyOf(materialize(mergeWithBuiltIns(customOperations)));
    }

    /**
     * Creates an explicit registry from provided operations.
     */
    public LocalTimeOperations(Collection<? extends LocalTimeOperation> operations, boolean includeBuiltIns) {
        Collection<? extends LocalTimeOperation> source = includeBuiltIns ? mergeWithBuiltIns(operations) : operations;
        this.operationsById = Map.copyOf(materialize(source));
    }

    /**
     * Returns operation by id, or {@code null} when not registered.
     */
    public LocalTimeOperation operation(String operationId) {
        if (operationId == null) {
            return null;
        }
        return operationsById.get(operationId);
    }

    /**
     * Returns immutable set of registered operation ids.
     */
    public Set<String> operationIds() {
        return operationsById.keySet();
    }

    /**
     * Returns the shared built-in registry.
     */
    public static LocalTimeOperations defaultRegistry() {
        return DEFAULT;
    }

    private static Collection<LocalTimeOperation> defaultOperations() {
        return List.of(
                op(YEAR, LocalDateTime::getYear),
                op(MONTH, LocalDateTime::getMonthValue),
                op(DAY, LocalDateTime::getDayOfMonth),
                op(HOUR, LocalDateTime::getHour),
                op(MINUTE, LocalDateTime::getMinute),
                op(SECOND, LocalDateTime::getSecond),
                op(NANOSECOND, LocalDateTime::getNano),
                op(DAY_OF_WEEK, LocalDateTime::getDayOfWeek),
                op(DAY_OF_YEAR, LocalDateTime::getDayOfYear),
                op(LEAP_YEAR, local -> local.toLocalDate().isLeapYear()),
                op(TO_DATE, LocalDateTime::toLocalDate),
                op(BEGINNING_OF_DAY, LocalTimeOperations::beginningOfDay),
                op(MIDDLE_OF_DAY, local -> local.toLocalDate().atTime(LocalTime.NOON)),
                op(END_OF_DAY, LocalTimeOperations::endOfDay),
                op(BEGINNING_OF_HOUR, local -> local.truncatedTo(ChronoUnit.HOURS)),
                op(END_OF_HOUR, local -> local.truncatedTo(ChronoUnit.HOURS).plusHours(1).minusNanos(1)),
                op(BEGINNING_OF_MINUTE, local -> local.truncatedTo(ChronoUnit.MINUTES)),
                op(END_OF_MINUTE, local -> local.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1).minusNanos(1)),
                op(BEGINNING_OF_WEEK, LocalTimeOperations::beginningOfWeek),
                op(END_OF_WEEK, LocalTimeOperations::endOfWeek),
                op(BEGINNING_OF_MONTH, LocalTimeOperations::beginningOfMonth),
                op(END_OF_MONTH, LocalTimeOperations::endOfMonth),
                op(BEGINNING_OF_QUARTER, LocalTimeOperations::beginningOfQuarter),
                op(END_OF_QUARTER, LocalTimeOperations::endOfQuarter),
                op(BEGINNING_OF_YEAR, LocalTimeOperations::beginningOfYear),
                op(END_OF_YEAR, LocalTimeOperations::endOfYear),
                op(TOMORROW, local -> local.plusDays(1)),
                op(YESTERDAY, local -> local.minusDays(1)),
                op(ALL_DAY, local -> new LocalTimeRange(beginningOfDay(local), endOfDay(local))),
                op(ALL_WEEK, local -> new LocalTimeRange(beginningOfWeek(local), endOfWeek(local))),
                op(ALL_MONTH, local -> new LocalTimeRange(beginningOfMonth(local), endOfMonth(local))),
                op(ALL_QUARTER, local -> new LocalTimeRange(beginningOfQuarter(local), endOfQuarter(local))),
                op(ALL_YEAR, local -> new LocalTimeRange(beginningOfYear(local), endOfYear(local)))
        );
    }

    private static LocalTimeOperation op(String id, Function<LocalDateTime, ?> function) {
        return LocalTimeOperation.of(id, function);
    }

    private static LocalDateTime beginningOfDay(LocalDateTime local) {
        return local.toLocalDate().atStartOfDay();
    }

    private static LocalDateTime endOfDay(LocalDateTime local) {
        return local.toLocalDate().atTime(LocalTime.MAX);
    }

    private static LocalDateTime beginningOfWeek(LocalDateTime local) {
        return local.toLocalDate().with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).atStartOfDay();
    }

    private static LocalDateTime endOfWeek(LocalDateTime local) {
        return local.toLocalDate().with(TemporalAdjusters.nextOrSame(DayOfWeek.SUNDAY)).atTime(LocalTime.MAX);
    }

    private static LocalDateTime beginningOfMonth(LocalDateTime local) {
        return local.toLocalDate().withDayOfMonth(1).atStartOfDay();
    }

    private static LocalDateTime endOfMonth(LocalDateTime local) {
        return local.toLocalDate().with(TemporalAdjusters.lastDayOfMonth()).atTime(LocalTime.MAX);
    }

    private static LocalDateTime beginningOfQuarter(LocalDateTime local) {
        int firstMonth = (local.getMonthValue() - 1) / 3 * 3 + 1;
        return LocalDate.of(local.getYear(), firstMonth, 1).atStartOfDay();
    }

    private static LocalDateTime endOfQuarter(LocalDateTime local) {
        int lastMonth = (local.getMonthValue() - 1) / 3 * 3 + 3;
        return LocalDate.of(local.getYear(), lastMonth, 1).with(TemporalAdjusters.lastDayOfMonth()).atTime(LocalTime.MAX);
    }

    private static LocalDateTime beginningOfYear(LocalDateTime local) {
        return LocalDate.of(local.getYear(), 1, 1).atStartOfDay();
    }

    private static LocalDateTime endOfYear(LocalDateTime local) {
        return LocalDate.of(local.getYear(), 12, 31).atTime(LocalTime.MAX);
    }

    private static Collection<? extends LocalTimeOperation> mergeWithBuiltIns(
            Collection<? extends LocalTimeOperation> customOperations
    ) {
        LinkedHashMap<String, LocalTimeOperation> merged = new LinkedHashMap<>();
        for (LocalTimeOperation operation : defaultOperations()) {
            merged.put(operation.id(), operation);
        }
        if (customOperations != null) {
            for (LocalTimeOperation operation : customOperations) {
                LocalTimeOperation nonNullOperation = Objects.requireNonNull(operation, "operation");
                merged.put(normalizeRequiredId(nonNullOperation.id(), "operation.id"), nonNullOperation);
            }
        }
        return merged.values();
    }

    private static LinkedHashMap<String, LocalTimeOperation> materialize(
            Collection<? extends LocalTimeOperation> operations
    ) {
        Objects.requireNonNull(operations, "operations");
        LinkedHashMap<String, LocalTimeOperation> map = new LinkedHashMap<>();
        for (LocalTimeOperation operation : operations) {
            LocalTimeOperation nonNullOperation = Objects.requireNonNull(operation, "operation");
            map.put(normalizeRequiredId(nonNullOperation.id(), "operation.id"), nonNullOperation);
        }
        return map;
    }

    private static String normalizeRequiredId(String id, String fieldName) {
        String normalized = Objects.requireNonNull(id, fieldName).trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must be non-blank");
        }
        return normalized;
    }
}
