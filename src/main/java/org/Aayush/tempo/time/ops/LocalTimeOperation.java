package org.Aayush.tempo.time.ops;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.function.Function;

/**
 * Named operation over local wall-clock fields that a zoned time forwards to its local time.
 *
 * <p>Results that are {@link LocalDateTime}s or {@link LocalTimeRange}s are re-wrapped into
 * the caller's zone; any other result is handed back as is.</p>
 */
public interface LocalTimeOperation {

    /**
     * Returns stable operation identifier.
     */
    String id();

    /**
     * Applies the operation.
     *
     * @param local wall-clock fields of the receiver.
     * @return operation result.
     * @throws UnsupportedOperationException when the operation does not apply to {@code local}.
     */
    Object apply(LocalDateTime local);

    /**
     * Creates an operation from a function.
     */
    static LocalTimeOperation of(String id, Function<LocalDateTime, ?> function) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(function, "function");
        return new LocalTimeOperation() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public Object apply(LocalDateTime local) {
                return function.apply(local);
            }
        };
    }
}
