package org.Aayush.tempo.core.time;

import lombok.experimental.UtilityClass;

import java.util.Map;

/**
 * Classifies added or subtracted quantities by the representation arithmetic must anchor to.
 *
 * <p>Fixed-length quantities (raw seconds, {@link java.time.Duration}, spans made only of
 * hours/minutes/seconds) anchor to the UTC instant. Spans carrying any of years, months,
 * weeks or days anchor to the local wall clock.</p>
 */
@UtilityClass
public final class DurationClassifier {

    /**
     * Returns whether a span contains at least one calendar-variable unit.
     *
     * @param span span to classify.
     * @return {@code true} when years, months, weeks or days are present.
     */
    public static boolean isVariableLength(TimeSpan span) {
        if (span == null) {
            return false;
        }
        for (Map.Entry<TimeSpan.Unit, Long> entry : span.parts().entrySet()) {
            if (entry.getKey().variableLength()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns whether an arbitrary quantity is calendar-variable.
     *
     * <p>Only {@link TimeSpan} values can be; numbers and durations are always fixed-length.</p>
     */
    public static boolean isVariableLength(Object quantity) {
        return quantity instanceof TimeSpan && isVariableLength((TimeSpan) quantity);
    }
}
