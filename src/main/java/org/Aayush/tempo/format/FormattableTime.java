package org.Aayush.tempo.format;

import org.Aayush.tempo.time.TimeLike;

/**
 * Time value that named formats can render.
 */
public interface FormattableTime extends TimeLike {

    /**
     * Renders a strftime pattern against this value's wall clock.
     */
    String strftime(String pattern);

    /**
     * Renders the UTC offset, or {@code alternateUtc} at offset zero when it is non-null.
     */
    String formattedOffset(boolean colon, String alternateUtc);

    /**
     * Renders ISO 8601 with the given number of fractional second digits.
     */
    String iso8601(int fractionDigits);

    /**
     * Returns the wall-clock day of month.
     */
    int dayOfMonth();
}
