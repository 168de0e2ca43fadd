package org.Aayush.tempo.zone;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Offset-rule lookup contract for one zone.
 */
public interface TimezoneResolver {

    /**
     * Returns the period observed at a UTC instant. Never ambiguous.
     *
     * @param utc UTC instant.
     * @return observed period.
     */
    Period periodForUtc(Instant utc);

    /**
     * Returns every period a local time could belong to, earliest first.
     *
     * <p>The list is empty for a local time inside a gap, holds one period for a regular local
     * time and two for a local time inside a fold.</p>
     *
     * @param local wall-clock fields.
     * @return candidate periods.
     */
    List<Period> periodsForLocal(LocalDateTime local);

    /**
     * Returns the default period for a local time: the first candidate.
     *
     * @param local wall-clock fields.
     * @return resolved period.
     * @throws PeriodNotFoundException when the local time falls in a gap.
     */
    default Period periodForLocal(LocalDateTime local) {
        List<Period> periods = periodsForLocal(local);
        if (periods.isEmpty()) {
            throw new PeriodNotFoundException("no period for local time " + local);
        }
        return periods.get(0);
    }
}
