package org.Aayush.tempo.zone;

import lombok.experimental.StandardException;

/**
 * Thrown when a local time falls in a zone gap and no period covers it.
 */
@StandardException
public class PeriodNotFoundException extends RuntimeException {
}
