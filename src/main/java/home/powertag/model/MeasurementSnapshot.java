package home.powertag.model;

import java.time.Instant;

/**
 * Результат одного опроса устройства. Частичных снимков не бывает.
 */
public interface MeasurementSnapshot {
    Instant getPolledAt();
}
