package home.powertag.model;

import java.time.Instant;

public final class Control2DIPollResult implements MeasurementSnapshot {
    private final boolean di1Status;

    private final boolean di2Status;

    private final Instant polledAt;

    public Control2DIPollResult(boolean di1Status, boolean di2Status, Instant polledAt) {
        this.di1Status = di1Status;
        this.di2Status = di2Status;
        this.polledAt = polledAt;
    }

    /**
     * @return true если вход включен
     */
    public boolean isDi1Status() {
        return di1Status;
    }

    public boolean isDi2Status() {
        return di2Status;
    }

    @Override
    public Instant getPolledAt() {
        return polledAt;
    }
}
