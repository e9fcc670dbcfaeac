package home.powertag.model;

import java.time.Instant;

public final class ControlIOPollResult implements MeasurementSnapshot {
    private final boolean di1Status;

    private final boolean outputStatus;

    private final Instant polledAt;

    public ControlIOPollResult(boolean di1Status, boolean outputStatus, Instant polledAt) {
        this.di1Status = di1Status;
        this.outputStatus = outputStatus;
        this.polledAt = polledAt;
    }

    public boolean isDi1Status() {
        return di1Status;
    }

    public boolean isOutputStatus() {
        return outputStatus;
    }

    @Override
    public Instant getPolledAt() {
        return polledAt;
    }
}
