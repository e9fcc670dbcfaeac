package home.powertag.model;

import home.powertag.enums.AlarmLevel;

import java.time.Instant;

public final class HeatTagPollResult implements MeasurementSnapshot {
    private final double temperature;

    private final double humidityPercent;

    private final int alarmLevelRaw;

    private final Instant polledAt;

    public HeatTagPollResult(double temperature, double humidityPercent, int alarmLevelRaw, Instant polledAt) {
        this.temperature = temperature;
        this.humidityPercent = humidityPercent;
        this.alarmLevelRaw = alarmLevelRaw;
        this.polledAt = polledAt;
    }

    public double getTemperature() {
        return temperature;
    }

    public double getHumidityPercent() {
        return humidityPercent;
    }

    public int getAlarmLevelRaw() {
        return alarmLevelRaw;
    }

    public AlarmLevel getAlarmLevel() {
        return AlarmLevel.fromRegister(alarmLevelRaw);
    }

    @Override
    public Instant getPolledAt() {
        return polledAt;
    }
}
