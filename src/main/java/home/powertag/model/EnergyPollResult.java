package home.powertag.model;

import home.powertag.enums.VoltageMode;

import java.time.Instant;

public final class EnergyPollResult implements MeasurementSnapshot {
    private final double currentL1;
    private final double currentL2;
    private final double currentL3;
    private final VoltageMode voltageMode;
    private final double voltagePh1;
    private final double voltagePh2;
    private final double voltagePh3;
    private final double powerL1;
    private final double powerL2;
    private final double powerL3;
    private final double totalPower;
    private final double powerFactor;
    private final double frequency;
    private final double temperature;
    private final double totalEnergy;
    private final Instant polledAt;

    public EnergyPollResult(
        double[] current,
        VoltageMode voltageMode,
        double[] voltage,
        double[] power,
        double powerFactor,
        double frequency,
        double temperature,
        double totalEnergy,
        Instant polledAt
    ) {
        this.currentL1 = current[0];
        this.currentL2 = current[1];
        this.currentL3 = current[2];
        this.voltageMode = voltageMode;
        this.voltagePh1 = voltage[0];
        this.voltagePh2 = voltage[1];
        this.voltagePh3 = voltage[2];
        this.powerL1 = power[0];
        this.powerL2 = power[1];
        this.powerL3 = power[2];
        this.totalPower = power[3];
        this.powerFactor = powerFactor;
        this.frequency = frequency;
        this.temperature = temperature;
        this.totalEnergy = totalEnergy;
        this.polledAt = polledAt;
    }

    public double getCurrentL1() {
        return currentL1;
    }

    public double getCurrentL2() {
        return currentL2;
    }

    public double getCurrentL3() {
        return currentL3;
    }

    public VoltageMode getVoltageMode() {
        return voltageMode;
    }

    public double getVoltagePh1() {
        return voltagePh1;
    }

    public double getVoltagePh2() {
        return voltagePh2;
    }

    public double getVoltagePh3() {
        return voltagePh3;
    }

    public double getPowerL1() {
        return powerL1;
    }

    public double getPowerL2() {
        return powerL2;
    }

    public double getPowerL3() {
        return powerL3;
    }

    public double getTotalPower() {
        return totalPower;
    }

    public double getPowerFactor() {
        return powerFactor;
    }

    public double getFrequency() {
        return frequency;
    }

    public double getTemperature() {
        return temperature;
    }

    /**
     * @return накопленная энергия в kWh
     */
    public double getTotalEnergy() {
        return totalEnergy;
    }

    @Override
    public Instant getPolledAt() {
        return polledAt;
    }
}
