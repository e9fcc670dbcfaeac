package home.powertag.model;

import home.powertag.enums.VoltageMode;

/**
 * Сопряженное устройство из конфигурации, привязывается через powertag.devices[n].*
 */
public class PairedDevice {
    private String address;

    private int port = GatewayEndpoint.DEFAULT_PORT;

    private int unitId;

    private int typeId;

    private VoltageMode voltageMode = VoltageMode.L_N;

    public PairedDevice() {
    }

    public PairedDevice(String address, int port, int unitId, int typeId, VoltageMode voltageMode) {
        this.address = address;
        this.port = port;
        this.unitId = unitId;
        this.typeId = typeId;
        this.voltageMode = voltageMode;
    }

    public GatewayEndpoint getEndpoint() {
        return new GatewayEndpoint(address, port);
    }

    public String getDeviceId() {
        return address + ":" + port + ":" + unitId;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public int getUnitId() {
        return unitId;
    }

    public void setUnitId(int unitId) {
        this.unitId = unitId;
    }

    public int getTypeId() {
        return typeId;
    }

    public void setTypeId(int typeId) {
        this.typeId = typeId;
    }

    public VoltageMode getVoltageMode() {
        return voltageMode;
    }

    public void setVoltageMode(VoltageMode voltageMode) {
        this.voltageMode = voltageMode;
    }

    @Override
    public String toString() {
        return getDeviceId();
    }
}
