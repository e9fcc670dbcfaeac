package home.powertag.model;

/**
 * Устройство, найденное за один прогон обнаружения
 */
public final class DiscoveredDevice {
    private final GatewayEndpoint endpoint;

    private final int unitId;

    private final int typeId;

    private final ModelDescriptor model;

    private final String name;

    public DiscoveredDevice(GatewayEndpoint endpoint, int unitId, int typeId, ModelDescriptor model, String name) {
        this.endpoint = endpoint;
        this.unitId = unitId;
        this.typeId = typeId;
        this.model = model;
        this.name = name == null ? "" : name;
    }

    public GatewayEndpoint getEndpoint() {
        return endpoint;
    }

    public int getUnitId() {
        return unitId;
    }

    public int getTypeId() {
        return typeId;
    }

    public ModelDescriptor getModel() {
        return model;
    }

    /**
     * @return имя, заданное пользователем на шлюзе, может быть пустым
     */
    public String getName() {
        return name;
    }

    public String getDeviceId() {
        return endpoint.getAddress() + ":" + endpoint.getPort() + ":" + unitId;
    }

    public String getDisplayName() {
        return name.isEmpty() ? model.getName() + " (" + unitId + ")" : name;
    }

    @Override
    public String toString() {
        return getDisplayName() + " [" + getDeviceId() + ", " + model + "]";
    }
}
