package home.powertag.model;

import java.util.Objects;

public final class GatewayEndpoint {
    public static final int DEFAULT_PORT = 502;

    private final String address;

    private final int port;

    public GatewayEndpoint(String address, int port) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("gateway address is empty");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("gateway port out of range: " + port);
        }
        this.address = address.trim();
        this.port = port;
    }

    public String getAddress() {
        return address;
    }

    public int getPort() {
        return port;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        GatewayEndpoint that = (GatewayEndpoint) o;
        return port == that.port && address.equals(that.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(address, port);
    }

    @Override
    public String toString() {
        return address + ":" + port;
    }
}
