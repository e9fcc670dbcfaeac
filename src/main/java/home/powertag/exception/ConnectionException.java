package home.powertag.exception;

import home.powertag.model.GatewayEndpoint;

/**
 * Не удалось установить TCP соединение со шлюзом
 */
public class ConnectionException extends ModbusException {
    public enum Reason {
        TIMEOUT,
        REFUSED
    }

    private final GatewayEndpoint endpoint;

    private final Reason reason;

    public ConnectionException(GatewayEndpoint endpoint, Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.endpoint = endpoint;
        this.reason = reason;
    }

    public static ConnectionException timeout(GatewayEndpoint endpoint, Throwable cause) {
        return new ConnectionException(endpoint, Reason.TIMEOUT, "Connection timeout to " + endpoint, cause);
    }

    public static ConnectionException refused(GatewayEndpoint endpoint, Throwable cause) {
        String details = cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : "";
        return new ConnectionException(endpoint, Reason.REFUSED, "Cannot connect to " + endpoint + details, cause);
    }

    public GatewayEndpoint getEndpoint() {
        return endpoint;
    }

    public Reason getReason() {
        return reason;
    }
}
