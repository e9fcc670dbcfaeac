package home.powertag.exception;

/**
 * Базовое исключение протокольного слоя
 */
public class ModbusException extends Exception {
    public ModbusException() {
        super();
    }

    public ModbusException(String message) {
        super(message);
    }

    public ModbusException(String message, Throwable cause) {
        super(message, cause);
    }
}
