package home.powertag.exception;

/**
 * Буфер регистров не соответствует ожидаемой раскладке - рассинхронизация протокола или ошибка в коде
 */
public class DecodeException extends RuntimeException {
    public DecodeException(String message) {
        super(message);
    }
}
