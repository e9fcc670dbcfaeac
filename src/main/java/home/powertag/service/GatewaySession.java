package home.powertag.service;

import home.powertag.exception.RegisterAccessException;
import home.powertag.model.GatewayEndpoint;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Одно TCP соединение со шлюзом. Все запросы идут на unit id, выставленный последним вызовом
 * {@link #setUnitId(int)}; unit id фиксируется в момент постановки запроса, поэтому его смена
 * не влияет на уже поставленные запросы. Транзакции уходят в провод строго по очереди.
 */
public interface GatewaySession extends AutoCloseable {
    int FUNCTION_READ_HOLDING_REGISTERS = 3;

    int FUNCTION_WRITE_SINGLE_REGISTER = 6;

    /* потолок протокола на одно чтение */
    int MAX_REGISTERS_PER_READ = 125;

    GatewayEndpoint getEndpoint();

    /**
     * Выставляет unit id для последующих запросов, без обмена по сети
     */
    void setUnitId(int unitId);

    int getUnitId();

    /**
     * Ставит в очередь чтение holding регистров (F03) и не ждет ответа
     *
     * @param startRegister первый регистр (с нуля)
     * @param count         количество регистров, не больше 125
     * @param timeoutMs     таймаут ответа
     * @return буфер big-endian, по 2 байта на регистр; при ошибке future завершается
     * {@link RegisterAccessException}
     */
    CompletableFuture<byte[]> submitReadHoldingRegisters(int startRegister, int count, int timeoutMs);

    /**
     * Запись одного регистра (F06)
     */
    void writeSingleRegister(int register, int value, int timeoutMs) throws RegisterAccessException;

    /**
     * Закрывает соединение, повторный вызов ничего не делает
     */
    @Override
    void close();

    /**
     * Чтение holding регистров (F03) с ожиданием ответа
     */
    default byte[] readHoldingRegisters(int startRegister, int count, int timeoutMs)
        throws RegisterAccessException {
        return await(submitReadHoldingRegisters(startRegister, count, timeoutMs), getUnitId(), startRegister);
    }

    /**
     * Дожидается результата запроса и разворачивает причину ошибки
     */
    static <T> T await(CompletableFuture<T> future, int unitId, int register) throws RegisterAccessException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RegisterAccessException) {
                throw (RegisterAccessException) cause;
            }
            throw RegisterAccessException.io(FUNCTION_READ_HOLDING_REGISTERS, unitId, register, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw RegisterAccessException.io(FUNCTION_READ_HOLDING_REGISTERS, unitId, register, e);
        }
    }
}
