package home.powertag.exception;

/**
 * Ошибка чтения (F03) или записи (F06) регистров по конкретному unit id
 */
public class RegisterAccessException extends ModbusException {
    public enum Reason {
        /* нет ответа за отведенное время, основной признак отсутствия устройства */
        TIMEOUT,
        /* шлюз вернул modbus exception */
        EXCEPTION_RESPONSE,
        /* прочие ошибки транспорта */
        IO
    }

    private final Reason reason;

    private final int functionCode;

    private final int unitId;

    private final int register;

    private final int exceptionCode;

    public RegisterAccessException(
        Reason reason,
        int functionCode,
        int unitId,
        int register,
        int exceptionCode,
        Throwable cause
    ) {
        super(describe(reason, functionCode, unitId, register, exceptionCode), cause);
        this.reason = reason;
        this.functionCode = functionCode;
        this.unitId = unitId;
        this.register = register;
        this.exceptionCode = exceptionCode;
    }

    public static RegisterAccessException timeout(int functionCode, int unitId, int register, Throwable cause) {
        return new RegisterAccessException(Reason.TIMEOUT, functionCode, unitId, register, 0, cause);
    }

    public static RegisterAccessException exceptionResponse(
        int functionCode,
        int unitId,
        int register,
        int exceptionCode,
        Throwable cause
    ) {
        return new RegisterAccessException(Reason.EXCEPTION_RESPONSE,
            functionCode,
            unitId,
            register,
            exceptionCode,
            cause
        );
    }

    public static RegisterAccessException io(int functionCode, int unitId, int register, Throwable cause) {
        return new RegisterAccessException(Reason.IO, functionCode, unitId, register, 0, cause);
    }

    private static String describe(Reason reason, int functionCode, int unitId, int register, int exceptionCode) {
        String base = "F0" + functionCode + " unit " + unitId + " register " + register;
        return switch (reason) {
            case TIMEOUT -> base + ": response timeout";
            case EXCEPTION_RESPONSE -> base + ": exception code " + exceptionCode;
            case IO -> base + ": transport error";
        };
    }

    public Reason getReason() {
        return reason;
    }

    public int getFunctionCode() {
        return functionCode;
    }

    public int getUnitId() {
        return unitId;
    }

    public int getRegister() {
        return register;
    }

    /**
     * @return код modbus исключения, 0 если ответ не был исключением
     */
    public int getExceptionCode() {
        return exceptionCode;
    }
}
