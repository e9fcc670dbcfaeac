package home.powertag.service;

import home.powertag.exception.ModbusException;

public interface OutputControlService {
    /**
     * Переключение выхода сопряженного модуля Control IO
     *
     * @param deviceId идентификатор address:port:unitId
     * @param on       true - включить, false - выключить
     * @throws ModbusException при ошибке подключения или записи
     */
    void setOutput(String deviceId, boolean on) throws ModbusException;
}
