package home.powertag.service;

import home.powertag.exception.ModbusException;
import home.powertag.model.MeasurementSnapshot;
import home.powertag.model.PairedDevice;

public interface MeasurementService {
    /**
     * Опрос сопряженного устройства в отдельном соединении. Результат кэшируется на время жизни кэша.
     *
     * @param device сопряженное устройство
     * @return свежий снимок измерений
     * @throws ModbusException при ошибке подключения, неизвестной модели или ошибке чтения любого блока
     */
    MeasurementSnapshot poll(PairedDevice device) throws ModbusException;
}
