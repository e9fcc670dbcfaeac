package home.powertag.service;

import home.powertag.model.MeasurementSnapshot;
import jakarta.annotation.Nullable;

public interface PollingService {
    /**
     * Возвращает последний успешный снимок устройства
     * Если последний опрос завершился ошибкой - возвращает null
     *
     * @param deviceId идентификатор address:port:unitId
     * @return снимок измерений
     */
    @Nullable
    MeasurementSnapshot getLatestSnapshot(String deviceId);

    /**
     * Опрашивает все сопряженные устройства
     */
    void pollAll();
}
