package home.powertag.service;

import home.powertag.enums.VoltageMode;
import home.powertag.exception.RegisterAccessException;
import home.powertag.model.Control2DIPollResult;
import home.powertag.model.ControlIOPollResult;
import home.powertag.model.EnergyPollResult;
import home.powertag.model.HeatTagPollResult;
import home.powertag.model.MeasurementSnapshot;
import home.powertag.model.ModelDescriptor;

public interface RegisterReader {
    /**
     * Опрос устройства по набору блоков его семейства. Сессия уже должна быть адресована устройству.
     * Все блоки ставятся в очередь сразу, результат собирается после получения всех ответов;
     * ошибка любого блока - ошибка всего опроса.
     *
     * @param session     сессия с выставленным unit id
     * @param model       модель устройства
     * @param voltageMode режим напряжения, учитывается только для энергосчетчиков
     * @return снимок измерений семейства модели
     */
    MeasurementSnapshot read(GatewaySession session, ModelDescriptor model, VoltageMode voltageMode)
        throws RegisterAccessException;

    EnergyPollResult readEnergy(GatewaySession session, VoltageMode voltageMode) throws RegisterAccessException;

    HeatTagPollResult readHeatTag(GatewaySession session) throws RegisterAccessException;

    Control2DIPollResult readControl2DI(GatewaySession session) throws RegisterAccessException;

    ControlIOPollResult readControlIO(GatewaySession session) throws RegisterAccessException;

    /**
     * Команда выходу Control IO: 2 - включить, 1 - выключить
     */
    void writeOutput(GatewaySession session, boolean on) throws RegisterAccessException;
}
