package home.powertag.service.impl;

import home.powertag.configuration.ModbusConfiguration;
import home.powertag.exception.DecodeException;
import home.powertag.exception.RegisterAccessException;
import home.powertag.model.RegisterBlocks;
import home.powertag.service.GatewaySession;
import home.powertag.utils.RegisterCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Чтение идентифицирующих строк устройства, общих для обеих стратегий обнаружения
 */
@Component
public class DeviceNameReader {
    private static final Logger logger = LoggerFactory.getLogger(DeviceNameReader.class);
    private final ModbusConfiguration modbusConfiguration;

    public DeviceNameReader(ModbusConfiguration modbusConfiguration) {
        this.modbusConfiguration = modbusConfiguration;
    }

    /**
     * Имя, заданное пользователем. Регистр поддерживается не всеми шлюзами, поэтому при ошибке
     * возвращаем пустую строку.
     */
    public String readDeviceNameOrEmpty(GatewaySession session) {
        try {
            byte[] buffer = session.readHoldingRegisters(RegisterBlocks.DEVICE_NAME,
                RegisterBlocks.DEVICE_NAME_LENGTH,
                modbusConfiguration.getReadTimeout()
            );
            return RegisterCodec.decodeFixedAscii(buffer);
        } catch (RegisterAccessException | DecodeException e) {
            logger.debug("Unit {}: имя устройства не прочитано ({})", session.getUnitId(), e.getMessage());
            return "";
        }
    }

    public String readCommercialReference(GatewaySession session) throws RegisterAccessException {
        byte[] buffer = session.readHoldingRegisters(RegisterBlocks.COMMERCIAL_REFERENCE,
            RegisterBlocks.COMMERCIAL_REFERENCE_LENGTH,
            modbusConfiguration.getReadTimeout()
        );
        return RegisterCodec.decodeFixedAscii(buffer);
    }

    public int readDeviceType(GatewaySession session) throws RegisterAccessException {
        byte[] buffer = session.readHoldingRegisters(RegisterBlocks.DEVICE_TYPE, 1, modbusConfiguration.getReadTimeout());
        return RegisterCodec.decodeUInt16BE(buffer, 0);
    }
}
