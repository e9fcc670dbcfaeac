package home.powertag.service.impl;

import home.powertag.exception.DecodeException;
import home.powertag.exception.RegisterAccessException;
import home.powertag.model.DiscoveredDevice;
import home.powertag.model.DiscoveryStatistics;
import home.powertag.model.ModelDescriptor;
import home.powertag.model.ScanRange;
import home.powertag.service.GatewaySession;
import home.powertag.service.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Обнаружение в стиле Smartlink: перебор unit id с чтением регистра типа устройства.
 * Адреса устройств идут плотно, поэтому серия таймаутов подряд означает конец заселенных адресов.
 */
@Component
public class UnitRangeScanner {
    private static final Logger logger = LoggerFactory.getLogger(UnitRangeScanner.class);
    private final ModelRegistry modelRegistry;
    private final DeviceNameReader deviceNameReader;

    public UnitRangeScanner(ModelRegistry modelRegistry, DeviceNameReader deviceNameReader) {
        this.modelRegistry = modelRegistry;
        this.deviceNameReader = deviceNameReader;
    }

    public List<DiscoveredDevice> scan(GatewaySession session, ScanRange range, DiscoveryStatistics statistics) {
        List<DiscoveredDevice> devices = new ArrayList<>();
        logger.debug("Сканируем unit id {}", range);

        int consecutiveTimeouts = 0;
        for (int unitId = range.getFrom(); unitId < range.getTo(); unitId++) {
            int typeId;
            try {
                session.setUnitId(unitId);
                typeId = deviceNameReader.readDeviceType(session);
            } catch (RegisterAccessException e) {
                statistics.failedRead();
                consecutiveTimeouts++;
                if (consecutiveTimeouts >= range.getMaxConsecutiveTimeouts()) {
                    logger.debug("Остановка сканирования после {} таймаутов подряд на unit {}",
                        consecutiveTimeouts,
                        unitId
                    );
                    break;
                }
                continue;
            } catch (DecodeException e) {
                logger.warn("Unit {}: не удалось разобрать тип устройства, пропускаем", unitId);
                statistics.failedRead();
                consecutiveTimeouts = 0;
                continue;
            }
            /* ответ получен - серия таймаутов прервана */
            consecutiveTimeouts = 0;

            if (typeId == 0 || typeId == 0xFFFF) {
                statistics.emptyUnit();
                continue;
            }
            logger.debug("Unit {}: typeId={}", unitId, typeId);

            Optional<ModelDescriptor> model = modelRegistry.lookupByTypeId(typeId);
            if (model.isEmpty()) {
                logger.warn("Неизвестный тип устройства {} на unit {}, пропускаем", typeId, unitId);
                statistics.unknownModel();
                continue;
            }

            String name = deviceNameReader.readDeviceNameOrEmpty(session);
            devices.add(new DiscoveredDevice(session.getEndpoint(), unitId, typeId, model.get(), name));
            logger.info("Найден {} на unit {}", model.get().getName(), unitId);
        }
        return devices;
    }
}
