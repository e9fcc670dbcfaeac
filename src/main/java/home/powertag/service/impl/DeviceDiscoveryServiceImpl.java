package home.powertag.service.impl;

import home.powertag.configuration.DiscoveryConfiguration;
import home.powertag.configuration.ModbusConfiguration;
import home.powertag.enums.DiscoveryStrategy;
import home.powertag.event.info.DiscoveryCompletedEvent;
import home.powertag.exception.ConnectionException;
import home.powertag.exception.DecodeException;
import home.powertag.exception.RegisterAccessException;
import home.powertag.model.DiscoveredDevice;
import home.powertag.model.DiscoveryStatistics;
import home.powertag.model.GatewayEndpoint;
import home.powertag.model.ScanRange;
import home.powertag.service.DeviceDiscoveryService;
import home.powertag.service.GatewaySession;
import home.powertag.service.GatewaySessionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class DeviceDiscoveryServiceImpl implements DeviceDiscoveryService {
    private static final Logger logger = LoggerFactory.getLogger(DeviceDiscoveryServiceImpl.class);
    private final GatewaySessionFactory gatewaySessionFactory;
    private final ModbusConfiguration modbusConfiguration;
    private final DiscoveryConfiguration discoveryConfiguration;
    private final PanelServerDiscovery panelServerDiscovery;
    private final UnitRangeScanner unitRangeScanner;
    private final ApplicationEventPublisher applicationEventPublisher;

    public DeviceDiscoveryServiceImpl(
        GatewaySessionFactory gatewaySessionFactory,
        ModbusConfiguration modbusConfiguration,
        DiscoveryConfiguration discoveryConfiguration,
        PanelServerDiscovery panelServerDiscovery,
        UnitRangeScanner unitRangeScanner,
        ApplicationEventPublisher applicationEventPublisher
    ) {
        this.gatewaySessionFactory = gatewaySessionFactory;
        this.modbusConfiguration = modbusConfiguration;
        this.discoveryConfiguration = discoveryConfiguration;
        this.panelServerDiscovery = panelServerDiscovery;
        this.unitRangeScanner = unitRangeScanner;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @Override
    public List<DiscoveredDevice> discover(GatewayEndpoint endpoint) throws ConnectionException {
        logger.info("Запущено обнаружение устройств на шлюзе {}", endpoint);
        DiscoveryStatistics statistics = new DiscoveryStatistics();

        try (GatewaySession session = gatewaySessionFactory.open(endpoint, modbusConfiguration.getConnectTimeout())) {
            /* Panel Server отвечает быстро, если поддерживается, и одним таймаутом, если нет */
            DiscoveryStrategy strategy = DiscoveryStrategy.PANEL_SERVER;
            List<DiscoveredDevice> devices = new ArrayList<>();
            try {
                devices = panelServerDiscovery.discover(session, statistics);
                logger.info("Обнаружение через Panel Server нашло устройств: {}", devices.size());
            } catch (RegisterAccessException | DecodeException e) {
                logger.info("Таблица адресов Panel Server недоступна ({}), переходим к сканированию Smartlink",
                    e.getMessage());
            }

            if (devices.isEmpty()) {
                strategy = DiscoveryStrategy.RANGE_SCAN;
                devices = scanRanges(session, statistics);
                logger.info("Сканирование Smartlink нашло устройств: {}", devices.size());
            }

            logger.info("Обнаружение на шлюзе {} завершено: найдено {} ({}; {})",
                endpoint,
                devices.size(),
                strategy.getTemplate(),
                statistics
            );
            applicationEventPublisher.publishEvent(
                new DiscoveryCompletedEvent(this, endpoint, strategy, devices, statistics));
            return devices;
        }
    }

    private List<DiscoveredDevice> scanRanges(GatewaySession session, DiscoveryStatistics statistics) {
        /* при пересекающихся диапазонах устройство попадает в результат один раз */
        Map<Integer, DiscoveredDevice> byUnitId = new LinkedHashMap<>();
        for (ScanRange range : discoveryConfiguration.getScanRanges()) {
            for (DiscoveredDevice device : unitRangeScanner.scan(session, range, statistics)) {
                byUnitId.putIfAbsent(device.getUnitId(), device);
            }
        }
        return new ArrayList<>(byUnitId.values());
    }
}
