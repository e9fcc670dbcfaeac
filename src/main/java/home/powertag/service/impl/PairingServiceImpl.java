package home.powertag.service.impl;

import home.powertag.configuration.ModbusConfiguration;
import home.powertag.configuration.PairingConfiguration;
import home.powertag.exception.ConnectionException;
import home.powertag.model.DiscoveredDevice;
import home.powertag.model.GatewayEndpoint;
import home.powertag.service.DeviceDiscoveryService;
import home.powertag.service.GatewaySessionFactory;
import home.powertag.service.PairingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class PairingServiceImpl implements PairingService {
    private static final Logger logger = LoggerFactory.getLogger(PairingServiceImpl.class);
    private final GatewaySessionFactory gatewaySessionFactory;
    private final DeviceDiscoveryService deviceDiscoveryService;
    private final ModbusConfiguration modbusConfiguration;
    private final PairingConfiguration pairingConfiguration;

    public PairingServiceImpl(
        GatewaySessionFactory gatewaySessionFactory,
        DeviceDiscoveryService deviceDiscoveryService,
        ModbusConfiguration modbusConfiguration,
        PairingConfiguration pairingConfiguration
    ) {
        this.gatewaySessionFactory = gatewaySessionFactory;
        this.deviceDiscoveryService = deviceDiscoveryService;
        this.modbusConfiguration = modbusConfiguration;
        this.pairingConfiguration = pairingConfiguration;
    }

    @EventListener({ApplicationReadyEvent.class})
    public void pairOnStartup() {
        if (!pairingConfiguration.isEnabled()) {
            return;
        }
        GatewayEndpoint endpoint = new GatewayEndpoint(pairingConfiguration.getAddress(), pairingConfiguration.getPort());
        try {
            List<DiscoveredDevice> devices = pair(endpoint);
            devices.forEach(device -> logger.info("Доступно для сопряжения: {}", device));
        } catch (ConnectionException e) {
            logger.error("Сопряжение со шлюзом {} не выполнено: {}", endpoint, e.getMessage());
        }
    }

    @Override
    public List<DiscoveredDevice> pair(GatewayEndpoint endpoint) throws ConnectionException {
        logger.info("Проверка шлюза {}", endpoint);
        gatewaySessionFactory.checkConnectivity(endpoint, modbusConfiguration.getValidationTimeout());
        logger.info("Шлюз {} доступен", endpoint);
        return deviceDiscoveryService.discover(endpoint);
    }
}
