package home.powertag.service.impl;

import home.powertag.configuration.ModbusConfiguration;
import home.powertag.configuration.PairedDevicesConfiguration;
import home.powertag.enums.ModelFamily;
import home.powertag.exception.ModbusException;
import home.powertag.model.ModelDescriptor;
import home.powertag.model.PairedDevice;
import home.powertag.service.GatewaySession;
import home.powertag.service.GatewaySessionFactory;
import home.powertag.service.ModelRegistry;
import home.powertag.service.OutputControlService;
import home.powertag.service.RegisterReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class OutputControlServiceImpl implements OutputControlService {
    private static final Logger logger = LoggerFactory.getLogger(OutputControlServiceImpl.class);
    private final PairedDevicesConfiguration configuration;
    private final ModelRegistry modelRegistry;
    private final GatewaySessionFactory gatewaySessionFactory;
    private final RegisterReader registerReader;
    private final ModbusConfiguration modbusConfiguration;

    public OutputControlServiceImpl(
        PairedDevicesConfiguration configuration,
        ModelRegistry modelRegistry,
        GatewaySessionFactory gatewaySessionFactory,
        RegisterReader registerReader,
        ModbusConfiguration modbusConfiguration
    ) {
        this.configuration = configuration;
        this.modelRegistry = modelRegistry;
        this.gatewaySessionFactory = gatewaySessionFactory;
        this.registerReader = registerReader;
        this.modbusConfiguration = modbusConfiguration;
    }

    @Override
    public void setOutput(String deviceId, boolean on) throws ModbusException {
        PairedDevice device = configuration.getDevice(deviceId)
            .orElseThrow(() -> new IllegalArgumentException("Устройство " + deviceId + " не сопряжено"));
        ModelDescriptor model = modelRegistry.lookupByTypeId(device.getTypeId())
            .filter(descriptor -> descriptor.getFamily() == ModelFamily.CONTROL_IO)
            .orElseThrow(() -> new IllegalArgumentException("Устройство " + deviceId + " не имеет выхода"));

        logger.info("{} ({}) - выход {}", deviceId, model.getName(), on ? "включаем" : "выключаем");
        try (GatewaySession session = gatewaySessionFactory.open(device.getEndpoint(),
            modbusConfiguration.getConnectTimeout()
        )) {
            session.setUnitId(device.getUnitId());
            registerReader.writeOutput(session, on);
        }
    }
}
