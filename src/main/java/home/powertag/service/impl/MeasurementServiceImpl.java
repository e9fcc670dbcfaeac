package home.powertag.service.impl;

import home.powertag.configuration.ModbusConfiguration;
import home.powertag.exception.ModbusException;
import home.powertag.model.MeasurementSnapshot;
import home.powertag.model.ModelDescriptor;
import home.powertag.model.PairedDevice;
import home.powertag.service.GatewaySession;
import home.powertag.service.GatewaySessionFactory;
import home.powertag.service.MeasurementService;
import home.powertag.service.ModelRegistry;
import home.powertag.service.RegisterReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.CacheConfig;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

@Service
@CacheConfig(cacheNames = {"measurement_cache"})
public class MeasurementServiceImpl implements MeasurementService {
    private static final Logger logger = LoggerFactory.getLogger(MeasurementServiceImpl.class);
    private final GatewaySessionFactory gatewaySessionFactory;
    private final ModelRegistry modelRegistry;
    private final RegisterReader registerReader;
    private final ModbusConfiguration modbusConfiguration;

    public MeasurementServiceImpl(
        GatewaySessionFactory gatewaySessionFactory,
        ModelRegistry modelRegistry,
        RegisterReader registerReader,
        ModbusConfiguration modbusConfiguration
    ) {
        this.gatewaySessionFactory = gatewaySessionFactory;
        this.modelRegistry = modelRegistry;
        this.registerReader = registerReader;
        this.modbusConfiguration = modbusConfiguration;
    }

    @Override
    @Cacheable(key = "#device.deviceId")
    public MeasurementSnapshot poll(PairedDevice device) throws ModbusException {
        ModelDescriptor model = modelRegistry.lookupByTypeId(device.getTypeId())
            .orElseThrow(() -> new ModbusException("Неизвестный тип устройства " + device.getTypeId()));

        logger.debug("Опрос {} ({})", device, model.getName());
        try (GatewaySession session = gatewaySessionFactory.open(device.getEndpoint(),
            modbusConfiguration.getConnectTimeout()
        )) {
            session.setUnitId(device.getUnitId());
            return registerReader.read(session, model, device.getVoltageMode());
        }
    }
}
