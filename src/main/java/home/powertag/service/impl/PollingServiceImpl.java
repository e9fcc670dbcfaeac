package home.powertag.service.impl;

import home.powertag.configuration.PairedDevicesConfiguration;
import home.powertag.enums.ModelFamily;
import home.powertag.event.error.DevicePollErrorEvent;
import home.powertag.exception.ModbusException;
import home.powertag.model.EnergyPollResult;
import home.powertag.model.MeasurementSnapshot;
import home.powertag.model.PairedDevice;
import home.powertag.service.MeasurementService;
import home.powertag.service.ModelRegistry;
import home.powertag.service.PollingService;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;

@Service
public class PollingServiceImpl implements PollingService {
    private static final Logger logger = LoggerFactory.getLogger(PollingServiceImpl.class);
    private final PairedDevicesConfiguration configuration;
    private final MeasurementService measurementService;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Map<String, MeasurementSnapshot> latestSnapshots = new ConcurrentHashMap<>();

    public PollingServiceImpl(
        PairedDevicesConfiguration configuration,
        MeasurementService measurementService,
        ModelRegistry modelRegistry,
        ApplicationEventPublisher applicationEventPublisher,
        MeterRegistry meterRegistry
    ) {
        this.configuration = configuration;
        this.measurementService = measurementService;
        this.applicationEventPublisher = applicationEventPublisher;

        for (PairedDevice device : configuration.getDevices()) {
            boolean energy = modelRegistry.lookupByTypeId(device.getTypeId())
                .map(model -> model.getFamily() == ModelFamily.ENERGY)
                .orElse(false);
            if (!energy) {
                continue;
            }
            Gauge.builder("power_watts", bind(this::getTotalPower, device.getDeviceId()))
                .tag("system", "powertag")
                .tag("component", device.getDeviceId())
                .register(meterRegistry);
            Gauge.builder("energy_kwh", bind(this::getTotalEnergy, device.getDeviceId()))
                .tag("system", "powertag")
                .tag("component", device.getDeviceId())
                .register(meterRegistry);
        }
    }

    private <T, R> Supplier<R> bind(Function<T, R> fn, T val) {
        return () -> fn.apply(val);
    }

    @Scheduled(fixedRateString = "${polling.interval}", initialDelayString = "${polling.initialDelay}")
    private void control() {
        logger.debug("Запущена задача опроса сопряженных устройств");
        pollAll();
    }

    @Override
    public void pollAll() {
        for (PairedDevice device : configuration.getDevices()) {
            poll(device);
        }
    }

    private void poll(PairedDevice device) {
        try {
            latestSnapshots.put(device.getDeviceId(), measurementService.poll(device));
        } catch (ModbusException e) {
            logger.error("{} - ошибка опроса: {}", device, e.getMessage());
            pollFailed(device, e);
        } catch (RuntimeException e) {
            /* например, неверный адрес в настройках устройства */
            logger.error("{} - опрос невозможен", device, e);
            pollFailed(device, e);
        }
    }

    private void pollFailed(PairedDevice device, Exception e) {
        /* снимок с частью устаревших полей хуже, чем отсутствие снимка */
        latestSnapshots.remove(device.getDeviceId());
        logger.debug("Отправляем событие об ошибке опроса {}", device);
        applicationEventPublisher.publishEvent(new DevicePollErrorEvent(this, device, e));
    }

    @Override
    public MeasurementSnapshot getLatestSnapshot(String deviceId) {
        return latestSnapshots.get(deviceId);
    }

    private Double getTotalPower(String deviceId) {
        MeasurementSnapshot snapshot = latestSnapshots.get(deviceId);
        return snapshot instanceof EnergyPollResult ? ((EnergyPollResult) snapshot).getTotalPower() : null;
    }

    private Double getTotalEnergy(String deviceId) {
        MeasurementSnapshot snapshot = latestSnapshots.get(deviceId);
        return snapshot instanceof EnergyPollResult ? ((EnergyPollResult) snapshot).getTotalEnergy() : null;
    }
}
