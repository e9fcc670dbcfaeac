package home.powertag.service.impl;

import home.powertag.configuration.ModbusConfiguration;
import home.powertag.exception.DecodeException;
import home.powertag.exception.RegisterAccessException;
import home.powertag.model.DiscoveredDevice;
import home.powertag.model.DiscoveryStatistics;
import home.powertag.model.ModelDescriptor;
import home.powertag.model.RegisterBlocks;
import home.powertag.service.GatewaySession;
import home.powertag.service.ModelRegistry;
import home.powertag.utils.RegisterCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Обнаружение через таблицу адресов Panel Server (PAS600), читаемую с unit 255
 */
@Component
public class PanelServerDiscovery {
    public static final int GATEWAY_UNIT_ID = 255;
    private static final Logger logger = LoggerFactory.getLogger(PanelServerDiscovery.class);
    private final ModbusConfiguration modbusConfiguration;
    private final ModelRegistry modelRegistry;
    private final DeviceNameReader deviceNameReader;

    public PanelServerDiscovery(
        ModbusConfiguration modbusConfiguration,
        ModelRegistry modelRegistry,
        DeviceNameReader deviceNameReader
    ) {
        this.modbusConfiguration = modbusConfiguration;
        this.modelRegistry = modelRegistry;
        this.deviceNameReader = deviceNameReader;
    }

    /**
     * @throws RegisterAccessException если шлюз не отдал таблицу адресов - стратегия неприменима
     */
    public List<DiscoveredDevice> discover(GatewaySession session, DiscoveryStatistics statistics)
        throws RegisterAccessException {
        Map<Integer, Integer> addressTable = readAddressTable(session);
        logger.info("Таблица адресов Panel Server: занято слотов {}", addressTable.size());

        List<DiscoveredDevice> devices = new ArrayList<>();
        for (Map.Entry<Integer, Integer> entry : addressTable.entrySet()) {
            int slot = entry.getKey();
            int unitId = entry.getValue();
            if (unitId > 255) {
                logger.warn("Слот {}: недопустимый unit id {}, пропускаем", slot, unitId);
                statistics.failedRead();
                continue;
            }
            try {
                session.setUnitId(unitId);
                String reference = deviceNameReader.readCommercialReference(session);
                if (reference.isEmpty()) {
                    logger.debug("Слот {} (unit {}): пустой артикул, пропускаем", slot, unitId);
                    continue;
                }

                Optional<ModelDescriptor> model = modelRegistry.lookupByCommercialReference(reference);
                if (model.isEmpty()) {
                    logger.warn("Слот {} (unit {}): неизвестный артикул \"{}\", пропускаем", slot, unitId, reference);
                    statistics.unknownModel();
                    continue;
                }

                String name = deviceNameReader.readDeviceNameOrEmpty(session);
                devices.add(new DiscoveredDevice(session.getEndpoint(),
                    unitId,
                    model.get().getTypeId(),
                    model.get(),
                    name
                ));
                logger.info("Найден {} \"{}\" на unit {} (слот {})", model.get().getName(), reference, unitId, slot);
            } catch (RegisterAccessException | DecodeException e) {
                logger.warn("Слот {} (unit {}): ошибка чтения, пропускаем ({})", slot, unitId, e.getMessage());
                statistics.failedRead();
            }
        }
        return devices;
    }

    /**
     * Читает 99 слотов по 5 регистров порциями не больше 125 регистров (125, 125, 125, 120).
     *
     * @return номер слота (1..99) -> unit id, только занятые слоты
     */
    Map<Integer, Integer> readAddressTable(GatewaySession session) throws RegisterAccessException {
        session.setUnitId(GATEWAY_UNIT_ID);
        int timeout = modbusConfiguration.getReadTimeout();
        int total = RegisterBlocks.PANEL_SERVER_SLOTS * RegisterBlocks.PANEL_SERVER_SLOT_SIZE;
        int chunkSize = GatewaySession.MAX_REGISTERS_PER_READ;

        List<CompletableFuture<byte[]>> futures = new ArrayList<>();
        for (int offset = 0; offset < total; offset += chunkSize) {
            int count = Math.min(chunkSize, total - offset);
            futures.add(session.submitReadHoldingRegisters(RegisterBlocks.PANEL_SERVER_ADDRESS_TABLE + offset,
                count,
                timeout
            ));
        }

        List<byte[]> chunks = new ArrayList<>(futures.size());
        RegisterAccessException failure = null;
        for (int i = 0; i < futures.size(); i++) {
            try {
                chunks.add(GatewaySession.await(futures.get(i),
                    GATEWAY_UNIT_ID,
                    RegisterBlocks.PANEL_SERVER_ADDRESS_TABLE + i * chunkSize
                ));
            } catch (RegisterAccessException e) {
                if (failure == null) {
                    failure = e;
                }
            }
        }
        if (failure != null) {
            throw failure;
        }

        Map<Integer, Integer> addresses = new LinkedHashMap<>();
        for (int slot = 1; slot <= RegisterBlocks.PANEL_SERVER_SLOTS; slot++) {
            int registerOffset = (slot - 1) * RegisterBlocks.PANEL_SERVER_SLOT_SIZE;
            byte[] chunk = chunks.get(registerOffset / chunkSize);
            int unitId = RegisterCodec.decodeUInt16BE(chunk, (registerOffset % chunkSize) * RegisterCodec.REGISTER_BYTES);
            if (unitId != 0 && unitId != 0xFFFF) {
                addresses.put(slot, unitId);
            }
        }
        return addresses;
    }
}
