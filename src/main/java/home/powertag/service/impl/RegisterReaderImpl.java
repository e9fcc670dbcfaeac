package home.powertag.service.impl;

import home.powertag.configuration.ModbusConfiguration;
import home.powertag.enums.OutputCommand;
import home.powertag.enums.VoltageMode;
import home.powertag.exception.RegisterAccessException;
import home.powertag.model.BlockSpec;
import home.powertag.model.Control2DIPollResult;
import home.powertag.model.ControlIOPollResult;
import home.powertag.model.EnergyPollResult;
import home.powertag.model.HeatTagPollResult;
import home.powertag.model.MeasurementSnapshot;
import home.powertag.model.ModelDescriptor;
import home.powertag.model.RegisterBlocks;
import home.powertag.service.GatewaySession;
import home.powertag.service.RegisterReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Service
public class RegisterReaderImpl implements RegisterReader {
    private static final Logger logger = LoggerFactory.getLogger(RegisterReaderImpl.class);
    private final ModbusConfiguration modbusConfiguration;

    public RegisterReaderImpl(ModbusConfiguration modbusConfiguration) {
        this.modbusConfiguration = modbusConfiguration;
    }

    @Override
    public MeasurementSnapshot read(GatewaySession session, ModelDescriptor model, VoltageMode voltageMode)
        throws RegisterAccessException {
        return switch (model.getFamily()) {
            case ENERGY -> readEnergy(session, model.resolveVoltageMode(voltageMode));
            case HEAT_TAG -> readHeatTag(session);
            case CONTROL_2DI -> readControl2DI(session);
            case CONTROL_IO -> readControlIO(session);
        };
    }

    @Override
    public EnergyPollResult readEnergy(GatewaySession session, VoltageMode voltageMode)
        throws RegisterAccessException {
        BlockReads reads = new BlockReads(session);
        CompletableFuture<double[]> current = reads.submit(RegisterBlocks.CURRENT);
        CompletableFuture<double[]> voltage =
            reads.submit(voltageMode == VoltageMode.L_L ? RegisterBlocks.VOLTAGE_LL : RegisterBlocks.VOLTAGE_LN);
        CompletableFuture<double[]> power = reads.submit(RegisterBlocks.POWER);
        CompletableFuture<Double> powerFactor = reads.submit(RegisterBlocks.POWER_FACTOR);
        CompletableFuture<Double> frequency = reads.submit(RegisterBlocks.FREQUENCY);
        CompletableFuture<Double> temperature = reads.submit(RegisterBlocks.TEMPERATURE);
        CompletableFuture<Double> totalEnergy = reads.submit(RegisterBlocks.ENERGY_TOTAL);
        reads.awaitAll();

        return new EnergyPollResult(
            current.join(),
            voltageMode,
            voltage.join(),
            power.join(),
            powerFactor.join(),
            frequency.join(),
            temperature.join(),
            totalEnergy.join(),
            Instant.now()
        );
    }

    @Override
    public HeatTagPollResult readHeatTag(GatewaySession session) throws RegisterAccessException {
        BlockReads reads = new BlockReads(session);
        CompletableFuture<Double> temperature = reads.submit(RegisterBlocks.HEATTAG_TEMPERATURE);
        CompletableFuture<Double> humidity = reads.submit(RegisterBlocks.HEATTAG_HUMIDITY);
        CompletableFuture<Integer> alarm = reads.submit(RegisterBlocks.HEATTAG_ALARM);
        reads.awaitAll();

        return new HeatTagPollResult(temperature.join(), humidity.join(), alarm.join(), Instant.now());
    }

    @Override
    public Control2DIPollResult readControl2DI(GatewaySession session) throws RegisterAccessException {
        BlockReads reads = new BlockReads(session);
        CompletableFuture<Boolean> di1 = reads.submit(RegisterBlocks.DI1_STATUS);
        CompletableFuture<Boolean> di2 = reads.submit(RegisterBlocks.DI2_STATUS);
        reads.awaitAll();

        return new Control2DIPollResult(di1.join(), di2.join(), Instant.now());
    }

    @Override
    public ControlIOPollResult readControlIO(GatewaySession session) throws RegisterAccessException {
        BlockReads reads = new BlockReads(session);
        CompletableFuture<Boolean> di1 = reads.submit(RegisterBlocks.DI1_STATUS);
        CompletableFuture<Boolean> output = reads.submit(RegisterBlocks.DO1_STATUS);
        reads.awaitAll();

        return new ControlIOPollResult(di1.join(), output.join(), Instant.now());
    }

    @Override
    public void writeOutput(GatewaySession session, boolean on) throws RegisterAccessException {
        OutputCommand command = OutputCommand.of(on);
        logger.debug("Команда выходу unit {}: {}", session.getUnitId(), command);
        session.writeSingleRegister(RegisterBlocks.DO1_COMMAND, command.getValue(), modbusConfiguration.getReadTimeout());
    }

    /**
     * Чтения блоков одного опроса: все ставятся в очередь сразу, не дожидаясь ответов, затем
     * {@link #awaitAll()} дожидается каждого. Любая ошибка чтения или раскодирования - ошибка всего опроса.
     */
    private class BlockReads {
        private final GatewaySession session;
        private final int unitId;
        private final Map<BlockSpec<?>, CompletableFuture<?>> pending = new LinkedHashMap<>();

        BlockReads(GatewaySession session) {
            this.session = session;
            this.unitId = session.getUnitId();
        }

        <T> CompletableFuture<T> submit(BlockSpec<T> block) {
            CompletableFuture<T> future = session.submitReadHoldingRegisters(block.getStartRegister(),
                block.getRegisterCount(),
                modbusConfiguration.getReadTimeout()
            ).thenApply(block::decode);
            pending.put(block, future);
            return future;
        }

        void awaitAll() throws RegisterAccessException {
            RegisterAccessException failure = null;
            for (Map.Entry<BlockSpec<?>, CompletableFuture<?>> entry : pending.entrySet()) {
                try {
                    GatewaySession.await(entry.getValue(), unitId, entry.getKey().getStartRegister());
                } catch (RegisterAccessException e) {
                    if (failure == null) {
                        failure = e;
                    }
                }
            }
            if (failure != null) {
                logger.debug("Опрос unit {} не удался: {}", unitId, failure.getMessage());
                throw failure;
            }
        }
    }
}
