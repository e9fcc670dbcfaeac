package home.powertag.service.impl;

import home.powertag.exception.ConnectionException;
import home.powertag.exception.RegisterAccessException;
import home.powertag.service.GatewaySession;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ModbusGatewaySessionTest {
    private static final int READ_TIMEOUT = 300;

    private final GatewaySessionFactoryImpl factory = new GatewaySessionFactoryImpl();

    private LoopbackModbusServer server;

    private GatewaySession session;

    @BeforeEach
    void start() throws IOException, ConnectionException {
        server = new LoopbackModbusServer()
            .setRegister(100, 1)
            .setRegister(101, 0xABCD)
            .setRegister(102, 7);
        session = factory.open(server.getEndpoint(), 1000);
    }

    @AfterEach
    void stop() {
        session.close();
        server.close();
    }

    private List<LoopbackModbusServer.Frame> frames(int functionCode) {
        return server.getFrames().stream()
            .filter(frame -> frame.getFunctionCode() == functionCode)
            .collect(Collectors.toList());
    }

    @Test
    @DisplayName("F03: регистры возвращаются big-endian буфером, запрос уходит на выставленный unit id")
    void checkReadHoldingRegisters() throws RegisterAccessException {
        session.setUnitId(150);

        byte[] buffer = session.readHoldingRegisters(100, 3, READ_TIMEOUT);

        assertArrayEquals(new byte[]{0, 1, (byte) 0xAB, (byte) 0xCD, 0, 7}, buffer);
        List<LoopbackModbusServer.Frame> reads = frames(3);
        assertEquals(1, reads.size());
        assertEquals(150, reads.get(0).getUnitId());
        assertEquals(100, reads.get(0).getRegister());
        assertEquals(3, reads.get(0).getValue());
    }

    @Test
    @DisplayName("Unit id фиксируется в момент постановки запроса")
    void checkUnitIdCapturedOnSubmit() throws RegisterAccessException {
        session.setUnitId(5);
        CompletableFuture<byte[]> first = session.submitReadHoldingRegisters(100, 1, READ_TIMEOUT);
        session.setUnitId(6);
        CompletableFuture<byte[]> second = session.submitReadHoldingRegisters(101, 1, READ_TIMEOUT);

        GatewaySession.await(first, 5, 100);
        GatewaySession.await(second, 6, 101);

        List<LoopbackModbusServer.Frame> reads = frames(3);
        assertEquals(List.of(5, 6), reads.stream().map(LoopbackModbusServer.Frame::getUnitId).collect(Collectors.toList()));
        assertEquals(List.of(100, 101),
            reads.stream().map(LoopbackModbusServer.Frame::getRegister).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("Молчащий unit id - таймаут чтения")
    void checkReadTimeout() {
        server.silentUnit(42);
        session.setUnitId(42);

        RegisterAccessException e =
            assertThrows(RegisterAccessException.class, () -> session.readHoldingRegisters(100, 1, READ_TIMEOUT));

        assertEquals(RegisterAccessException.Reason.TIMEOUT, e.getReason());
        assertEquals(42, e.getUnitId());
        assertEquals(100, e.getRegister());
    }

    @Test
    @DisplayName("Modbus исключение от шлюза передается с кодом, unit 255 допустим")
    void checkExceptionResponse() {
        session.setUnitId(PanelServerDiscovery.GATEWAY_UNIT_ID);

        RegisterAccessException e =
            assertThrows(RegisterAccessException.class, () -> session.readHoldingRegisters(504, 1, READ_TIMEOUT));

        assertEquals(RegisterAccessException.Reason.EXCEPTION_RESPONSE, e.getReason());
        assertEquals(LoopbackModbusServer.ILLEGAL_DATA_ADDRESS, e.getExceptionCode());
        assertEquals(255, e.getUnitId());
    }

    @Test
    @DisplayName("F06: запись одного регистра")
    void checkWriteSingleRegister() throws RegisterAccessException {
        session.setUnitId(160);

        session.writeSingleRegister(37051, 2, READ_TIMEOUT);

        List<LoopbackModbusServer.Frame> writes = frames(6);
        assertEquals(1, writes.size());
        assertEquals(160, writes.get(0).getUnitId());
        assertEquals(37051, writes.get(0).getRegister());
        assertEquals(2, writes.get(0).getValue());
    }

    @Test
    @DisplayName("Повторное закрытие ничего не делает, запросы после закрытия завершаются ошибкой")
    void checkCloseIsIdempotent() {
        session.setUnitId(150);
        session.close();
        session.close();

        RegisterAccessException e =
            assertThrows(RegisterAccessException.class, () -> session.readHoldingRegisters(100, 1, READ_TIMEOUT));

        assertEquals(RegisterAccessException.Reason.IO, e.getReason());
    }

    @Test
    @DisplayName("Больше 125 регистров за одно чтение запросить нельзя")
    void checkRegisterCountLimit() {
        assertThrows(IllegalArgumentException.class,
            () -> session.submitReadHoldingRegisters(100, GatewaySession.MAX_REGISTERS_PER_READ + 1, READ_TIMEOUT));
    }
}
