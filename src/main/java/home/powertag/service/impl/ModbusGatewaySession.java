package home.powertag.service.impl;

import com.intelligt.modbus.jlibmodbus.Modbus;
import com.intelligt.modbus.jlibmodbus.exception.ModbusIOException;
import com.intelligt.modbus.jlibmodbus.exception.ModbusNumberException;
import com.intelligt.modbus.jlibmodbus.exception.ModbusProtocolException;
import com.intelligt.modbus.jlibmodbus.master.ModbusMaster;
import com.intelligt.modbus.jlibmodbus.master.ModbusMasterFactory;
import com.intelligt.modbus.jlibmodbus.tcp.TcpParameters;
import home.powertag.exception.ConnectionException;
import home.powertag.exception.RegisterAccessException;
import home.powertag.model.GatewayEndpoint;
import home.powertag.service.GatewaySession;
import home.powertag.utils.RegisterCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Сессия поверх jlibmodbus. Все транзакции выполняются одним потоком в порядке постановки,
 * unit id запоминается в задаче в момент постановки.
 */
public class ModbusGatewaySession implements GatewaySession {
    private static final Logger logger = LoggerFactory.getLogger(ModbusGatewaySession.class);
    private final GatewayEndpoint endpoint;
    private final ExecutorService executorService = Executors.newSingleThreadExecutor();
    private final Object closeLock = new Object();
    /* выставляется потоком сессии под closeLock */
    private ModbusMaster modbusMaster;
    private volatile int unitId = 1;
    private boolean closed;

    ModbusGatewaySession(GatewayEndpoint endpoint) {
        this.endpoint = endpoint;
    }

    /**
     * Сначала проверяем доступность порта обычным сокетом с заданным таймаутом, затем поднимаем
     * modbus мастер в потоке сессии. jlibmodbus подключается со своим фиксированным таймаутом,
     * поэтому общее время ограничено оставшейся частью connectTimeoutMs.
     */
    void connect(int connectTimeoutMs) throws ConnectionException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(connectTimeoutMs);
        InetAddress host;
        try {
            host = InetAddress.getByName(endpoint.getAddress());
        } catch (UnknownHostException e) {
            close();
            throw ConnectionException.refused(endpoint, e);
        }
        try {
            checkReachable(endpoint, connectTimeoutMs);
        } catch (ConnectionException e) {
            close();
            throw e;
        }

        Future<?> future = executorService.submit(() -> {
            openMaster(host);
            return null;
        });
        long remainingMs = Math.max(1, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime()));
        try {
            future.get(remainingMs, TimeUnit.MILLISECONDS);
            logger.debug("Установлено соединение с {}", endpoint);
        } catch (TimeoutException e) {
            future.cancel(true);
            close();
            throw ConnectionException.timeout(endpoint, e);
        } catch (ExecutionException e) {
            close();
            throw connectionError(endpoint, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            throw ConnectionException.refused(endpoint, e);
        }
    }

    /**
     * С keepAlive мастер подключается уже в конструкторе и при неудаче только пишет предупреждение,
     * поэтому причину ошибки получаем повторным connect()
     */
    private void openMaster(InetAddress host) throws ModbusIOException {
        TcpParameters tcpParameters = new TcpParameters();
        tcpParameters.setHost(host);
        tcpParameters.setKeepAlive(true);
        tcpParameters.setPort(endpoint.getPort());

        ModbusMaster master = ModbusMasterFactory.createModbusMasterTCP(tcpParameters);
        Modbus.setAutoIncrementTransactionId(true);
        if (!master.isConnected()) {
            master.connect();
        }
        synchronized (closeLock) {
            if (!closed) {
                modbusMaster = master;
                return;
            }
        }
        /* сессию закрыли, пока шло подключение */
        logger.debug("Соединение с {} установлено после закрытия сессии, отключаемся", endpoint);
        master.disconnect();
    }

    /**
     * Проверка, что шлюз принимает TCP соединения, без обмена по modbus
     */
    static void checkReachable(GatewayEndpoint endpoint, int timeoutMs) throws ConnectionException {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(endpoint.getAddress(), endpoint.getPort()), timeoutMs);
        } catch (IOException e) {
            throw connectionError(endpoint, e);
        }
    }

    private static ConnectionException connectionError(GatewayEndpoint endpoint, Throwable e) {
        for (Throwable c = e; c != null; c = c.getCause()) {
            if (c instanceof SocketTimeoutException) {
                return ConnectionException.timeout(endpoint, e);
            }
        }
        return ConnectionException.refused(endpoint, e);
    }

    @Override
    public GatewayEndpoint getEndpoint() {
        return endpoint;
    }

    @Override
    public void setUnitId(int unitId) {
        if (unitId < 0 || unitId > 255) {
            throw new IllegalArgumentException("unit id out of range: " + unitId);
        }
        this.unitId = unitId;
    }

    @Override
    public int getUnitId() {
        return unitId;
    }

    @Override
    public CompletableFuture<byte[]> submitReadHoldingRegisters(int startRegister, int count, int timeoutMs) {
        if (count < 1 || count > MAX_REGISTERS_PER_READ) {
            throw new IllegalArgumentException("register count must be 1.." + MAX_REGISTERS_PER_READ + ", got " + count);
        }
        final int targetUnitId = unitId;
        CompletableFuture<byte[]> future = new CompletableFuture<>();
        try {
            executorService.execute(() -> {
                try {
                    future.complete(read(targetUnitId, startRegister, count, timeoutMs));
                } catch (RegisterAccessException e) {
                    future.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(
                RegisterAccessException.io(FUNCTION_READ_HOLDING_REGISTERS, targetUnitId, startRegister, e));
        }
        return future;
    }

    @Override
    public void writeSingleRegister(int register, int value, int timeoutMs) throws RegisterAccessException {
        final int targetUnitId = unitId;
        CompletableFuture<Void> future = new CompletableFuture<>();
        try {
            executorService.execute(() -> {
                try {
                    write(targetUnitId, register, value, timeoutMs);
                    future.complete(null);
                } catch (RegisterAccessException e) {
                    future.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            throw RegisterAccessException.io(FUNCTION_WRITE_SINGLE_REGISTER, targetUnitId, register, e);
        }
        try {
            future.get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RegisterAccessException) {
                throw (RegisterAccessException) e.getCause();
            }
            throw RegisterAccessException.io(FUNCTION_WRITE_SINGLE_REGISTER, targetUnitId, register, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw RegisterAccessException.io(FUNCTION_WRITE_SINGLE_REGISTER, targetUnitId, register, e);
        }
    }

    private byte[] read(int targetUnitId, int startRegister, int count, int timeoutMs)
        throws RegisterAccessException {
        try {
            modbusMaster.setResponseTimeout(timeoutMs);
            int[] registers = modbusMaster.readHoldingRegisters(targetUnitId, startRegister, count);
            logger.trace("F03 unit {} [{}+{}] ok", targetUnitId, startRegister, count);
            return RegisterCodec.toBytes(registers);
        } catch (ModbusProtocolException e) {
            throw RegisterAccessException.exceptionResponse(FUNCTION_READ_HOLDING_REGISTERS,
                targetUnitId,
                startRegister,
                e.getException().getValue(),
                e
            );
        } catch (ModbusIOException e) {
            throw transportError(FUNCTION_READ_HOLDING_REGISTERS, targetUnitId, startRegister, e);
        } catch (ModbusNumberException e) {
            throw RegisterAccessException.io(FUNCTION_READ_HOLDING_REGISTERS, targetUnitId, startRegister, e);
        }
    }

    private void write(int targetUnitId, int register, int value, int timeoutMs) throws RegisterAccessException {
        try {
            modbusMaster.setResponseTimeout(timeoutMs);
            modbusMaster.writeSingleRegister(targetUnitId, register, value);
            logger.trace("F06 unit {} [{}] = {} ok", targetUnitId, register, value);
        } catch (ModbusProtocolException e) {
            throw RegisterAccessException.exceptionResponse(FUNCTION_WRITE_SINGLE_REGISTER,
                targetUnitId,
                register,
                e.getException().getValue(),
                e
            );
        } catch (ModbusIOException e) {
            throw transportError(FUNCTION_WRITE_SINGLE_REGISTER, targetUnitId, register, e);
        } catch (ModbusNumberException e) {
            throw RegisterAccessException.io(FUNCTION_WRITE_SINGLE_REGISTER, targetUnitId, register, e);
        }
    }

    private static RegisterAccessException transportError(int functionCode, int unitId, int register, Exception e) {
        for (Throwable c = e; c != null; c = c.getCause()) {
            if (c instanceof SocketTimeoutException) {
                return RegisterAccessException.timeout(functionCode, unitId, register, e);
            }
        }
        return RegisterAccessException.io(functionCode, unitId, register, e);
    }

    @Override
    public void close() {
        ModbusMaster master;
        synchronized (closeLock) {
            if (closed) {
                return;
            }
            closed = true;
            master = modbusMaster;
        }
        executorService.shutdownNow();
        if (master != null) {
            try {
                master.disconnect();
            } catch (ModbusIOException e) {
                logger.warn("Ошибка закрытия соединения с {}", endpoint, e);
            }
        }
        logger.debug("Соединение с {} закрыто", endpoint);
    }
}
