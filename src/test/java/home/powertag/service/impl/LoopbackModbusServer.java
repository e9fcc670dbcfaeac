package home.powertag.service.impl;

import home.powertag.model.GatewayEndpoint;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Modbus TCP сервер на loopback для проверки настоящей сессии. Отвечает на F03 значениями из
 * таблицы регистров (незаданный регистр - исключение ILLEGAL DATA ADDRESS), на F06 эхом запроса.
 * Unit id из списка молчащих не получает ответа.
 */
public class LoopbackModbusServer implements AutoCloseable {
    public static final int ILLEGAL_DATA_ADDRESS = 2;

    private final ServerSocket serverSocket;
    private final Map<Integer, Integer> registers = new ConcurrentHashMap<>();
    private final Set<Integer> silentUnits = ConcurrentHashMap.newKeySet();
    private final List<Frame> frames = new CopyOnWriteArrayList<>();
    private final Set<Socket> clients = new HashSet<>();

    public LoopbackModbusServer() throws IOException {
        serverSocket = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
        Thread acceptor = new Thread(this::acceptLoop, "loopback-modbus-accept");
        acceptor.setDaemon(true);
        acceptor.start();
    }

    public GatewayEndpoint getEndpoint() {
        return new GatewayEndpoint(serverSocket.getInetAddress().getHostAddress(), serverSocket.getLocalPort());
    }

    public LoopbackModbusServer setRegister(int register, int value) {
        registers.put(register, value & 0xFFFF);
        return this;
    }

    public LoopbackModbusServer silentUnit(int unitId) {
        silentUnits.add(unitId);
        return this;
    }

    public List<Frame> getFrames() {
        return frames;
    }

    private void acceptLoop() {
        while (!serverSocket.isClosed()) {
            try {
                Socket client = serverSocket.accept();
                synchronized (clients) {
                    clients.add(client);
                }
                Thread handler = new Thread(() -> serve(client), "loopback-modbus-client");
                handler.setDaemon(true);
                handler.start();
            } catch (IOException e) {
                return;
            }
        }
    }

    private void serve(Socket client) {
        try (client) {
            DataInputStream in = new DataInputStream(client.getInputStream());
            DataOutputStream out = new DataOutputStream(client.getOutputStream());
            while (true) {
                int transactionId = in.readUnsignedShort();
                in.readUnsignedShort();
                int length = in.readUnsignedShort();
                int unitId = in.readUnsignedByte();
                byte[] pdu = new byte[length - 1];
                in.readFully(pdu);

                Frame frame = new Frame(unitId,
                    pdu[0] & 0xFF,
                    ((pdu[1] & 0xFF) << 8) | (pdu[2] & 0xFF),
                    ((pdu[3] & 0xFF) << 8) | (pdu[4] & 0xFF)
                );
                frames.add(frame);
                if (silentUnits.contains(unitId)) {
                    continue;
                }

                byte[] response = respond(frame, pdu);
                out.writeShort(transactionId);
                out.writeShort(0);
                out.writeShort(response.length + 1);
                out.writeByte(unitId);
                out.write(response);
                out.flush();
            }
        } catch (IOException e) {
            /* клиент отключился */
        }
    }

    private byte[] respond(Frame frame, byte[] request) {
        if (frame.getFunctionCode() == 6) {
            registers.put(frame.getRegister(), frame.getValue());
            return request;
        }
        int count = frame.getValue();
        byte[] response = new byte[2 + count * 2];
        response[0] = 3;
        response[1] = (byte) (count * 2);
        for (int i = 0; i < count; i++) {
            Integer value = registers.get(frame.getRegister() + i);
            if (value == null) {
                return new byte[]{(byte) 0x83, ILLEGAL_DATA_ADDRESS};
            }
            response[2 + i * 2] = (byte) (value >> 8);
            response[3 + i * 2] = (byte) value.intValue();
        }
        return response;
    }

    @Override
    public void close() {
        try {
            serverSocket.close();
            synchronized (clients) {
                for (Socket client : clients) {
                    client.close();
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Принятый запрос: для F03 value - количество регистров, для F06 - записываемое значение
     */
    public static final class Frame {
        private final int unitId;
        private final int functionCode;
        private final int register;
        private final int value;

        Frame(int unitId, int functionCode, int register, int value) {
            this.unitId = unitId;
            this.functionCode = functionCode;
            this.register = register;
            this.value = value;
        }

        public int getUnitId() {
            return unitId;
        }

        public int getFunctionCode() {
            return functionCode;
        }

        public int getRegister() {
            return register;
        }

        public int getValue() {
            return value;
        }
    }
}
