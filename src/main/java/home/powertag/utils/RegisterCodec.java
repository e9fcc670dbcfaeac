package home.powertag.utils;

import home.powertag.exception.DecodeException;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/* Register Codec: big-endian buffers of holding registers into values */
public class RegisterCodec {
    public static final int REGISTER_BYTES = 2;

    private RegisterCodec() {
    }

    public static double decodeFloat32BE(byte[] buffer, int offset) {
        requireBytes(buffer, offset, 4);
        return ByteBuffer.wrap(buffer).getFloat(offset);
    }

    public static int decodeUInt16BE(byte[] buffer, int offset) {
        requireBytes(buffer, offset, 2);
        return ((buffer[offset] & 0xFF) << 8) | (buffer[offset + 1] & 0xFF);
    }

    /**
     * Знаковое 64-битное целое, поделенное на divisor (например Wh / 1000 = kWh)
     */
    public static double decodeScaledInt64BE(byte[] buffer, int offset, double divisor) {
        requireBytes(buffer, offset, 8);
        return ByteBuffer.wrap(buffer).getLong(offset) / divisor;
    }

    /**
     * Строка до первого нулевого байта или конца буфера, без пробелов по краям.
     * Непечатаемые символы не отбрасываются.
     */
    public static String decodeFixedAscii(byte[] buffer) {
        if (buffer == null) {
            throw new DecodeException("register buffer is null");
        }
        int length = 0;
        while (length < buffer.length && buffer[length] != 0) {
            length++;
        }
        return new String(buffer, 0, length, StandardCharsets.ISO_8859_1).strip();
    }

    /**
     * Раскладывает значения регистров (0..65535), как их отдает modbus master, в big-endian буфер
     */
    public static byte[] toBytes(int[] registers) {
        byte[] buffer = new byte[registers.length * REGISTER_BYTES];
        for (int i = 0; i < registers.length; i++) {
            buffer[i * 2] = (byte) ((registers[i] >> 8) & 0xFF);
            buffer[i * 2 + 1] = (byte) (registers[i] & 0xFF);
        }
        return buffer;
    }

    private static void requireBytes(byte[] buffer, int offset, int width) {
        if (buffer == null) {
            throw new DecodeException("register buffer is null");
        }
        if (offset < 0 || offset + width > buffer.length) {
            throw new DecodeException(
                "need " + width + " bytes at offset " + offset + " (len=" + buffer.length + ")");
        }
    }
}
