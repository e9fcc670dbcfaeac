package home.powertag;

import home.powertag.exception.DecodeException;
import home.powertag.utils.RegisterCodec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class RegisterCodecTest {

    @Test
    @DisplayName("Строка обрезается по первому нулевому байту")
    void checkAsciiUpToZeroByte() {
        byte[] buffer = new byte[32];
        byte[] reference = "A9MEM1560".getBytes(StandardCharsets.US_ASCII);
        System.arraycopy(reference, 0, buffer, 0, reference.length);

        assertEquals("A9MEM1560", RegisterCodec.decodeFixedAscii(buffer));
    }

    @Test
    @DisplayName("Пробелы по краям убираются, строка без нулевого байта читается целиком")
    void checkAsciiTrimAndFullBuffer() {
        assertEquals("Kitchen", RegisterCodec.decodeFixedAscii("  Kitchen ".getBytes(StandardCharsets.US_ASCII)));
        assertEquals("", RegisterCodec.decodeFixedAscii(new byte[20]));
        assertEquals("", RegisterCodec.decodeFixedAscii("    ".getBytes(StandardCharsets.US_ASCII)));
    }

    @Test
    @DisplayName("Непечатаемые байты не приводят к ошибке и не отбрасываются")
    void checkAsciiNonPrintable() {
        byte[] buffer = {'A', 0x01, (byte) 0xC8, 'B', 0, 'C'};
        String decoded = RegisterCodec.decodeFixedAscii(buffer);

        assertEquals(4, decoded.length());
        assertEquals('A', decoded.charAt(0));
        assertEquals('\u0001', decoded.charAt(1));
        assertEquals('B', decoded.charAt(3));
    }

    @Test
    @DisplayName("Float32 и UInt16 в big-endian")
    void checkFloatAndUInt16() {
        byte[] buffer = ByteBuffer.allocate(6).putFloat(230.5F).putShort((short) 0xFFFF).array();

        assertEquals(230.5, RegisterCodec.decodeFloat32BE(buffer, 0), 1e-6);
        assertEquals(65535, RegisterCodec.decodeUInt16BE(buffer, 4));
    }

    @Test
    @DisplayName("Накопленная энергия: 5000 Wh в int64 это 5 kWh")
    void checkScaledEnergy() {
        byte[] buffer = ByteBuffer.allocate(8).putLong(5000L).array();
        assertEquals(5.0, RegisterCodec.decodeScaledInt64BE(buffer, 0, 1000), 1e-9);

        byte[] negative = ByteBuffer.allocate(8).putLong(-1500L).array();
        assertEquals(-1.5, RegisterCodec.decodeScaledInt64BE(negative, 0, 1000), 1e-9);
    }

    @Test
    @DisplayName("Короткий буфер - громкая ошибка, а не чтение за границей")
    void checkShortBuffer() {
        assertThrows(DecodeException.class, () -> RegisterCodec.decodeFloat32BE(new byte[3], 0));
        assertThrows(DecodeException.class, () -> RegisterCodec.decodeFloat32BE(new byte[4], 2));
        assertThrows(DecodeException.class, () -> RegisterCodec.decodeUInt16BE(new byte[1], 0));
        assertThrows(DecodeException.class, () -> RegisterCodec.decodeScaledInt64BE(new byte[6], 0, 1000));
        assertThrows(DecodeException.class, () -> RegisterCodec.decodeUInt16BE(new byte[4], -1));
    }

    @Test
    @DisplayName("Регистры master раскладываются в big-endian буфер")
    void checkToBytes() {
        assertArrayEquals(new byte[]{0x12, 0x34, (byte) 0xFF, (byte) 0xFF}, RegisterCodec.toBytes(new int[]{0x1234, 0xFFFF}));
    }
}
