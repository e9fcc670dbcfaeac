package home.powertag.model;

import static home.powertag.utils.RegisterCodec.decodeFloat32BE;
import static home.powertag.utils.RegisterCodec.decodeScaledInt64BE;
import static home.powertag.utils.RegisterCodec.decodeUInt16BE;

/**
 * Раскладка регистров PowerTag (адреса с нуля, F03).
 * Соседние регистры объединены в блоки, чтобы опрос энергосчетчика укладывался в 7 транзакций.
 */
public final class RegisterBlocks {
    /* тип устройства, используется при сканировании Smartlink */
    public static final int DEVICE_TYPE = 31024;

    /* имя устройства, заданное пользователем: 10 регистров, 20 ASCII символов */
    public static final int DEVICE_NAME = 31000;
    public static final int DEVICE_NAME_LENGTH = 10;

    /* коммерческий артикул: 16 регистров, 32 ASCII символа */
    public static final int COMMERCIAL_REFERENCE = 31060;
    public static final int COMMERCIAL_REFERENCE_LENGTH = 16;

    /* таблица адресов Panel Server на unit 255: 99 слотов по 5 регистров, первый регистр - unit id */
    public static final int PANEL_SERVER_ADDRESS_TABLE = 504;
    public static final int PANEL_SERVER_SLOTS = 99;
    public static final int PANEL_SERVER_SLOT_SIZE = 5;

    /* команда выхода Control IO: 0 - нет, 1 - выключить, 2 - включить */
    public static final int DO1_COMMAND = 37051;

    public static final BlockSpec<double[]> CURRENT =
        new BlockSpec<>("current", 2999, 6, buffer -> floats(buffer, 3));

    public static final BlockSpec<double[]> VOLTAGE_LN =
        new BlockSpec<>("voltage L-N", 3027, 6, buffer -> floats(buffer, 3));

    public static final BlockSpec<double[]> VOLTAGE_LL =
        new BlockSpec<>("voltage L-L", 3019, 6, buffer -> floats(buffer, 3));

    /* L1, L2, L3 и суммарная */
    public static final BlockSpec<double[]> POWER =
        new BlockSpec<>("power", 3053, 8, buffer -> floats(buffer, 4));

    public static final BlockSpec<Double> POWER_FACTOR =
        new BlockSpec<>("power factor", 3083, 2, buffer -> decodeFloat32BE(buffer, 0));

    public static final BlockSpec<Double> FREQUENCY =
        new BlockSpec<>("frequency", 3109, 2, buffer -> decodeFloat32BE(buffer, 0));

    public static final BlockSpec<Double> TEMPERATURE =
        new BlockSpec<>("temperature", 3131, 2, buffer -> decodeFloat32BE(buffer, 0));

    /* Wh в int64, отдаем kWh */
    public static final BlockSpec<Double> ENERGY_TOTAL =
        new BlockSpec<>("energy", 3203, 4, buffer -> decodeScaledInt64BE(buffer, 0, 1000));

    public static final BlockSpec<Double> HEATTAG_TEMPERATURE =
        new BlockSpec<>("heattag temperature", 4001, 2, buffer -> decodeFloat32BE(buffer, 0));

    /* влажность хранится долей (0.50), отдаем проценты */
    public static final BlockSpec<Double> HEATTAG_HUMIDITY =
        new BlockSpec<>("heattag humidity", 4007, 2, buffer -> decodeFloat32BE(buffer, 0) * 100);

    public static final BlockSpec<Integer> HEATTAG_ALARM =
        new BlockSpec<>("heattag alarm", 3323, 1, buffer -> decodeUInt16BE(buffer, 0));

    /* у входов 0 - включен, 1 - выключен */
    public static final BlockSpec<Boolean> DI1_STATUS =
        new BlockSpec<>("DI1 status", 34065, 1, buffer -> decodeUInt16BE(buffer, 0) == 0);

    public static final BlockSpec<Boolean> DI2_STATUS =
        new BlockSpec<>("DI2 status", 34165, 1, buffer -> decodeUInt16BE(buffer, 0) == 0);

    /* у выхода наоборот: 1 - включен */
    public static final BlockSpec<Boolean> DO1_STATUS =
        new BlockSpec<>("DO1 status", 37052, 1, buffer -> decodeUInt16BE(buffer, 0) == 1);

    private RegisterBlocks() {
    }

    private static double[] floats(byte[] buffer, int count) {
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = decodeFloat32BE(buffer, i * 4);
        }
        return values;
    }
}
