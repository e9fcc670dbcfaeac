package home.powertag.enums;

import home.powertag.model.BlockSpec;
import home.powertag.model.RegisterBlocks;

import java.util.List;

/**
 * Семейства устройств с разным набором опрашиваемых блоков регистров.
 * Раскладка блоков задана явно для каждого семейства и не выводится из адресов.
 */
public enum ModelFamily {
    ENERGY("энергосчетчик"),

    HEAT_TAG("датчик температуры и влажности"),

    CONTROL_2DI("модуль двух дискретных входов"),

    CONTROL_IO("модуль входа и выхода");

    private final String template;

    ModelFamily(String template) {
        this.template = template;
    }

    public String getTemplate() {
        return template;
    }

    public List<BlockSpec<?>> getRegisterBlocks(VoltageMode voltageMode) {
        return switch (this) {
            case ENERGY -> List.of(
                RegisterBlocks.CURRENT,
                voltageMode == VoltageMode.L_L ? RegisterBlocks.VOLTAGE_LL : RegisterBlocks.VOLTAGE_LN,
                RegisterBlocks.POWER,
                RegisterBlocks.POWER_FACTOR,
                RegisterBlocks.FREQUENCY,
                RegisterBlocks.TEMPERATURE,
                RegisterBlocks.ENERGY_TOTAL
            );
            case HEAT_TAG -> List.of(
                RegisterBlocks.HEATTAG_TEMPERATURE,
                RegisterBlocks.HEATTAG_HUMIDITY,
                RegisterBlocks.HEATTAG_ALARM
            );
            case CONTROL_2DI -> List.of(RegisterBlocks.DI1_STATUS, RegisterBlocks.DI2_STATUS);
            case CONTROL_IO -> List.of(RegisterBlocks.DI1_STATUS, RegisterBlocks.DO1_STATUS);
        };
    }
}
