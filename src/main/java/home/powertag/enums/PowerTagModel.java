package home.powertag.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Известные модели: код типа (регистр 31024), коммерческий артикул (регистр 31060), число фаз,
 * семейство и поддерживаемые режимы измерения напряжения
 */
public enum PowerTagModel {
    M63_1P(41, "A9MEM1520", "PowerTag M63 1P", 1, ModelFamily.ENERGY, EnumSet.of(VoltageMode.L_N)),
    M63_1PN_TOP(42, "A9MEM1521", "PowerTag M63 1P+N Top", 1, ModelFamily.ENERGY, EnumSet.of(VoltageMode.L_N)),
    M63_1PN_BOTTOM(43, "A9MEM1522", "PowerTag M63 1P+N Bottom", 1, ModelFamily.ENERGY, EnumSet.of(VoltageMode.L_N)),
    M63_3P(44, "A9MEM1540", "PowerTag M63 3P", 3, ModelFamily.ENERGY, EnumSet.of(VoltageMode.L_L)),
    M63_3PN_TOP(45, "A9MEM1541", "PowerTag M63 3P+N Top", 3, ModelFamily.ENERGY,
        EnumSet.of(VoltageMode.L_N, VoltageMode.L_L)),
    M63_3PN_BOTTOM(46, "A9MEM1542", "PowerTag M63 3P+N Bottom", 3, ModelFamily.ENERGY,
        EnumSet.of(VoltageMode.L_N, VoltageMode.L_L)),

    F63_1PN(81, "A9MEM1560", "PowerTag F63 1P+N", 1, ModelFamily.ENERGY, EnumSet.of(VoltageMode.L_N)),
    P63_1PN_TOP(82, "A9MEM1561", "PowerTag P63 1P+N Top", 1, ModelFamily.ENERGY, EnumSet.of(VoltageMode.L_N)),
    P63_1PN_BOTTOM(83, "A9MEM1562", "PowerTag P63 1P+N Bottom", 1, ModelFamily.ENERGY, EnumSet.of(VoltageMode.L_N)),
    P63_1PN_BOTTOM_ALT(84, "A9MEM1563", "PowerTag P63 1P+N Bottom", 1, ModelFamily.ENERGY,
        EnumSet.of(VoltageMode.L_N)),
    F63_3PN(85, "A9MEM1570", "PowerTag F63 3P+N", 3, ModelFamily.ENERGY,
        EnumSet.of(VoltageMode.L_N, VoltageMode.L_L)),
    P63_3PN_TOP(86, "A9MEM1571", "PowerTag P63 3P+N Top", 3, ModelFamily.ENERGY,
        EnumSet.of(VoltageMode.L_N, VoltageMode.L_L)),
    P63_3PN_BOTTOM(87, "A9MEM1572", "PowerTag P63 3P+N Bottom", 3, ModelFamily.ENERGY,
        EnumSet.of(VoltageMode.L_N, VoltageMode.L_L)),

    M250_3P(92, "LV434020", "PowerTag M250 3P", 3, ModelFamily.ENERGY, EnumSet.of(VoltageMode.L_L)),
    M250_4P(93, "LV434021", "PowerTag M250 4P", 3, ModelFamily.ENERGY,
        EnumSet.of(VoltageMode.L_N, VoltageMode.L_L)),
    M630_3P(94, "LV434022", "PowerTag M630 3P", 3, ModelFamily.ENERGY, EnumSet.of(VoltageMode.L_L)),
    M630_4P(95, "LV434023", "PowerTag M630 4P", 3, ModelFamily.ENERGY,
        EnumSet.of(VoltageMode.L_N, VoltageMode.L_L)),

    HEAT_TAG(170, "SMT10020", "HeatTag", 1, ModelFamily.HEAT_TAG, EnumSet.noneOf(VoltageMode.class)),
    CONTROL_2DI(171, "A9XMC2D3", "PowerTag C 2DI", 1, ModelFamily.CONTROL_2DI, EnumSet.noneOf(VoltageMode.class)),
    CONTROL_IO(172, "A9XMC1D3", "PowerTag C IO", 1, ModelFamily.CONTROL_IO, EnumSet.noneOf(VoltageMode.class));

    private final int typeId;

    private final String commercialReference;

    private final String modelName;

    private final int phaseCount;

    private final ModelFamily family;

    private final Set<VoltageMode> voltageModes;

    PowerTagModel(
        int typeId,
        String commercialReference,
        String modelName,
        int phaseCount,
        ModelFamily family,
        Set<VoltageMode> voltageModes
    ) {
        this.typeId = typeId;
        this.commercialReference = commercialReference;
        this.modelName = modelName;
        this.phaseCount = phaseCount;
        this.family = family;
        this.voltageModes = voltageModes;
    }

    public int getTypeId() {
        return typeId;
    }

    public String getCommercialReference() {
        return commercialReference;
    }

    public String getModelName() {
        return modelName;
    }

    public int getPhaseCount() {
        return phaseCount;
    }

    public ModelFamily getFamily() {
        return family;
    }

    public Set<VoltageMode> getVoltageModes() {
        return voltageModes;
    }
}
