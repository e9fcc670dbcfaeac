package home.powertag.model;

import home.powertag.enums.ModelFamily;
import home.powertag.enums.PowerTagModel;
import home.powertag.enums.VoltageMode;

import java.util.List;
import java.util.Set;

/**
 * Неизменяемое описание модели устройства
 */
public final class ModelDescriptor {
    private final PowerTagModel model;

    private final Set<VoltageMode> voltageModes;

    public ModelDescriptor(PowerTagModel model) {
        this.model = model;
        this.voltageModes = Set.copyOf(model.getVoltageModes());
    }

    public PowerTagModel getModel() {
        return model;
    }

    public int getTypeId() {
        return model.getTypeId();
    }

    public String getCommercialReference() {
        return model.getCommercialReference();
    }

    public String getName() {
        return model.getModelName();
    }

    public int getPhaseCount() {
        return model.getPhaseCount();
    }

    public ModelFamily getFamily() {
        return model.getFamily();
    }

    public Set<VoltageMode> getVoltageModes() {
        return voltageModes;
    }

    /**
     * Режим напряжения, который реально будет опрошен: запрошенный, если модель его поддерживает,
     * иначе единственный доступный (трехфазные без нейтрали меряют только L-L)
     */
    public VoltageMode resolveVoltageMode(VoltageMode requested) {
        if (voltageModes.isEmpty() || voltageModes.contains(requested)) {
            return requested;
        }
        return voltageModes.contains(VoltageMode.L_N) ? VoltageMode.L_N : VoltageMode.L_L;
    }

    public List<BlockSpec<?>> getRegisterBlocks(VoltageMode voltageMode) {
        return model.getFamily().getRegisterBlocks(resolveVoltageMode(voltageMode));
    }

    @Override
    public String toString() {
        return model.getModelName() + " (" + model.getCommercialReference() + ", type " + model.getTypeId() + ")";
    }
}
