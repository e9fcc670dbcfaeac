package home.powertag;

import home.powertag.enums.ModelFamily;
import home.powertag.enums.PowerTagModel;
import home.powertag.enums.VoltageMode;
import home.powertag.model.ModelDescriptor;
import home.powertag.service.ModelRegistry;
import home.powertag.service.impl.ModelRegistryImpl;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ModelRegistryTest {
    private final ModelRegistry modelRegistry = new ModelRegistryImpl();

    @Test
    @DisplayName("Поиск по коду типа")
    void checkLookupByTypeId() {
        ModelDescriptor descriptor = modelRegistry.lookupByTypeId(81).orElseThrow();

        assertEquals(PowerTagModel.F63_1PN, descriptor.getModel());
        assertEquals("A9MEM1560", descriptor.getCommercialReference());
        assertEquals(1, descriptor.getPhaseCount());
        assertTrue(modelRegistry.lookupByTypeId(0).isEmpty());
        assertTrue(modelRegistry.lookupByTypeId(9999).isEmpty());
    }

    @Test
    @DisplayName("Поиск по артикулу: точное совпадение и совпадение по префиксу")
    void checkLookupByReference() {
        assertEquals(PowerTagModel.M63_3PN_TOP, modelRegistry.lookupByCommercialReference("A9MEM1541").orElseThrow().getModel());
        assertEquals(PowerTagModel.F63_1PN, modelRegistry.lookupByCommercialReference("A9MEM1560-01").orElseThrow().getModel());
        assertEquals(PowerTagModel.HEAT_TAG, modelRegistry.lookupByCommercialReference(" smt10020 ").orElseThrow().getModel());
        assertTrue(modelRegistry.lookupByCommercialReference("A9MEM15").isEmpty());
        assertTrue(modelRegistry.lookupByCommercialReference("").isEmpty());
        assertTrue(modelRegistry.lookupByCommercialReference(null).isEmpty());
    }

    @Test
    @DisplayName("Приведение артикула к верхнему регистру не зависит от локали системы")
    void checkReferenceLookupIgnoresDefaultLocale() {
        Locale defaultLocale = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertEquals(PowerTagModel.CONTROL_2DI,
                modelRegistry.lookupByCommercialReference("a9xmc2d3").orElseThrow().getModel()
            );
            assertEquals(PowerTagModel.M630_4P,
                modelRegistry.lookupByCommercialReference("lv434023").orElseThrow().getModel()
            );
        } finally {
            Locale.setDefault(defaultLocale);
        }
    }

    @Test
    @DisplayName("Трехфазный без нейтрали опрашивается только в режиме L-L")
    void checkVoltageModeResolution() {
        ModelDescriptor threePhase = modelRegistry.lookupByTypeId(PowerTagModel.M63_3P.getTypeId()).orElseThrow();
        ModelDescriptor withNeutral = modelRegistry.lookupByTypeId(PowerTagModel.F63_3PN.getTypeId()).orElseThrow();
        ModelDescriptor heatTag = modelRegistry.lookupByTypeId(PowerTagModel.HEAT_TAG.getTypeId()).orElseThrow();

        assertEquals(VoltageMode.L_L, threePhase.resolveVoltageMode(VoltageMode.L_N));
        assertEquals(VoltageMode.L_N, withNeutral.resolveVoltageMode(VoltageMode.L_N));
        assertEquals(VoltageMode.L_L, withNeutral.resolveVoltageMode(VoltageMode.L_L));
        assertEquals(ModelFamily.HEAT_TAG, heatTag.getFamily());
        assertEquals(3, heatTag.getRegisterBlocks(VoltageMode.L_N).size());
        assertEquals(7, withNeutral.getRegisterBlocks(VoltageMode.L_N).size());
    }

    @Test
    @DisplayName("Коды типов и артикулы уникальны")
    void checkUniqueness() {
        for (PowerTagModel model : PowerTagModel.values()) {
            assertEquals(model, modelRegistry.lookupByTypeId(model.getTypeId()).orElseThrow().getModel());
            assertEquals(model,
                modelRegistry.lookupByCommercialReference(model.getCommercialReference()).orElseThrow().getModel()
            );
        }
    }
}
