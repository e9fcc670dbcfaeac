package home.powertag.service;

import home.powertag.model.ModelDescriptor;

import java.util.Optional;

public interface ModelRegistry {
    /**
     * Поиск модели по коду типа из регистра 31024
     *
     * @param typeId код типа устройства
     * @return описание модели или пусто, если модель неизвестна
     */
    Optional<ModelDescriptor> lookupByTypeId(int typeId);

    /**
     * Поиск модели по коммерческому артикулу: точное совпадение либо совпадение по префиксу
     *
     * @param reference артикул, например "A9MEM1560"
     * @return описание модели или пусто, если модель неизвестна
     */
    Optional<ModelDescriptor> lookupByCommercialReference(String reference);
}
