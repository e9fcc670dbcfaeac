package home.powertag.service;

import home.powertag.exception.ConnectionException;
import home.powertag.model.DiscoveredDevice;
import home.powertag.model.GatewayEndpoint;

import java.util.List;

public interface DeviceDiscoveryService {
    /**
     * Поиск устройств за шлюзом: сначала таблица адресов Panel Server, если она ничего не дала -
     * сканирование диапазонов unit id в стиле Smartlink
     *
     * @param endpoint адрес шлюза
     * @return найденные устройства, возможно пустой список
     * @throws ConnectionException только если не удалось подключиться к шлюзу
     */
    List<DiscoveredDevice> discover(GatewayEndpoint endpoint) throws ConnectionException;
}
