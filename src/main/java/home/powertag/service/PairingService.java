package home.powertag.service;

import home.powertag.exception.ConnectionException;
import home.powertag.model.DiscoveredDevice;
import home.powertag.model.GatewayEndpoint;

import java.util.List;

public interface PairingService {
    /**
     * Проверяет доступность шлюза и возвращает список устройств для выбора пользователем
     *
     * @param endpoint адрес шлюза, введенный пользователем
     * @return найденные устройства
     * @throws ConnectionException с указанием host:port, если шлюз недоступен
     */
    List<DiscoveredDevice> pair(GatewayEndpoint endpoint) throws ConnectionException;
}
