package home.powertag.service;

import home.powertag.exception.ConnectionException;
import home.powertag.model.GatewayEndpoint;

public interface GatewaySessionFactory {
    /**
     * Открывает новое соединение со шлюзом. Каждый прогон обнаружения и каждый опрос устройства
     * работают в своем соединении, вызывающий обязан закрыть сессию.
     *
     * @param endpoint         адрес шлюза
     * @param connectTimeoutMs таймаут установки соединения
     * @return подключенная сессия
     * @throws ConnectionException если соединение не установлено (таймаут или отказ)
     */
    GatewaySession open(GatewayEndpoint endpoint, int connectTimeoutMs) throws ConnectionException;

    /**
     * Проверка доступности шлюза: открыть TCP соединение и сразу закрыть
     *
     * @param endpoint  адрес шлюза
     * @param timeoutMs таймаут установки соединения
     * @throws ConnectionException с указанием host:port, если шлюз недоступен
     */
    void checkConnectivity(GatewayEndpoint endpoint, int timeoutMs) throws ConnectionException;
}
