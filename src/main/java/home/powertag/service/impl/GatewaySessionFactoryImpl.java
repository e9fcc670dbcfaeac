package home.powertag.service.impl;

import home.powertag.exception.ConnectionException;
import home.powertag.model.GatewayEndpoint;
import home.powertag.service.GatewaySession;
import home.powertag.service.GatewaySessionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class GatewaySessionFactoryImpl implements GatewaySessionFactory {
    private static final Logger logger = LoggerFactory.getLogger(GatewaySessionFactoryImpl.class);

    @Override
    public GatewaySession open(GatewayEndpoint endpoint, int connectTimeoutMs) throws ConnectionException {
        ModbusGatewaySession session = new ModbusGatewaySession(endpoint);
        try {
            session.connect(connectTimeoutMs);
        } catch (ConnectionException e) {
            logger.error("Ошибка подключения к шлюзу {}", endpoint, e);
            throw e;
        }
        return session;
    }

    @Override
    public void checkConnectivity(GatewayEndpoint endpoint, int timeoutMs) throws ConnectionException {
        logger.debug("Проверка доступности шлюза {}", endpoint);
        ModbusGatewaySession.checkReachable(endpoint, timeoutMs);
    }
}
