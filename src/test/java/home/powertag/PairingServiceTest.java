package home.powertag;

import home.powertag.exception.ConnectionException;
import home.powertag.model.DiscoveredDevice;
import home.powertag.model.GatewayEndpoint;
import home.powertag.model.RegisterBlocks;
import home.powertag.service.PairingService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class PairingServiceTest extends AbstractTest {
    private static final GatewayEndpoint ENDPOINT = new GatewayEndpoint("10.0.0.7", 502);

    @Autowired
    PairingService pairingService;

    @Test
    @DisplayName("Сопряжение: проверка доступности шлюза, затем обнаружение")
    void checkPairing() throws ConnectionException {
        FakeGatewaySession session = new FakeGatewaySession(ENDPOINT)
            .setRegister(150, RegisterBlocks.DEVICE_TYPE, 171);
        Mockito.when(gatewaySessionFactory.open(ArgumentMatchers.eq(ENDPOINT), ArgumentMatchers.anyInt()))
            .thenReturn(session);

        List<DiscoveredDevice> devices = pairingService.pair(ENDPOINT);

        assertEquals(1, devices.size());
        assertEquals("10.0.0.7:502:150", devices.get(0).getDeviceId());
        assertEquals("PowerTag C 2DI (150)", devices.get(0).getDisplayName());
        Mockito.verify(gatewaySessionFactory).checkConnectivity(ENDPOINT, 1000);
    }

    @Test
    @DisplayName("Недоступный шлюз: обнаружение не запускается")
    void checkUnreachableGateway() throws ConnectionException {
        Mockito.doThrow(ConnectionException.timeout(ENDPOINT, null))
            .when(gatewaySessionFactory).checkConnectivity(ArgumentMatchers.eq(ENDPOINT), ArgumentMatchers.anyInt());

        ConnectionException e = assertThrows(ConnectionException.class, () -> pairingService.pair(ENDPOINT));

        assertEquals(ConnectionException.Reason.TIMEOUT, e.getReason());
        assertEquals("Connection timeout to 10.0.0.7:502", e.getMessage());
        Mockito.verify(gatewaySessionFactory, Mockito.never()).open(ArgumentMatchers.any(), ArgumentMatchers.anyInt());
    }
}
