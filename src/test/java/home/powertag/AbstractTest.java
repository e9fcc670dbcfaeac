package home.powertag;

import home.powertag.service.GatewaySessionFactory;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.event.RecordApplicationEvents;

@SpringBootTest(
    properties = {
        "modbus.connectTimeout = 1000",
        "modbus.readTimeout = 100",
        "modbus.validationTimeout = 1000",
        "spring.cache.caffeine.spec = expireAfterWrite=1s"
    })
@ActiveProfiles("test")
@RecordApplicationEvents
public abstract class AbstractTest {
    @MockBean
    GatewaySessionFactory gatewaySessionFactory;
}
