package home.powertag;

import home.powertag.model.DiscoveredDevice;
import home.powertag.model.DiscoveryStatistics;
import home.powertag.model.RegisterBlocks;
import home.powertag.model.ScanRange;
import home.powertag.service.impl.UnitRangeScanner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class UnitRangeScannerTest extends AbstractTest {

    @Autowired
    UnitRangeScanner unitRangeScanner;

    @Test
    @DisplayName("Шлюз без ответов: ровно 3 запроса при пороге 3 независимо от размера диапазона")
    void checkStopsAfterConsecutiveTimeouts() {
        FakeGatewaySession session = new FakeGatewaySession();

        List<DiscoveredDevice> devices = unitRangeScanner.scan(session, new ScanRange(1, 248, 3), new DiscoveryStatistics());

        assertEquals(0, devices.size());
        assertEquals(3, session.getRequests().size());
        assertEquals(List.of(1, 2, 3), session.getRequests().stream().map(FakeGatewaySession.Request::getUnitId).toList());
    }

    @Test
    @DisplayName("Ответ 0/65535 прерывает серию таймаутов, но устройства не дает")
    void checkEmptyUnitResetsCounter() {
        FakeGatewaySession session = new FakeGatewaySession()
            .setRegister(12, RegisterBlocks.DEVICE_TYPE, 0)
            .setRegister(15, RegisterBlocks.DEVICE_TYPE, 65535)
            .setRegister(18, RegisterBlocks.DEVICE_TYPE, 81);
        DiscoveryStatistics statistics = new DiscoveryStatistics();

        List<DiscoveredDevice> devices = unitRangeScanner.scan(session, new ScanRange(10, 30, 3), statistics);

        /* 10, 11 - таймауты, 12 - пусто, 13, 14 - таймауты, 15 - пусто, 16, 17 - таймауты, 18 - устройство,
        19, 20, 21 - таймауты и остановка */
        assertEquals(1, devices.size());
        assertEquals(18, devices.get(0).getUnitId());
        assertEquals(12, session.getRequests().stream()
            .filter(request -> request.getRegister() == RegisterBlocks.DEVICE_TYPE).count());
        assertEquals(2, statistics.getEmptyUnits());
    }

    @Test
    @DisplayName("Неизвестный тип пропускается, но серию таймаутов прерывает")
    void checkUnknownTypeResetsCounter() {
        FakeGatewaySession session = new FakeGatewaySession()
            .setRegister(2, RegisterBlocks.DEVICE_TYPE, 4242)
            .setRegister(4, RegisterBlocks.DEVICE_TYPE, 41);
        DiscoveryStatistics statistics = new DiscoveryStatistics();

        List<DiscoveredDevice> devices = unitRangeScanner.scan(session, new ScanRange(1, 10, 2), statistics);

        assertEquals(1, devices.size());
        assertEquals(4, devices.get(0).getUnitId());
        assertEquals("PowerTag M63 1P (4)", devices.get(0).getDisplayName());
        assertEquals(1, statistics.getUnknownModels());
    }
}
