package home.powertag.event.info;

import home.powertag.enums.DiscoveryStrategy;
import home.powertag.model.DiscoveredDevice;
import home.powertag.model.DiscoveryStatistics;
import home.powertag.model.GatewayEndpoint;
import org.springframework.context.ApplicationEvent;

import java.util.List;

public class DiscoveryCompletedEvent extends ApplicationEvent {
    private final GatewayEndpoint endpoint;

    private final DiscoveryStrategy strategy;

    private final List<DiscoveredDevice> devices;

    private final DiscoveryStatistics statistics;

    public DiscoveryCompletedEvent(
        Object source,
        GatewayEndpoint endpoint,
        DiscoveryStrategy strategy,
        List<DiscoveredDevice> devices,
        DiscoveryStatistics statistics
    ) {
        super(source);
        this.endpoint = endpoint;
        this.strategy = strategy;
        this.devices = List.copyOf(devices);
        this.statistics = statistics;
    }

    public GatewayEndpoint getEndpoint() {
        return endpoint;
    }

    /**
     * @return стратегия, давшая результат
     */
    public DiscoveryStrategy getStrategy() {
        return strategy;
    }

    public List<DiscoveredDevice> getDevices() {
        return devices;
    }

    public DiscoveryStatistics getStatistics() {
        return statistics;
    }
}
