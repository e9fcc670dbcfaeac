package home.powertag.configuration;

import home.powertag.model.ScanRange;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class DiscoveryConfiguration {
    /* основной, плотно заселенный диапазон Smartlink */
    @Value("${discovery.primary.from}")
    private Integer primaryFrom;

    @Value("${discovery.primary.to}")
    private Integer primaryTo;

    @Value("${discovery.primary.maxConsecutiveTimeouts}")
    private Integer primaryMaxConsecutiveTimeouts;

    @Value("${discovery.lower.from}")
    private Integer lowerFrom;

    @Value("${discovery.lower.to}")
    private Integer lowerTo;

    @Value("${discovery.lower.maxConsecutiveTimeouts}")
    private Integer lowerMaxConsecutiveTimeouts;

    @Value("${discovery.upper.from}")
    private Integer upperFrom;

    @Value("${discovery.upper.to}")
    private Integer upperTo;

    @Value("${discovery.upper.maxConsecutiveTimeouts}")
    private Integer upperMaxConsecutiveTimeouts;

    public ScanRange getPrimaryRange() {
        return new ScanRange(primaryFrom, primaryTo, primaryMaxConsecutiveTimeouts);
    }

    public ScanRange getLowerRange() {
        return new ScanRange(lowerFrom, lowerTo, lowerMaxConsecutiveTimeouts);
    }

    public ScanRange getUpperRange() {
        return new ScanRange(upperFrom, upperTo, upperMaxConsecutiveTimeouts);
    }

    /**
     * Диапазоны в порядке сканирования: сначала основной, затем расширенные
     */
    public List<ScanRange> getScanRanges() {
        return List.of(getPrimaryRange(), getLowerRange(), getUpperRange());
    }
}
