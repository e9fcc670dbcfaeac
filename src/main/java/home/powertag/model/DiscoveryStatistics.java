package home.powertag.model;

/**
 * Счетчики одного прогона обнаружения для диагностики
 */
public class DiscoveryStatistics {
    private int unknownModels;

    private int failedReads;

    private int emptyUnits;

    public void unknownModel() {
        unknownModels++;
    }

    public void failedRead() {
        failedReads++;
    }

    public void emptyUnit() {
        emptyUnits++;
    }

    /**
     * @return устройства ответили, но модель не опознана
     */
    public int getUnknownModels() {
        return unknownModels;
    }

    /**
     * @return запросы, завершившиеся таймаутом, исключением или ошибкой разбора
     */
    public int getFailedReads() {
        return failedReads;
    }

    /**
     * @return unit id, вернувшие 0 или 65535 вместо типа
     */
    public int getEmptyUnits() {
        return emptyUnits;
    }

    @Override
    public String toString() {
        return "unknownModels=" + unknownModels + ", failedReads=" + failedReads + ", emptyUnits=" + emptyUnits;
    }
}
