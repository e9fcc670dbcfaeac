package home.powertag.enums;

public enum DiscoveryStrategy {
    PANEL_SERVER("таблица адресов Panel Server"),

    RANGE_SCAN("сканирование диапазонов unit id");

    private final String template;

    DiscoveryStrategy(String template) {
        this.template = template;
    }

    public String getTemplate() {
        return template;
    }
}
