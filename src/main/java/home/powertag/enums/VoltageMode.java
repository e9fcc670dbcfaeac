package home.powertag.enums;

public enum VoltageMode {
    L_N("L-N", "фазное напряжение (фаза-нейтраль)"),

    L_L("L-L", "линейное напряжение (фаза-фаза)");

    private final String code;

    private final String template;

    VoltageMode(String code, String template) {
        this.code = code;
        this.template = template;
    }

    public String getCode() {
        return code;
    }

    public String getTemplate() {
        return template;
    }
}
