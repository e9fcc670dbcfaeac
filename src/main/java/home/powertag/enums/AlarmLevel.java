package home.powertag.enums;

public enum AlarmLevel {
    NONE(0, "тревоги нет"),

    LOW(1, "низкий уровень тревоги"),

    MEDIUM(2, "средний уровень тревоги"),

    HIGH(3, "высокий уровень тревоги"),

    UNKNOWN(-1, "неизвестный уровень тревоги");

    private final int value;

    private final String template;

    AlarmLevel(int value, String template) {
        this.value = value;
        this.template = template;
    }

    public static AlarmLevel fromRegister(int value) {
        for (AlarmLevel level : values()) {
            if (level.value == value) {
                return level;
            }
        }
        return UNKNOWN;
    }

    public int getValue() {
        return value;
    }

    public String getTemplate() {
        return template;
    }
}
