package home.powertag.enums;

/**
 * Значения регистра команды выхода Control IO
 */
public enum OutputCommand {
    NONE(0),

    OFF(1),

    ON(2);

    private final int value;

    OutputCommand(int value) {
        this.value = value;
    }

    public static OutputCommand of(boolean on) {
        return on ? ON : OFF;
    }

    public int getValue() {
        return value;
    }
}
