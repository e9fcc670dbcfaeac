package home.powertag.model;

import java.util.function.Function;

/**
 * Одно непрерывное чтение holding регистров и способ его раскодировать
 *
 * @param <T> тип раскодированного значения
 */
public final class BlockSpec<T> {
    private final String name;

    private final int startRegister;

    private final int registerCount;

    private final Function<byte[], T> decoder;

    public BlockSpec(String name, int startRegister, int registerCount, Function<byte[], T> decoder) {
        if (registerCount < 1 || registerCount > 125) {
            throw new IllegalArgumentException("register count must be 1..125, got " + registerCount);
        }
        this.name = name;
        this.startRegister = startRegister;
        this.registerCount = registerCount;
        this.decoder = decoder;
    }

    public String getName() {
        return name;
    }

    public int getStartRegister() {
        return startRegister;
    }

    public int getRegisterCount() {
        return registerCount;
    }

    public T decode(byte[] buffer) {
        return decoder.apply(buffer);
    }

    @Override
    public String toString() {
        return name + "[" + startRegister + "+" + registerCount + "]";
    }
}
