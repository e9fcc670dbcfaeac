package home.powertag.model;

/**
 * Диапазон unit id [from, to) и допустимое число подряд идущих таймаутов
 */
public final class ScanRange {
    private final int from;

    private final int to;

    private final int maxConsecutiveTimeouts;

    public ScanRange(int from, int to, int maxConsecutiveTimeouts) {
        if (from < 0 || to > 256 || from > to) {
            throw new IllegalArgumentException("invalid unit id range " + from + ".." + to);
        }
        if (maxConsecutiveTimeouts < 1) {
            throw new IllegalArgumentException("maxConsecutiveTimeouts must be positive");
        }
        this.from = from;
        this.to = to;
        this.maxConsecutiveTimeouts = maxConsecutiveTimeouts;
    }

    public int getFrom() {
        return from;
    }

    public int getTo() {
        return to;
    }

    public int getMaxConsecutiveTimeouts() {
        return maxConsecutiveTimeouts;
    }

    @Override
    public String toString() {
        return from + "-" + (to - 1);
    }
}
