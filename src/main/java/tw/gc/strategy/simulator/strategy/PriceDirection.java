package tw.gc.strategy.simulator.strategy;

/**
 * Local price direction between two consecutive observations.
 */
public enum PriceDirection {
    /**
     * No movement observed yet, or no movement between the two prices
     */
    UNSET,
    RISING,
    FALLING;

    /**
     * Direction of the move from {@code previous} to {@code current}.
     * Equal prices (and NaN on either side) give {@link #UNSET}.
     */
    public static PriceDirection between(double previous, double current) {
        if (current > previous) {
            return RISING;
        }
        if (current < previous) {
            return FALLING;
        }
        return UNSET;
    }

    /**
     * True when moving from this direction to {@code next} turns a rise into a fall.
     */
    public boolean peaksInto(PriceDirection next) {
        return this == RISING && next == FALLING;
    }

    /**
     * True when moving from this direction to {@code next} turns a fall into a rise.
     */
    public boolean bottomsInto(PriceDirection next) {
        return this == FALLING && next == RISING;
    }
}
