package tw.gc.strategy.simulator.engine;

/**
 * Receives notable events of a running {@link PrototypeStrategy}.
 */
public interface StrategyEventListener {

    /**
     * An order was executed and balances updated.
     */
    default void onOrderExecuted(Order order, double fund, double unit) {
    }

    /**
     * A buy could not be paid in full; it was clipped to what the fund affords.
     */
    default void onFundsExhausted(double requested, double filled, double price) {
    }

    /**
     * The threshold control overrode the primary proposal.
     */
    default void onThresholdTriggered(double proposed, double override, double gain) {
    }
}
