package tw.gc.strategy.simulator.strategy;

/**
 * Pending-trade marker of a stepped subroutine.
 *
 * <pre>
 *   IDLE --threshold crossed--> ARMED_BUY / ARMED_SELL
 *   ARMED_* --confirmed move--> IDLE (trade emitted)
 *   ARMED_* --retreat---------> IDLE (no trade)
 * </pre>
 */
public enum ArmState {
    IDLE,
    ARMED_BUY,
    ARMED_SELL
}
