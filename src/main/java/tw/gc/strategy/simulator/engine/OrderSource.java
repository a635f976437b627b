package tw.gc.strategy.simulator.engine;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Origin of an executed order.
 */
public enum OrderSource {
    CHASE("chase"),
    TURNING("turning"),
    THRESHOLD_CONTROL("thresholdcontrol"),
    OTHER("other");

    private final String tag;

    OrderSource(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    public static OrderSource of(StrategyMode mode) {
        return mode == StrategyMode.CHASE ? CHASE : TURNING;
    }
}
