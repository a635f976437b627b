package tw.gc.strategy.simulator.engine;

/**
 * Which subroutine provides the primary proposal of each tick.
 */
public enum StrategyMode {
    CHASE("chase"),
    TURNING("turning");

    private final String code;

    StrategyMode(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static StrategyMode fromCode(String code) {
        for (StrategyMode mode : values()) {
            if (mode.code.equalsIgnoreCase(code)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Mode not supported: " + code);
    }
}
