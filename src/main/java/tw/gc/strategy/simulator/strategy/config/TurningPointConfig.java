package tw.gc.strategy.simulator.strategy.config;

import lombok.Builder;
import lombok.Value;
import tw.gc.strategy.simulator.strategy.TradeSide;

/**
 * Settings of the turning point subroutine.
 */
@Value
@Builder
public class TurningPointConfig {

    public static final String MODE = "mode_turning";
    public static final String INITIAL_SIDE = "buysell";
    public static final String SIZE = "n";
    public static final String SIZE_DELTA = "n_delta";
    public static final String REVERSAL_THRESHOLD = "h";

    @Builder.Default
    Mode mode = Mode.INCREASE;

    /**
     * Side of the first trade
     */
    @Builder.Default
    TradeSide initialSide = TradeSide.SELL;

    /**
     * Initial buying and selling size
     */
    @Builder.Default
    double size = 10;

    /**
     * Upper bound on how much a size grows after one trade
     */
    @Builder.Default
    double sizeDelta = 1;

    /**
     * Move away from the last extremum required to trade ({@code h})
     */
    @Builder.Default
    double reversalThreshold = 1.0;

    public enum Mode {
        /**
         * Adapt the buying size
         */
        INCREASE("increase"),
        /**
         * Adapt the selling size
         */
        DECREASE("decrease"),
        /**
         * Adapt both sizes
         */
        SIZE("size");

        private final String code;

        Mode(String code) {
            this.code = code;
        }

        public String getCode() {
            return code;
        }

        public static Mode fromCode(String code) {
            for (Mode mode : values()) {
                if (mode.code.equalsIgnoreCase(code)) {
                    return mode;
                }
            }
            throw new IllegalArgumentException("Mode error: " + code);
        }
    }

    public static TurningPointConfig defaults() {
        return builder().build();
    }

    public static TurningPointConfig from(StrategyParameters parameters) {
        TurningPointConfig config = TurningPointConfig.builder()
                .mode(Mode.fromCode(parameters.getString(MODE, Mode.INCREASE.getCode())))
                .initialSide(TradeSide.fromSign(parameters.getDouble(INITIAL_SIDE, -1)))
                .size(parameters.getDouble(SIZE, 10))
                .sizeDelta(parameters.getDouble(SIZE_DELTA, 1))
                .reversalThreshold(parameters.getDouble(REVERSAL_THRESHOLD, 1.0))
                .build();
        config.validate();
        return config;
    }

    public void validate() {
        if (mode == null) {
            throw new IllegalArgumentException("Mode error: null");
        }
        if (initialSide == null) {
            throw new IllegalArgumentException(INITIAL_SIDE + " must be set");
        }
        if (!(size >= 0)) {
            throw new IllegalArgumentException(SIZE + " must not be negative: " + size);
        }
        if (!(sizeDelta >= 0)) {
            throw new IllegalArgumentException(SIZE_DELTA + " must not be negative: " + sizeDelta);
        }
        if (!(reversalThreshold > 0)) {
            throw new IllegalArgumentException(REVERSAL_THRESHOLD + " must be positive: " + reversalThreshold);
        }
    }
}
