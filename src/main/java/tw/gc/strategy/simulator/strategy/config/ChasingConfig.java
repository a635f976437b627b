package tw.gc.strategy.simulator.strategy.config;

import lombok.Builder;
import lombok.Value;

/**
 * Settings of the chasing subroutine.
 */
@Value
@Builder
public class ChasingConfig {

    public static final String TREND = "trend";
    public static final String MODE = "mode_chase";
    public static final String GAP = "gap";
    public static final String UPPER_LIMIT = "upper_limit";
    public static final String LOWER_LIMIT = "lower_limit";
    public static final String INIT = "init";
    public static final String INC = "inc";
    public static final String SAFETY_AMOUNT = "safetyamount";

    /**
     * Expected market trend, +1 (up) or -1 (down)
     */
    @Builder.Default
    int trend = 1;

    @Builder.Default
    Mode mode = Mode.CHASE;

    /**
     * Distance between stepped thresholds
     */
    @Builder.Default
    double gap = 5;

    @Builder.Default
    double upperLimit = 1;

    @Builder.Default
    double lowerLimit = 0.5;

    /**
     * Size of the first confirmed chase trade
     */
    @Builder.Default
    double init = 50;

    /**
     * Size reduction applied per stacked trade
     */
    @Builder.Default
    double inc = 10;

    /**
     * Fixed size of safety trades
     */
    @Builder.Default
    double safetyAmount = 20;

    public enum Mode {
        /**
         * Grow the holding along the trend
         */
        CHASE("chase"),
        /**
         * Trade against the trend at turning points
         */
        SAFETY("safety");

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
            throw new IllegalArgumentException("Unsupported mode of operation: " + code);
        }
    }

    public static ChasingConfig defaults() {
        return builder().build();
    }

    public static ChasingConfig from(StrategyParameters parameters) {
        ChasingConfig config = ChasingConfig.builder()
                .trend(normalizeTrend(parameters.getString(TREND, "1")))
                .mode(Mode.fromCode(parameters.getString(MODE, Mode.CHASE.getCode())))
                .gap(parameters.getDouble(GAP, 5))
                .upperLimit(parameters.getDouble(UPPER_LIMIT, 1))
                .lowerLimit(parameters.getDouble(LOWER_LIMIT, 0.5))
                .init(parameters.getDouble(INIT, 50))
                .inc(parameters.getDouble(INC, 10))
                .safetyAmount(parameters.getDouble(SAFETY_AMOUNT, 20))
                .build();
        config.validate();
        return config;
    }

    /**
     * -1 stays -1, anything else becomes +1.
     */
    public static int normalizeTrend(double trend) {
        return trend == -1 ? -1 : 1;
    }

    /**
     * Text form of {@link #normalizeTrend(double)}; non-numeric values mean +1.
     */
    public static int normalizeTrend(String trend) {
        try {
            return normalizeTrend(Double.parseDouble(trend.trim()));
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    public void validate() {
        if (mode == null) {
            throw new IllegalArgumentException("Unsupported mode of operation: null");
        }
        if (trend != 1 && trend != -1) {
            throw new IllegalArgumentException(TREND + " must be +1 or -1: " + trend);
        }
        requirePositive(GAP, gap);
        requirePositive(UPPER_LIMIT, upperLimit);
        requirePositive(LOWER_LIMIT, lowerLimit);
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0)) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }
}
