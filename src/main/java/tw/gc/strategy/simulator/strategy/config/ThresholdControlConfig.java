package tw.gc.strategy.simulator.strategy.config;

import lombok.Builder;
import lombok.Value;

/**
 * Settings of the threshold control.
 *
 * All four values are fractions in [0, 1].
 */
@Value
@Builder
public class ThresholdControlConfig {

    public static final String WINNING_PER = "winningPer";
    public static final String LOSING_PER = "losingPer";
    public static final String SELLING_PER_WIN = "sellingPerWin";
    public static final String SELLING_PER_LOSE = "sellingPerLose";

    /**
     * Gain over the baseline, as a fraction of it, that triggers profit taking
     */
    @Builder.Default
    double winningPer = 0.4;

    /**
     * Loss under the baseline, as a fraction of it, that triggers the stop loss
     */
    @Builder.Default
    double losingPer = 0.2;

    /**
     * Share of the holding to unwind on profit taking
     */
    @Builder.Default
    double sellingPerWin = 0.5;

    /**
     * Share of the holding to unwind on stop loss
     */
    @Builder.Default
    double sellingPerLose = 1.0;

    public static ThresholdControlConfig defaults() {
        return builder().build();
    }

    public static ThresholdControlConfig from(StrategyParameters parameters) {
        ThresholdControlConfig config = ThresholdControlConfig.builder()
                .winningPer(parameters.getDouble(WINNING_PER, 0.4))
                .losingPer(parameters.getDouble(LOSING_PER, 0.2))
                .sellingPerWin(parameters.getDouble(SELLING_PER_WIN, 0.5))
                .sellingPerLose(parameters.getDouble(SELLING_PER_LOSE, 1.0))
                .build();
        config.validate();
        return config;
    }

    public void validate() {
        requireFraction(WINNING_PER, winningPer);
        requireFraction(LOSING_PER, losingPer);
        requireFraction(SELLING_PER_WIN, sellingPerWin);
        requireFraction(SELLING_PER_LOSE, sellingPerLose);
    }

    private static void requireFraction(String name, double value) {
        if (!(value >= 0 && value <= 1)) {
            throw new IllegalArgumentException(name + " must be within [0, 1]: " + value);
        }
    }
}
