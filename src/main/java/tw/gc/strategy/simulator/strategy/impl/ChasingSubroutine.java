package tw.gc.strategy.simulator.strategy.impl;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import tw.gc.strategy.simulator.instrument.Instrument;
import tw.gc.strategy.simulator.strategy.ArmState;
import tw.gc.strategy.simulator.strategy.PriceDirection;
import tw.gc.strategy.simulator.strategy.ReversalTrackingSubroutine;
import tw.gc.strategy.simulator.strategy.config.ChasingConfig;

import java.util.Objects;

/**
 * Follows the larger scale trend of the instrument using stepped price thresholds.
 *
 * <h3>Chase mode</h3>
 * Grows the holding along the expected trend. Crossing the next step arms a trade; a
 * further move of {@code upper_limit} (up) or {@code lower_limit} (down) confirms it. Each
 * confirmed trade is {@code init - stack * inc} units, floored at 0, so repeated trades
 * shrink. A retreat back across the step disarms without trading.
 *
 * <h3>Safety mode</h3>
 * Trades a fixed {@code safetyamount} against the trend. Breaking either step arms the
 * trade and re-centres the steps; it fires once the price comes back at least
 * {@code lower_limit} from the last extremum.
 *
 * Meant to run under a {@link ThresholdControl}. Does not consider shorting.
 */
@Slf4j
@Getter
public class ChasingSubroutine extends ReversalTrackingSubroutine {

    private final ChasingConfig config;

    private double nextStepUp;
    private double nextStepDown;
    private int stack;
    private ArmState armState = ArmState.IDLE;

    public ChasingSubroutine(Instrument instrument) {
        this(instrument, ChasingConfig.defaults());
    }

    public ChasingSubroutine(Instrument instrument, ChasingConfig config) {
        super(instrument);
        this.config = Objects.requireNonNull(config, "config");
        config.validate();
        this.nextStepUp = instrument.getPrice() + config.getGap();
        this.nextStepDown = instrument.getPrice() - config.getGap();
        log.info("[Chasing] Initialized: mode={}, trend={}, steps={}~{}, init={}",
                config.getMode().getCode(), config.getTrend(), nextStepDown, nextStepUp, config.getInit());
    }

    @Override
    protected double decide(double price, PriceDirection move) {
        boolean up = config.getTrend() == 1;
        double amount = switch (config.getMode()) {
            case CHASE -> up ? chaseUp(price) : chaseDown(price);
            case SAFETY -> up ? safetyUp(price, move) : safetyDown(price, move);
        };
        if (amount != 0) {
            log.info("[Chasing] {} {} units @ {} (stack={})",
                    amount > 0 ? "BUY" : "SELL", Math.abs(amount), price, stack);
        }
        return amount;
    }

    private double chaseUp(double price) {
        if (price >= nextStepUp) {
            armState = ArmState.ARMED_BUY;
        }
        if (price >= nextStepUp + config.getUpperLimit()) {
            if (armState == ArmState.ARMED_BUY) {
                double amount = stackedAmount();
                nextStepUp = price + config.getGap();
                armState = ArmState.IDLE;
                return amount;
            }
        } else if (price <= nextStepUp - config.getLowerLimit()) {
            armState = ArmState.IDLE;
        }
        return 0;
    }

    private double chaseDown(double price) {
        if (price <= nextStepDown) {
            armState = ArmState.ARMED_SELL;
        }
        if (price <= nextStepDown - config.getLowerLimit()) {
            if (armState == ArmState.ARMED_SELL) {
                double amount = -stackedAmount();
                nextStepDown = price - config.getGap();
                armState = ArmState.IDLE;
                return amount;
            }
        } else if (price >= nextStepDown + config.getUpperLimit()) {
            armState = ArmState.IDLE;
        }
        return 0;
    }

    /**
     * Size of the next confirmed chase trade; only a non-zero size counts as a stacked trade.
     */
    private double stackedAmount() {
        double amount = config.getInit() - stack * config.getInc();
        if (amount <= 0) {
            return 0;
        }
        stack++;
        return amount;
    }

    private double safetyUp(double price, PriceDirection move) {
        if (armState == ArmState.IDLE) {
            if (price >= nextStepUp) {
                armState = ArmState.ARMED_SELL;
                nextStepUp = price + config.getGap();
                nextStepDown = price - config.getGap();
            } else if (price <= nextStepDown) {
                armState = ArmState.ARMED_SELL;
                nextStepDown = price - config.getGap();
            }
        } else if (armState == ArmState.ARMED_SELL && move == PriceDirection.FALLING
                && getHigh() - price >= config.getLowerLimit()) {
            armState = ArmState.IDLE;
            return -config.getSafetyAmount();
        }
        return 0;
    }

    // Armed but not yet confirmed ticks fall through without a state change.
    private double safetyDown(double price, PriceDirection move) {
        if (armState == ArmState.IDLE) {
            if (price <= nextStepDown) {
                armState = ArmState.ARMED_BUY;
                nextStepUp = price + config.getGap();
                nextStepDown = price - config.getGap();
            } else if (price >= nextStepUp) {
                armState = ArmState.ARMED_BUY;
                nextStepUp = price + config.getGap();
            }
        } else if (armState == ArmState.ARMED_BUY && move == PriceDirection.RISING
                && price - getLow() >= config.getLowerLimit()) {
            armState = ArmState.IDLE;
            return config.getSafetyAmount();
        }
        return 0;
    }

    @Override
    public String getName() {
        return "chase";
    }
}
