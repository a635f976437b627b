package tw.gc.strategy.simulator.engine;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import tw.gc.strategy.simulator.instrument.Instrument;
import tw.gc.strategy.simulator.strategy.PriceSubroutine;
import tw.gc.strategy.simulator.strategy.config.ChasingConfig;
import tw.gc.strategy.simulator.strategy.config.StrategyParameters;
import tw.gc.strategy.simulator.strategy.config.ThresholdControlConfig;
import tw.gc.strategy.simulator.strategy.config.TurningPointConfig;
import tw.gc.strategy.simulator.strategy.impl.ChasingSubroutine;
import tw.gc.strategy.simulator.strategy.impl.ThresholdControl;
import tw.gc.strategy.simulator.strategy.impl.TurningPointSubroutine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Prototype strategy built from three subroutines:
 * <ol>
 *   <li>threshold management ({@link ThresholdControl})</li>
 *   <li>low resolution decremental chasing ({@link ChasingSubroutine})</li>
 *   <li>high resolution turning points ({@link TurningPointSubroutine})</li>
 * </ol>
 *
 * Each tick the subroutine selected by the {@link StrategyMode} proposes a trade, the
 * threshold control may override it, and the resulting amount is executed against the
 * fund and unit balances. Whenever the threshold control overrides, it is reset to a
 * baseline anchored to the post-trade balances.
 *
 * The instrument must be updated before each call to {@link #update()}.
 */
@Slf4j
@Getter
public class PrototypeStrategy {

    private final Instrument instrument;
    private final StrategyMode mode;
    private final double total0;

    private double fund;
    private double unit;

    private final ThresholdControl thresholdControl;
    private final ChasingSubroutine chasing;
    private final TurningPointSubroutine turningPoint;

    @Getter(AccessLevel.NONE)
    private final StrategyEventListener listener;
    @Getter(AccessLevel.NONE)
    private final List<StrategySnapshot> snapshots = new ArrayList<>();
    @Getter(AccessLevel.NONE)
    private final List<Order> orders = new ArrayList<>();

    public PrototypeStrategy(Instrument instrument, double fund, double unit, StrategyMode mode,
                             StrategyParameters parameters) {
        this(instrument, fund, unit, mode, parameters, new LoggingStrategyEventListener());
    }

    public PrototypeStrategy(Instrument instrument, double fund, double unit, StrategyMode mode,
                             StrategyParameters parameters, StrategyEventListener listener) {
        this(instrument, fund, unit, mode,
                ThresholdControlConfig.from(parameters),
                ChasingConfig.from(parameters),
                TurningPointConfig.from(parameters),
                listener);
    }

    public PrototypeStrategy(Instrument instrument, double fund, double unit, StrategyMode mode,
                             ThresholdControlConfig thresholdConfig, ChasingConfig chasingConfig,
                             TurningPointConfig turningConfig, StrategyEventListener listener) {
        this.instrument = Objects.requireNonNull(instrument, "instrument");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.fund = fund;
        this.unit = unit;
        this.total0 = fund + unit * instrument.getPrice();
        this.thresholdControl = new ThresholdControl(instrument, fund, unit, thresholdConfig);
        this.chasing = new ChasingSubroutine(instrument, chasingConfig);
        this.turningPoint = new TurningPointSubroutine(instrument, turningConfig);
        log.info("[Strategy] Initialized {} on {}: fund={}, unit={}, total0={}",
                mode.getCode(), instrument.getSymbol(), fund, unit, total0);
    }

    /**
     * Run one strategy step against the instrument's current price.
     *
     * @return signed quantity requested this tick, 0 when nothing was traded
     */
    public double update() {
        snapshots.add(new StrategySnapshot(instrument.getTimestamp(), instrument.getPrice(), fund, unit, getGain()));
        log.debug("[Strategy] Tick {} @ {}: fund={}, unit={}", instrument.getTimestamp(), instrument.getPrice(), fund, unit);

        double proposed = primary().update();
        double override = thresholdControl.update(fund, proposed);
        if (override == 0) {
            if (proposed != 0) {
                transact(proposed, OrderSource.of(mode));
            }
            return proposed;
        }

        listener.onThresholdTriggered(proposed, override, getGain());
        transact(override, OrderSource.THRESHOLD_CONTROL);
        thresholdControl.reset(fund, unit);
        return override;
    }

    /**
     * Trade {@code n} units at the current price, negative for a sale.
     *
     * When the fund cannot pay for the trade, the fund is spent completely on
     * {@code fund / price} units instead and drops to 0.
     */
    public Order transact(double n, OrderSource source) {
        double price = instrument.getPrice();
        double filled;
        if (fund - price * n <= 0) {
            filled = fund / price;
            listener.onFundsExhausted(n, filled, price);
            unit += filled;
            fund = 0;
        } else {
            filled = n;
            fund -= price * n;
            unit += n;
        }
        Order order = new Order(instrument.getTimestamp(), price, n, filled, source);
        orders.add(order);
        listener.onOrderExecuted(order, fund, unit);
        return order;
    }

    private PriceSubroutine primary() {
        return mode == StrategyMode.CHASE ? chasing : turningPoint;
    }

    /**
     * Portfolio value over the baseline at the current price.
     */
    public double getGain() {
        return fund + unit * instrument.getPrice() - total0;
    }

    public List<Order> getOrders() {
        return Collections.unmodifiableList(orders);
    }

    public List<StrategySnapshot> getSnapshots() {
        return Collections.unmodifiableList(snapshots);
    }
}
