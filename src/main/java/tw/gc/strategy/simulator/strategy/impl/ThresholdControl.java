package tw.gc.strategy.simulator.strategy.impl;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import tw.gc.strategy.simulator.instrument.Instrument;
import tw.gc.strategy.simulator.instrument.PriceTick;
import tw.gc.strategy.simulator.strategy.Subroutine;
import tw.gc.strategy.simulator.strategy.config.ThresholdControlConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Risk reducing control that moves the holding towards neutral once the portfolio
 * gain crosses a profit-taking or stop-loss percentage.
 *
 * The gain is measured against a baseline {@code total0 = fund + unit * price} fixed at
 * construction (or at the last {@link #reset(double, double)}). When triggered, the control
 * proposes unwinding a share of the holding rather than closing it completely. The caller
 * is expected to reset the control after executing such a proposal.
 *
 * The control keeps its own unit ledger: each update adds the proposed delta to the last
 * recorded holding.
 */
@Slf4j
public class ThresholdControl implements Subroutine {

    private final Instrument instrument;
    @Getter
    private final ThresholdControlConfig config;

    @Getter
    private double total0;
    private double lastOutput;

    private final List<PriceTick> priceHistory = new ArrayList<>();
    private final List<Double> funds = new ArrayList<>();
    private final List<Double> units = new ArrayList<>();

    public ThresholdControl(Instrument instrument, double fund, double unit) {
        this(instrument, fund, unit, ThresholdControlConfig.defaults());
    }

    public ThresholdControl(Instrument instrument, double fund, double unit, ThresholdControlConfig config) {
        this.instrument = Objects.requireNonNull(instrument, "instrument");
        this.config = Objects.requireNonNull(config, "config");
        config.validate();
        reset(fund, unit);
    }

    /**
     * Anchor a fresh baseline to the given fund and holding and restart the histories.
     */
    public void reset(double fund, double unit) {
        priceHistory.clear();
        funds.clear();
        units.clear();
        priceHistory.add(currentTick());
        funds.add(fund);
        units.add(unit);
        total0 = fund + unit * instrument.getPrice();
        lastOutput = 0;
        log.debug("[ThresholdControl] Baseline set: total0={}, fund={}, unit={}", total0, fund, unit);
    }

    /**
     * Evaluate the portfolio after applying {@code deltaUnit} to the recorded holding.
     *
     * @param fund current cash
     * @param deltaUnit trade proposed by the primary subroutine this tick
     * @return signed units to trade towards neutral, or 0 when no threshold is crossed
     */
    public double update(double fund, double deltaUnit) {
        priceHistory.add(currentTick());
        double price = instrument.getPrice();
        double unit = units.get(units.size() - 1) + deltaUnit;
        if (unit == 0) {
            return emit(0);
        }

        double total = fund + unit * price;
        double gain = total - total0;
        double ratio = gain / total0;
        log.trace("[ThresholdControl] gain={}, total={}, fund={}, unit={}", gain, total, fund, unit);

        if (gain >= 0 && ratio >= config.getWinningPer()) {
            double delta = towardsNeutral(unit, config.getSellingPerWin());
            log.info("[ThresholdControl] Winning control: gain={} ({}), trading {} units", gain, ratio, delta);
            record(fund - delta * price, unit + delta);
            return emit(delta);
        } else if (gain <= 0 && Math.abs(ratio) >= config.getLosingPer()) {
            double delta = towardsNeutral(unit, config.getSellingPerLose());
            log.info("[ThresholdControl] Losing control: gain={} ({}), trading {} units", gain, ratio, delta);
            record(fund - delta * price, unit + delta);
            return emit(delta);
        }

        record(fund, unit);
        return emit(0);
    }

    /**
     * Signed share of {@code unit} that moves it towards zero, never past it.
     */
    static double towardsNeutral(double unit, double share) {
        double size = Math.min(Math.abs(unit), Math.abs(unit) * share);
        return unit > 0 ? -size : size;
    }

    private void record(double fund, double unit) {
        funds.add(fund);
        units.add(unit);
    }

    private double emit(double amount) {
        lastOutput = amount;
        return amount;
    }

    private PriceTick currentTick() {
        return new PriceTick(instrument.getTimestamp(), instrument.getPrice());
    }

    @Override
    public double output() {
        return lastOutput;
    }

    @Override
    public String getName() {
        return "thresholdcontrol";
    }

    @Override
    public List<PriceTick> getPriceHistory() {
        return Collections.unmodifiableList(priceHistory);
    }

    public List<Double> getFunds() {
        return Collections.unmodifiableList(funds);
    }

    public List<Double> getUnits() {
        return Collections.unmodifiableList(units);
    }

    public double getLastUnit() {
        return units.get(units.size() - 1);
    }
}
