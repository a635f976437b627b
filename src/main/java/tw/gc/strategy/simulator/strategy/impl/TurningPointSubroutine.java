package tw.gc.strategy.simulator.strategy.impl;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import tw.gc.strategy.simulator.instrument.Instrument;
import tw.gc.strategy.simulator.strategy.PriceDirection;
import tw.gc.strategy.simulator.strategy.ReversalTrackingSubroutine;
import tw.gc.strategy.simulator.strategy.TradeSide;
import tw.gc.strategy.simulator.strategy.config.TurningPointConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Micro-manages small scale fluctuations by alternating buys and sells at turning points.
 *
 * A buy fires when the price has risen at least {@code h} above the last low, a sell when
 * it has fallen at least {@code h} below the last high; after each trade the pending side
 * flips. Trades feed a signed cash ledger ({@code gain}), and the realized gain, in units
 * of the current price, grows the buying size, the selling size or both depending on the
 * mode, by at most {@code n_delta} per trade.
 */
@Slf4j
@Getter
public class TurningPointSubroutine extends ReversalTrackingSubroutine {

    private final TurningPointConfig config;

    private TradeSide pendingSide;
    private double buying;
    private double selling;
    private double gain;
    private int tradeCount;

    @Getter(AccessLevel.NONE)
    private final List<Double> highs = new ArrayList<>();
    @Getter(AccessLevel.NONE)
    private final List<Double> lows = new ArrayList<>();
    @Getter(AccessLevel.NONE)
    private final List<Double> gains = new ArrayList<>();

    public TurningPointSubroutine(Instrument instrument) {
        this(instrument, TurningPointConfig.defaults());
    }

    public TurningPointSubroutine(Instrument instrument, TurningPointConfig config) {
        super(instrument);
        this.config = Objects.requireNonNull(config, "config");
        config.validate();
        this.pendingSide = config.getInitialSide();
        this.buying = config.getSize();
        this.selling = config.getSize();
        log.info("[TurningPoint] Initialized: mode={}, first={}, size={}, h={}",
                config.getMode().getCode(), pendingSide, config.getSize(), config.getReversalThreshold());
    }

    @Override
    protected double decide(double price, PriceDirection move) {
        double amount = 0;
        double h = config.getReversalThreshold();
        if (pendingSide == TradeSide.BUY && move == PriceDirection.RISING && price - getLow() >= h) {
            amount = buying;
        } else if (pendingSide == TradeSide.SELL && move == PriceDirection.FALLING && getHigh() - price >= h) {
            amount = -selling;
        }
        if (amount != 0) {
            gain -= amount * price;
            pendingSide = pendingSide.opposite();
        }
        gains.add(gain);

        if (amount != 0) {
            tradeCount++;
            adaptSizes(price);
            log.info("[TurningPoint] {} {} units @ {}, gain={}", amount > 0 ? "BUY" : "SELL",
                    Math.abs(amount), price, gain);
        }
        return amount;
    }

    private void adaptSizes(double price) {
        double delta = config.getSizeDelta();
        if (delta > gain / price) {
            delta = (long) (gain / price);
        }
        delta = Math.max(0, delta);
        log.debug("[TurningPoint] Size delta {} (gain/price={})", delta, gain / price);
        switch (config.getMode()) {
            case INCREASE -> buying += delta;
            case DECREASE -> selling += delta;
            case SIZE -> {
                buying += delta;
                selling += delta;
            }
        }
    }

    @Override
    protected void onHighRecorded(double high) {
        highs.add(high);
    }

    @Override
    protected void onLowRecorded(double low) {
        lows.add(low);
    }

    @Override
    public String getName() {
        return "turning";
    }

    public List<Double> getHighs() {
        return Collections.unmodifiableList(highs);
    }

    public List<Double> getLows() {
        return Collections.unmodifiableList(lows);
    }

    public List<Double> getGains() {
        return Collections.unmodifiableList(gains);
    }
}
