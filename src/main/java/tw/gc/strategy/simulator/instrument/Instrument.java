package tw.gc.strategy.simulator.instrument;

import lombok.AccessLevel;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A stock or future together with its current price and the prices it has seen.
 *
 * <p>The instrument is shared by every subroutine of a strategy. Callers update it once
 * per tick, before the strategy step, so that all subroutines observe the same price.
 * Timestamps are expected to be non-decreasing; this is not checked.
 */
@Getter
public class Instrument {

    private final int id;
    private final String name;
    private final String symbol;
    private final InstrumentType type;

    private double price = Double.NaN;
    private LocalDateTime timestamp;

    @Getter(AccessLevel.NONE)
    private final List<PriceTick> history = new ArrayList<>();

    public Instrument(int id, String name, String symbol) {
        this(id, name, symbol, InstrumentType.STOCK);
    }

    public Instrument(int id, String name, String symbol, InstrumentType type) {
        if (id < 0) {
            throw new IllegalArgumentException("Instrument id is invalid: " + id);
        }
        if (type == null) {
            throw new IllegalArgumentException("Type of instrument is not supported: null");
        }
        this.id = id;
        this.name = name;
        this.symbol = symbol;
        this.type = type;
    }

    /**
     * Set the current price and timestamp and append them to the history.
     */
    public void update(LocalDateTime timestamp, double price) {
        this.price = price;
        this.timestamp = timestamp;
        history.add(new PriceTick(timestamp, price));
    }

    public void update(PriceTick tick) {
        Objects.requireNonNull(tick, "tick");
        update(tick.timestamp(), tick.price());
    }

    /**
     * Prices seen so far, oldest first.
     */
    public List<PriceTick> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public PriceTick getLastTick() {
        return history.isEmpty() ? null : history.get(history.size() - 1);
    }

    /**
     * Lowest recorded price, NaN before the first update.
     */
    public double getLowPrice() {
        return history.stream().mapToDouble(PriceTick::price).min().orElse(Double.NaN);
    }

    /**
     * Highest recorded price, NaN before the first update.
     */
    public double getHighPrice() {
        return history.stream().mapToDouble(PriceTick::price).max().orElse(Double.NaN);
    }

    @Override
    public String toString() {
        return String.format("[I][%s,%d][%s] %s: %s @ %s, %s~%s",
                type.getCode(), id, symbol, name, price, timestamp, getLowPrice(), getHighPrice());
    }
}
