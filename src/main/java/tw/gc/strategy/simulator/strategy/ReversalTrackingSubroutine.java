package tw.gc.strategy.simulator.strategy;

import lombok.AccessLevel;
import lombok.Getter;
import tw.gc.strategy.simulator.instrument.Instrument;
import tw.gc.strategy.simulator.instrument.PriceTick;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base for subroutines that react to local price reversals.
 *
 * Each update compares the instrument price with the previously observed one:
 * <ol>
 *   <li>unchanged price: no-op tick, returns 0</li>
 *   <li>first observed move: remembers the direction, returns 0</li>
 *   <li>rise turning into a fall: the previous price becomes the local high</li>
 *   <li>fall turning into a rise: the previous price becomes the local low</li>
 * </ol>
 * and then delegates the trading decision to {@link #decide(double, PriceDirection)}.
 *
 * Extrema are NaN until the first reversal, so any comparison against them fails.
 */
@Getter
public abstract class ReversalTrackingSubroutine implements PriceSubroutine {

    protected final Instrument instrument;

    private PriceDirection direction = PriceDirection.UNSET;
    private double high = Double.NaN;
    private double low = Double.NaN;
    private double lastOutput;

    @Getter(AccessLevel.NONE)
    private final List<PriceTick> priceHistory = new ArrayList<>();

    protected ReversalTrackingSubroutine(Instrument instrument) {
        this.instrument = Objects.requireNonNull(instrument, "instrument");
        priceHistory.add(new PriceTick(instrument.getTimestamp(), instrument.getPrice()));
    }

    @Override
    public final double update() {
        double price = instrument.getPrice();
        double previous = priceHistory.get(priceHistory.size() - 1).price();
        priceHistory.add(new PriceTick(instrument.getTimestamp(), price));

        PriceDirection move = PriceDirection.between(previous, price);
        if (move == PriceDirection.UNSET) {
            return emit(0);
        }
        if (direction == PriceDirection.UNSET) {
            direction = move;
            return emit(0);
        }
        if (direction.peaksInto(move)) {
            high = previous;
            onHighRecorded(previous);
        } else if (direction.bottomsInto(move)) {
            low = previous;
            onLowRecorded(previous);
        }
        direction = move;
        return emit(decide(price, move));
    }

    /**
     * Trading decision for a tick that moved the price.
     *
     * @param price current price
     * @param move direction of the move that led to it
     * @return signed proposal, 0 for no trade
     */
    protected abstract double decide(double price, PriceDirection move);

    protected void onHighRecorded(double high) {
    }

    protected void onLowRecorded(double low) {
    }

    @Override
    public double output() {
        return lastOutput;
    }

    @Override
    public List<PriceTick> getPriceHistory() {
        return Collections.unmodifiableList(priceHistory);
    }

    private double emit(double amount) {
        lastOutput = amount;
        return amount;
    }
}
