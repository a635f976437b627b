package tw.gc.strategy.simulator.strategy;

/**
 * A subroutine driven purely by the instrument price.
 */
public interface PriceSubroutine extends Subroutine {

    /**
     * Observe the instrument's current price and return the proposal for this tick.
     *
     * @return signed number of units to trade, 0 for no trade
     */
    double update();
}
