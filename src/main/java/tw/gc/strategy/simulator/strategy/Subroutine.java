package tw.gc.strategy.simulator.strategy;

import tw.gc.strategy.simulator.instrument.PriceTick;

import java.util.List;

/**
 * Contract shared by every decision unit of a strategy.
 *
 * A subroutine is a modular algorithm with internal state. It traces exactly one
 * instrument, is constructed once with its configuration, consumes per-tick updates and
 * emits a signed trade proposal:
 * <ul>
 *   <li>positive amount: buy that many units</li>
 *   <li>negative amount: sell that many units</li>
 *   <li>zero: no trade this tick</li>
 * </ul>
 *
 * Subroutines never execute orders themselves; the owning strategy does.
 */
public interface Subroutine {

    /**
     * Most recent proposal, 0 before the first update.
     */
    double output();

    /**
     * Name used for identification and logging
     */
    String getName();

    /**
     * Prices observed by this subroutine, oldest first. The first entry is the
     * instrument price at construction.
     */
    List<PriceTick> getPriceHistory();
}
