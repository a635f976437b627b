package tw.gc.strategy.simulator.engine;

import java.time.LocalDateTime;

/**
 * An executed trade.
 *
 * @param timestamp instrument time of execution
 * @param price execution price
 * @param quantity signed quantity requested, negative for a sale
 * @param filledQuantity signed quantity actually added to the holding; differs from
 *                       {@code quantity} only when the trade was clipped for lack of funds
 * @param source which part of the strategy asked for the trade
 */
public record Order(LocalDateTime timestamp, double price, double quantity, double filledQuantity,
                    OrderSource source) {

    public boolean isBuy() {
        return quantity > 0;
    }

    public boolean isClipped() {
        return quantity != filledQuantity;
    }
}
