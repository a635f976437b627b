package tw.gc.strategy.simulator.instrument;

import java.time.LocalDateTime;

/**
 * One (timestamp, price) observation.
 */
public record PriceTick(LocalDateTime timestamp, double price) {
}
