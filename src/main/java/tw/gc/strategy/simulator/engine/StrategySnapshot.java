package tw.gc.strategy.simulator.engine;

import java.time.LocalDateTime;

/**
 * Strategy state at the start of one tick, before any trade of that tick.
 */
public record StrategySnapshot(LocalDateTime timestamp, double price, double fund, double unit, double gain) {
}
