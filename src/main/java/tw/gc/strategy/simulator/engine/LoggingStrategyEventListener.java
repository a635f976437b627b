package tw.gc.strategy.simulator.engine;

import lombok.extern.slf4j.Slf4j;

/**
 * Default listener writing strategy events to the log.
 */
@Slf4j
public class LoggingStrategyEventListener implements StrategyEventListener {

    @Override
    public void onOrderExecuted(Order order, double fund, double unit) {
        log.info("[Strategy] {} {} @ {} [{}] -> fund={}, unit={}",
                order.isBuy() ? "BUY" : "SELL", Math.abs(order.filledQuantity()), order.price(),
                order.source().getTag(), fund, unit);
    }

    @Override
    public void onFundsExhausted(double requested, double filled, double price) {
        log.warn("[Strategy] Running out of funds when trying to transact {} @ {}, filled {}",
                requested, price, filled);
    }

    @Override
    public void onThresholdTriggered(double proposed, double override, double gain) {
        log.info("[Strategy] Threshold control override: proposed={}, override={}, gain={}",
                proposed, override, gain);
    }
}
