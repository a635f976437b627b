package tw.gc.strategy.simulator.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.strategy.simulator.engine.Order;
import tw.gc.strategy.simulator.engine.PrototypeStrategy;
import tw.gc.strategy.simulator.engine.StrategyEventListener;
import tw.gc.strategy.simulator.instrument.Instrument;
import tw.gc.strategy.simulator.instrument.PriceTick;
import tw.gc.strategy.simulator.strategy.config.StrategyParameters;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Replays historical ticks through a {@link PrototypeStrategy}.
 *
 * The first tick only seeds the instrument, so the strategy's baseline and the
 * subroutines' initial steps are anchored to it. Every following tick updates the
 * instrument and then runs one strategy step.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SimulationService {

    private final StrategyEventListener listener;

    public SimulationResult run(SimulationRequest request, List<PriceTick> ticks) {
        if (ticks == null || ticks.isEmpty()) {
            throw new IllegalArgumentException("No price ticks to replay");
        }

        Instrument instrument = new Instrument(request.getInstrumentId(), request.getInstrumentName(),
                request.getSymbol(), request.getInstrumentType());
        instrument.update(ticks.get(0));

        PrototypeStrategy strategy = new PrototypeStrategy(instrument, request.getFund(), request.getUnit(),
                request.getMode(), StrategyParameters.of(request.getParameters()), listener);

        log.info("🚀 Starting simulation of {} [{}] over {} ticks", instrument.getSymbol(),
                request.getMode().getCode(), ticks.size());

        for (PriceTick tick : ticks.subList(1, ticks.size())) {
            instrument.update(tick);
            strategy.update();
        }

        SimulationResult result = summarize(request, ticks, instrument, strategy);
        log.info("✅ Simulation of {} completed: {} orders, gain={} ({}%)", result.getSymbol(),
                result.getTotalOrders(), result.getGain(), String.format("%.2f", result.getReturnPct()));
        return result;
    }

    private SimulationResult summarize(SimulationRequest request, List<PriceTick> ticks,
                                       Instrument instrument, PrototypeStrategy strategy) {
        List<Order> orders = strategy.getOrders();
        Map<String, Long> bySource = orders.stream()
                .collect(Collectors.groupingBy(o -> o.source().getTag(), LinkedHashMap::new, Collectors.counting()));
        double total0 = strategy.getTotal0();
        double gain = strategy.getGain();

        return SimulationResult.builder()
                .symbol(instrument.getSymbol())
                .mode(request.getMode().getCode())
                .periodStart(ticks.get(0).timestamp())
                .periodEnd(ticks.get(ticks.size() - 1).timestamp())
                .ticks(ticks.size())
                .initialFund(request.getFund())
                .initialUnit(request.getUnit())
                .total0(total0)
                .finalFund(strategy.getFund())
                .finalUnit(strategy.getUnit())
                .finalPrice(instrument.getPrice())
                .gain(gain)
                .returnPct(total0 != 0 ? gain / total0 * 100 : 0.0)
                .ordersBySource(bySource)
                .orders(orders)
                .snapshots(strategy.getSnapshots())
                .build();
    }
}
