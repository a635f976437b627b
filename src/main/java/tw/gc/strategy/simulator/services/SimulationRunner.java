package tw.gc.strategy.simulator.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import tw.gc.strategy.simulator.config.SimulatorProperties;
import tw.gc.strategy.simulator.instrument.PriceTick;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Replays the configured price feed once the application is up.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SimulationRunner {

    private final SimulatorProperties properties;
    private final PriceFeedLoader feedLoader;
    private final SimulationService simulationService;
    private final SimulationReportWriter reportWriter;

    @EventListener(ApplicationReadyEvent.class)
    public void runOnStartup() {
        if (properties.getFeedPath() == null || properties.getFeedPath().isBlank()) {
            log.info("No simulator.feed-path configured, nothing to replay");
            return;
        }
        try {
            run();
        } catch (PriceFeedException | IOException e) {
            log.error("❌ Simulation failed", e);
        }
    }

    public SimulationResult run() throws IOException {
        List<PriceTick> ticks = feedLoader.load(Path.of(properties.getFeedPath()));
        SimulationResult result = simulationService.run(SimulationRequest.from(properties), ticks);
        log.info("📊 {} [{}] {} → {}: fund={}, unit={}, orders={}", result.getSymbol(), result.getMode(),
                result.getPeriodStart(), result.getPeriodEnd(), result.getFinalFund(), result.getFinalUnit(),
                result.getOrdersBySource());
        if (properties.getReportPath() != null && !properties.getReportPath().isBlank()) {
            reportWriter.write(result, Path.of(properties.getReportPath()));
        }
        return result;
    }
}
