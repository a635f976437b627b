package tw.gc.strategy.simulator.services;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes simulation results as JSON.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SimulationReportWriter {

    private final ObjectMapper objectMapper;

    public void write(SimulationResult result, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(target.toFile(), result);
        log.info("📝 Simulation report written to {}", target);
    }

    public String toJson(SimulationResult result) throws IOException {
        return objectMapper.writeValueAsString(result);
    }
}
