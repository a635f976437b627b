package tw.gc.strategy.simulator.services;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tw.gc.strategy.simulator.instrument.PriceTick;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads {@code timestamp,price} CSV files into price ticks.
 *
 * Timestamps may be ISO local date-times ({@code 2024-01-02T09:30:00}), the same with a
 * space separator, or plain dates. Blank lines and a leading header row are skipped;
 * extra columns are ignored.
 */
@Component
@Slf4j
public class PriceFeedLoader {

    private static final DateTimeFormatter SPACED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]");

    public List<PriceTick> load(Path path) {
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PriceFeedException("Cannot read price feed " + path, e);
        }
        List<PriceTick> ticks = parse(lines, path.toString());
        log.info("📈 Loaded {} ticks from {}", ticks.size(), path);
        return ticks;
    }

    public List<PriceTick> parse(List<String> lines, String source) {
        List<PriceTick> ticks = new ArrayList<>();
        boolean firstRow = true;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] parts = line.split(",");
            if (parts.length < 2) {
                throw new PriceFeedException(String.format("%s:%d: expected timestamp,price but got '%s'", source, i + 1, line));
            }
            if (firstRow) {
                firstRow = false;
                if (!isNumeric(parts[1].trim())) {
                    log.debug("Skipping header row of {}: {}", source, line);
                    continue;
                }
            }
            try {
                ticks.add(new PriceTick(parseTimestamp(parts[0].trim()), Double.parseDouble(parts[1].trim())));
            } catch (DateTimeParseException | NumberFormatException e) {
                throw new PriceFeedException(String.format("%s:%d: malformed row '%s'", source, i + 1, line), e);
            }
        }
        return ticks;
    }

    static LocalDateTime parseTimestamp(String text) {
        if (text.contains("T")) {
            return LocalDateTime.parse(text);
        }
        if (text.contains(" ")) {
            return LocalDateTime.parse(text, SPACED);
        }
        return LocalDate.parse(text).atStartOfDay();
    }

    private static boolean isNumeric(String text) {
        try {
            Double.parseDouble(text);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
