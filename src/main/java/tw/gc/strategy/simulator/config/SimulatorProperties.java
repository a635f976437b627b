package tw.gc.strategy.simulator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Component
@ConfigurationProperties(prefix = "simulator")
public class SimulatorProperties {

    private Instrument instrument = new Instrument();
    @Data
    public static class Instrument {
        private int id = 0;
        private String name = "Instrument";
        private String symbol = "INST";
        private String type = "stock";
    }

    /**
     * Initial cash
     */
    private double fund = 10000;

    /**
     * Initial holding
     */
    private double unit = 0;

    /**
     * "chase" or "turning"
     */
    private String mode = "chase";

    /**
     * Flat strategy parameters shared by all subroutines. Keys containing anything other
     * than lowercase letters, digits or '-' need bracket notation, e.g. {@code [upper_limit]}.
     */
    private Map<String, String> parameters = new LinkedHashMap<>();

    /**
     * CSV of timestamp,price to replay on startup; nothing runs when unset
     */
    private String feedPath;

    /**
     * Where to write the JSON report of the replay; not written when unset
     */
    private String reportPath;
}
