package tw.gc.strategy.simulator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StrategySimulatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(StrategySimulatorApplication.class, args);
    }
}
