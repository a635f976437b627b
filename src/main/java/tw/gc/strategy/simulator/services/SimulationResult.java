package tw.gc.strategy.simulator.services;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import tw.gc.strategy.simulator.engine.Order;
import tw.gc.strategy.simulator.engine.StrategySnapshot;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Outcome of replaying a price series through a strategy.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimulationResult {

    private String symbol;
    private String mode;

    private LocalDateTime periodStart;
    private LocalDateTime periodEnd;
    private int ticks;

    private double initialFund;
    private double initialUnit;
    private double total0;

    private double finalFund;
    private double finalUnit;
    private double finalPrice;

    /**
     * Final portfolio value minus the baseline
     */
    private double gain;

    /**
     * Gain as a percentage of the baseline
     */
    private double returnPct;

    /**
     * Executed order count per source tag
     */
    private Map<String, Long> ordersBySource;

    private List<Order> orders;
    private List<StrategySnapshot> snapshots;

    public int getTotalOrders() {
        return orders == null ? 0 : orders.size();
    }
}
