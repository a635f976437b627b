package tw.gc.strategy.simulator.services;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import tw.gc.strategy.simulator.config.SimulatorProperties;
import tw.gc.strategy.simulator.engine.StrategyMode;
import tw.gc.strategy.simulator.instrument.InstrumentType;

import java.util.Map;

/**
 * Everything needed to replay a price series through a {@link tw.gc.strategy.simulator.engine.PrototypeStrategy}.
 */
@Value
@Builder
public class SimulationRequest {

    @Builder.Default
    int instrumentId = 0;
    @Builder.Default
    String instrumentName = "Instrument";
    @Builder.Default
    String symbol = "INST";
    @Builder.Default
    InstrumentType instrumentType = InstrumentType.STOCK;

    double fund;
    double unit;

    @Builder.Default
    StrategyMode mode = StrategyMode.CHASE;

    @Singular
    Map<String, Object> parameters;

    public static SimulationRequest from(SimulatorProperties properties) {
        SimulatorProperties.Instrument instrument = properties.getInstrument();
        return SimulationRequest.builder()
                .instrumentId(instrument.getId())
                .instrumentName(instrument.getName())
                .symbol(instrument.getSymbol())
                .instrumentType(InstrumentType.fromCode(instrument.getType()))
                .fund(properties.getFund())
                .unit(properties.getUnit())
                .mode(StrategyMode.fromCode(properties.getMode()))
                .parameters(properties.getParameters())
                .build();
    }
}
