package tw.gc.strategy.simulator.strategy.config;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class StrategyParametersTest {

    @Test
    void numbersAndNumericTextBecomeDoubles() {
        StrategyParameters parameters = StrategyParameters.of(Map.of(
                "gap", 5,
                "h", " 1.5 ",
                "inc", 10L));

        assertThat(parameters.asMap())
                .containsEntry("gap", 5.0)
                .containsEntry("h", 1.5)
                .containsEntry("inc", 10.0);
        assertThat(parameters.getDouble("h", 0)).isEqualTo(1.5);
    }

    @Test
    void nonNumericTextIsKeptTrimmed() {
        StrategyParameters parameters = StrategyParameters.of(Map.of("mode_chase", " safety "));

        assertThat(parameters.getString("mode_chase", "chase")).isEqualTo("safety");
    }

    @Test
    void collectionsContributeTheirFirstElement() {
        StrategyParameters parameters = StrategyParameters.of(Map.of(
                "gap", List.of("7", "9"),
                "mode_turning", new String[]{"size"}));

        assertThat(parameters.getDouble("gap", 0)).isEqualTo(7.0);
        assertThat(parameters.getString("mode_turning", null)).isEqualTo("size");
    }

    @Test
    void nullsAndEmptyCollectionsAreDropped() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("gap", null);
        raw.put("inc", List.of());
        raw.put("init", 30);

        StrategyParameters parameters = StrategyParameters.of(raw);

        assertThat(parameters.size()).isEqualTo(1);
        assertThat(parameters.contains("gap")).isFalse();
        assertThat(parameters.contains("inc")).isFalse();
        assertThat(parameters.getDouble("gap", 5)).isEqualTo(5.0);
    }

    @Test
    void missingKeysFallBackToDefaults() {
        StrategyParameters parameters = StrategyParameters.of(null);

        assertThat(parameters).isSameAs(StrategyParameters.empty());
        assertThat(parameters.getDouble("gap", 5)).isEqualTo(5.0);
        assertThat(parameters.getString("mode_chase", "chase")).isEqualTo("chase");
    }

    @Test
    void textWhereNumberExpectedIsRejected() {
        StrategyParameters parameters = StrategyParameters.of(Map.of("gap", "wide"));

        assertThatThrownBy(() -> parameters.getDouble("gap", 5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("gap");
    }

    @Test
    void numbersRenderBackToText() {
        StrategyParameters parameters = StrategyParameters.of(Map.of("mode_chase", 1));

        assertThat(parameters.getString("mode_chase", "chase")).isEqualTo("1.0");
    }
}
