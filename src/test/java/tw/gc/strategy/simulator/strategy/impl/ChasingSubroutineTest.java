package tw.gc.strategy.simulator.strategy.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tw.gc.strategy.simulator.instrument.Instrument;
import tw.gc.strategy.simulator.strategy.ArmState;
import tw.gc.strategy.simulator.strategy.PriceDirection;
import tw.gc.strategy.simulator.strategy.config.ChasingConfig;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ChasingSubroutine")
class ChasingSubroutineTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 1, 2, 9, 0);

    private Instrument instrument;
    private int minute;

    @BeforeEach
    void setUp() {
        instrument = new Instrument(1, "Taiwan Semiconductor", "2330.TW");
        minute = 0;
        instrument.update(T0, 100.0);
    }

    private List<Double> feed(ChasingSubroutine chasing, double... prices) {
        List<Double> out = new ArrayList<>();
        for (double price : prices) {
            instrument.update(T0.plusMinutes(++minute), price);
            out.add(chasing.update());
        }
        return out;
    }

    private ChasingSubroutine chase(int trend, double init, double inc) {
        return new ChasingSubroutine(instrument, ChasingConfig.builder()
                .trend(trend).gap(5).upperLimit(1).lowerLimit(0.5).init(init).inc(inc)
                .build());
    }

    private ChasingSubroutine safety(int trend) {
        return new ChasingSubroutine(instrument, ChasingConfig.builder()
                .mode(ChasingConfig.Mode.SAFETY).trend(trend).gap(5).upperLimit(1).lowerLimit(0.5)
                .safetyAmount(20)
                .build());
    }

    @Test
    @DisplayName("steps start one gap around the construction price")
    void initialSteps() {
        ChasingSubroutine chasing = chase(1, 50, 10);

        assertThat(chasing.getNextStepUp()).isEqualTo(105.0);
        assertThat(chasing.getNextStepDown()).isEqualTo(95.0);
        assertThat(chasing.getArmState()).isEqualTo(ArmState.IDLE);
        assertThat(chasing.getDirection()).isEqualTo(PriceDirection.UNSET);
        assertThat(chasing.getName()).isEqualTo("chase");
    }

    @Nested
    @DisplayName("chase mode, rising trend")
    class ChaseUp {

        @Test
        @DisplayName("buys once when price clears the step by upper_limit")
        void confirmsBuy() {
            ChasingSubroutine chasing = chase(1, 50, 10);

            List<Double> out = feed(chasing, 102, 104, 106, 111);

            assertThat(out).containsExactly(0.0, 0.0, 50.0, 0.0);
            assertThat(chasing.getStack()).isEqualTo(1);
            assertThat(chasing.getNextStepUp()).isEqualTo(111.0);
            assertThat(chasing.getArmState()).isEqualTo(ArmState.ARMED_BUY);
        }

        @Test
        @DisplayName("stacked buys shrink by inc")
        void stackedBuysShrink() {
            ChasingSubroutine chasing = chase(1, 50, 10);

            List<Double> out = feed(chasing, 102, 104, 106, 111, 112);

            assertThat(out).containsExactly(0.0, 0.0, 50.0, 0.0, 40.0);
            assertThat(chasing.getStack()).isEqualTo(2);
            assertThat(chasing.getNextStepUp()).isEqualTo(117.0);
        }

        @Test
        @DisplayName("exhausted size still advances the step without stacking")
        void sizeFloorsAtZero() {
            ChasingSubroutine chasing = chase(1, 10, 10);

            List<Double> out = feed(chasing, 102, 104, 106, 112);

            assertThat(out).containsExactly(0.0, 0.0, 10.0, 0.0);
            assertThat(chasing.getStack()).isEqualTo(1);
            assertThat(chasing.getNextStepUp()).isEqualTo(117.0);
            assertThat(chasing.getArmState()).isEqualTo(ArmState.IDLE);
        }

        @Test
        @DisplayName("retreat below the step disarms")
        void retreatDisarms() {
            ChasingSubroutine chasing = chase(1, 50, 10);

            feed(chasing, 102, 105);
            assertThat(chasing.getArmState()).isEqualTo(ArmState.ARMED_BUY);

            assertThat(feed(chasing, 104.4)).containsExactly(0.0);
            assertThat(chasing.getArmState()).isEqualTo(ArmState.IDLE);
            assertThat(chasing.getHigh()).isEqualTo(105.0);
        }
    }

    @Test
    @DisplayName("chase mode, falling trend sells on the way down")
    void chaseDown() {
        ChasingSubroutine chasing = chase(-1, 50, 10);

        List<Double> out = feed(chasing, 98, 96, 94);

        assertThat(out).containsExactly(0.0, 0.0, -50.0);
        assertThat(chasing.getStack()).isEqualTo(1);
        assertThat(chasing.getNextStepDown()).isEqualTo(89.0);
        assertThat(chasing.output()).isEqualTo(-50.0);
    }

    @Nested
    @DisplayName("safety mode")
    class Safety {

        @Test
        @DisplayName("rising trend sells a fixed amount after a pullback from the high")
        void sellsAfterPullback() {
            ChasingSubroutine chasing = safety(1);

            List<Double> out = feed(chasing, 102, 106);
            assertThat(out).containsExactly(0.0, 0.0);
            assertThat(chasing.getArmState()).isEqualTo(ArmState.ARMED_SELL);
            assertThat(chasing.getNextStepUp()).isEqualTo(111.0);
            assertThat(chasing.getNextStepDown()).isEqualTo(101.0);

            assertThat(feed(chasing, 107, 106)).containsExactly(0.0, -20.0);
            assertThat(chasing.getHigh()).isEqualTo(107.0);
            assertThat(chasing.getArmState()).isEqualTo(ArmState.IDLE);
        }

        @Test
        @DisplayName("breaking the lower step also arms, moving only that step")
        void lowerStepArms() {
            ChasingSubroutine chasing = safety(1);

            feed(chasing, 98, 94);

            assertThat(chasing.getArmState()).isEqualTo(ArmState.ARMED_SELL);
            assertThat(chasing.getNextStepUp()).isEqualTo(105.0);
            assertThat(chasing.getNextStepDown()).isEqualTo(89.0);
        }

        @Test
        @DisplayName("falling trend buys a fixed amount after a bounce from the low")
        void buysAfterBounce() {
            ChasingSubroutine chasing = safety(-1);

            List<Double> out = feed(chasing, 98, 94, 93, 94);

            assertThat(out).containsExactly(0.0, 0.0, 0.0, 20.0);
            assertThat(chasing.getLow()).isEqualTo(93.0);
            assertThat(chasing.getArmState()).isEqualTo(ArmState.IDLE);
        }

        @Test
        @DisplayName("falling trend stays armed while the price keeps falling")
        void armedWhileFalling() {
            ChasingSubroutine chasing = safety(-1);

            feed(chasing, 98, 94, 93, 92);

            assertThat(chasing.getArmState()).isEqualTo(ArmState.ARMED_BUY);
            assertThat(chasing.getNextStepDown()).isEqualTo(89.0);
        }
    }

    @Test
    @DisplayName("first move and flat ticks never trade nor change state")
    void flatTicksAreNoOps() {
        ChasingSubroutine chasing = chase(1, 50, 10);

        assertThat(feed(chasing, 100)).containsExactly(0.0);
        assertThat(chasing.getDirection()).isEqualTo(PriceDirection.UNSET);

        assertThat(feed(chasing, 106)).containsExactly(0.0);
        assertThat(chasing.getDirection()).isEqualTo(PriceDirection.RISING);
        assertThat(chasing.getArmState()).isEqualTo(ArmState.IDLE);

        assertThat(feed(chasing, 106, 106)).containsExactly(0.0, 0.0);
        assertThat(chasing.getArmState()).isEqualTo(ArmState.IDLE);
        assertThat(chasing.getStack()).isZero();
        assertThat(chasing.getNextStepUp()).isEqualTo(105.0);
        assertThat(chasing.getPriceHistory()).hasSize(5);
    }
}
