package tw.gc.strategy.simulator.instrument;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class InstrumentTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 1, 2, 9, 30);

    @Test
    void testNeverUpdated_PriceIsNaN() {
        Instrument instrument = new Instrument(1, "Taiwan Semiconductor", "2330.TW");

        assertTrue(Double.isNaN(instrument.getPrice()));
        assertNull(instrument.getTimestamp());
        assertTrue(instrument.getHistory().isEmpty());
        assertNull(instrument.getLastTick());
        assertTrue(Double.isNaN(instrument.getLowPrice()));
    }

    @Test
    void testUpdate_SetsPriceAndAppendsHistory() {
        Instrument instrument = new Instrument(1, "Taiwan Semiconductor", "2330.TW");

        instrument.update(T0, 580.0);
        instrument.update(T0.plusMinutes(1), 582.5);

        assertEquals(582.5, instrument.getPrice());
        assertEquals(T0.plusMinutes(1), instrument.getTimestamp());
        assertEquals(2, instrument.getHistory().size());
        assertEquals(new PriceTick(T0.plusMinutes(1), 582.5), instrument.getLastTick());
        assertEquals(new PriceTick(T0, 580.0), instrument.getHistory().get(0));
    }

    @Test
    void testUpdateWithTick() {
        Instrument instrument = new Instrument(3, "Mini TAIEX", "MTXF", InstrumentType.FUTURE);

        instrument.update(new PriceTick(T0, 17000.0));

        assertEquals(17000.0, instrument.getPrice());
        assertEquals(InstrumentType.FUTURE, instrument.getType());
    }

    @Test
    void testLowAndHighPrice() {
        Instrument instrument = new Instrument(1, "Taiwan Semiconductor", "2330.TW");
        instrument.update(T0, 100.0);
        instrument.update(T0.plusMinutes(1), 97.0);
        instrument.update(T0.plusMinutes(2), 104.0);

        assertEquals(97.0, instrument.getLowPrice());
        assertEquals(104.0, instrument.getHighPrice());
    }

    @Test
    void testHistoryIsReadOnly() {
        Instrument instrument = new Instrument(1, "Taiwan Semiconductor", "2330.TW");
        instrument.update(T0, 100.0);

        assertThrows(UnsupportedOperationException.class,
                () -> instrument.getHistory().add(new PriceTick(T0, 1.0)));
    }

    @Test
    void testNegativeId_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Instrument(-1, "Bad", "BAD"));
    }

    @Test
    void testNullType_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Instrument(1, "Bad", "BAD", null));
    }

    @Test
    void testTypeFromCode() {
        assertEquals(InstrumentType.STOCK, InstrumentType.fromCode("stock"));
        assertEquals(InstrumentType.FUTURE, InstrumentType.fromCode("FUTURE"));
        assertThrows(IllegalArgumentException.class, () -> InstrumentType.fromCode("bond"));
        assertThrows(IllegalArgumentException.class, () -> InstrumentType.fromCode(null));
    }

    @Test
    void testToString() {
        Instrument instrument = new Instrument(7, "MediaTek", "2454.TW");
        instrument.update(T0, 1000.0);

        String text = instrument.toString();

        assertTrue(text.startsWith("[I][stock,7][2454.TW] MediaTek: 1000.0"));
        assertTrue(text.contains("1000.0~1000.0"));
    }
}
