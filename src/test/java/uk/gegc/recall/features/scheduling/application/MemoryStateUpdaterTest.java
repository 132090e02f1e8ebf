package uk.gegc.recall.features.scheduling.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.recall.BaseUnitTest;
import uk.gegc.recall.features.scheduling.config.SchedulingProperties;
import uk.gegc.recall.features.scheduling.domain.model.MemoryUpdate;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MemoryStateUpdater")
class MemoryStateUpdaterTest extends BaseUnitTest {

    private final MemoryStateUpdater updater = new MemoryStateUpdater(new SchedulingProperties());

    @Test
    @DisplayName("correct answer grows stability and eases difficulty")
    void update_correct() {
        MemoryUpdate result = updater.update(10.0, 5.0, 0.9, true);

        assertTrue(result.stability() > 10.0);
        assertEquals(5.0 - 0.6 * 4.0 / 9.0, result.difficulty(), 1e-9);
    }

    @Test
    @DisplayName("recall at lower retrievability grows stability more")
    void update_lowerRetrievabilityGrowsMore() {
        double nearlyForgotten = updater.update(10.0, 5.0, 0.4, true).stability();
        double fresh = updater.update(10.0, 5.0, 0.95, true).stability();

        assertTrue(nearlyForgotten > fresh);
    }

    @Test
    @DisplayName("harder cards grow stability less")
    void update_higherDifficultyGrowsLess() {
        double easy = updater.update(10.0, 2.0, 0.9, true).stability();
        double hard = updater.update(10.0, 9.0, 0.9, true).stability();

        assertTrue(easy > hard);
    }

    @Test
    @DisplayName("incorrect answer shrinks stability and raises difficulty")
    void update_incorrect() {
        MemoryUpdate result = updater.update(10.0, 5.0, 0.5, false);

        assertEquals(3.0, result.stability(), 1e-9);
        assertEquals(5.0 + 2.0 * 5.0 / 9.0, result.difficulty(), 1e-9);
    }

    @Test
    @DisplayName("repeated lapses never drive stability to zero or NaN")
    void update_stabilityFloor() {
        double s = 50.0;
        double d = 5.0;
        for (int i = 0; i < 100; i++) {
            MemoryUpdate next = updater.update(s, d, 0.3, false);
            s = next.stability();
            d = next.difficulty();
            assertFalse(Double.isNaN(s));
            assertTrue(s >= 0.1);
            assertTrue(d <= 10.0);
        }
        assertEquals(0.1, s, 1e-12);
    }

    @Test
    @DisplayName("repeated recalls stay within the stability ceiling")
    void update_stabilityCeiling() {
        double s = 30000.0;
        for (int i = 0; i < 20; i++) {
            s = updater.update(s, 1.0, 0.0, true).stability();
        }
        assertEquals(36500.0, s, 1e-9);
    }

    @Test
    @DisplayName("NaN inputs are clamped to safe values")
    void clamp_nan() {
        assertEquals(0.1, updater.clampStability(Double.NaN));
        assertEquals(10.0, updater.clampDifficulty(Double.NaN));

        MemoryUpdate result = updater.update(Double.NaN, Double.NaN, Double.NaN, true);
        assertFalse(Double.isNaN(result.stability()));
        assertFalse(Double.isNaN(result.difficulty()));
    }

    @Test
    @DisplayName("range checks follow configured bounds")
    void rangeChecks() {
        assertTrue(updater.isStabilityInRange(0.1));
        assertFalse(updater.isStabilityInRange(0.0));
        assertTrue(updater.isDifficultyInRange(10.0));
        assertFalse(updater.isDifficultyInRange(10.5));
    }
}
