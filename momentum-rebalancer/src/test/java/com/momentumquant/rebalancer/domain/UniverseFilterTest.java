package com.momentumquant.rebalancer.domain;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the restriction and history filter, and the market-regime check.
 */
class UniverseFilterTest {

    private final List<LocalDate> days = SyntheticPrices.weekdays(LocalDate.of(2024, 3, 1), 25);
    private final LocalDate asOf = days.get(days.size() - 1);

    @Test
    void testFilter_ExcludesRestrictedAndShortHistory() {
        // Arrange
        PriceTable prices = SyntheticPrices.table(
                SyntheticPrices.flat("AAA", days, 10),
                SyntheticPrices.flat("BBB", days, 10),
                SyntheticPrices.flat("CCC", days.subList(15, 25), 10),
                SyntheticPrices.flat("DDD", days, 10));

        // Act
        EligibleUniverse eligible = new UniverseFilter(20)
                .filter(List.of("DDD", "AAA", "BBB", "CCC", "EEE"), asOf, Set.of("BBB"), prices);

        // Assert
        assertEquals(List.of("DDD", "AAA"), eligible.getSymbols(), "Universe order should be kept");
        assertEquals(ExclusionReason.RESTRICTED, eligible.getExcluded().get("BBB"));
        assertEquals(ExclusionReason.INSUFFICIENT_HISTORY, eligible.getExcluded().get("CCC"));
        assertEquals(ExclusionReason.INSUFFICIENT_HISTORY, eligible.getExcluded().get("EEE"));
    }

    @Test
    void testFilter_CountsOnlyBarsUpToTheDate() {
        // Arrange
        PriceTable prices = SyntheticPrices.table(SyntheticPrices.flat("AAA", days, 10));

        // Act
        EligibleUniverse early = new UniverseFilter(20).filter(List.of("AAA"), days.get(10), Set.of(), prices);
        EligibleUniverse late = new UniverseFilter(20).filter(List.of("AAA"), asOf, Set.of(), prices);

        // Assert
        assertTrue(early.isEmpty());
        assertTrue(late.contains("AAA"));
    }

    @Test
    void testFilter_RejectsNonPositiveHistory() {
        assertThrows(IllegalArgumentException.class, () -> new UniverseFilter(0));
    }

    @Test
    void testRegime_WeakWhenBenchmarkBelowAverage() {
        // Arrange
        PriceTable falling = SyntheticPrices.table(SyntheticPrices.trend("IDX", days, 100, -0.01));
        PriceTable rising = SyntheticPrices.table(SyntheticPrices.trend("IDX", days, 100, 0.01));
        MarketRegimeFilter regime = new MarketRegimeFilter("IDX", 10);

        // Act & Assert
        assertFalse(regime.isStrong(falling, asOf));
        assertTrue(regime.isStrong(rising, asOf));
    }

    @Test
    void testRegime_StrongWithoutBenchmarkData() {
        PriceTable prices = SyntheticPrices.table(SyntheticPrices.trend("IDX", days.subList(0, 5), 100, -0.01));

        assertTrue(new MarketRegimeFilter("IDX", 10).isStrong(prices, asOf), "Short history counts as strong");
        assertTrue(new MarketRegimeFilter(null, 10).isStrong(prices, asOf), "No benchmark configured");
    }
}
