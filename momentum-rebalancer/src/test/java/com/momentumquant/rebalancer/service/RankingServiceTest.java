package com.momentumquant.rebalancer.service;

import com.momentumquant.rebalancer.config.MomentumProperties;
import com.momentumquant.rebalancer.domain.ExclusionReason;
import com.momentumquant.rebalancer.domain.InMemoryPriceHistoryProvider;
import com.momentumquant.rebalancer.domain.PriceBar;
import com.momentumquant.rebalancer.domain.PriceTable;
import com.momentumquant.rebalancer.domain.RankedSymbol;
import com.momentumquant.rebalancer.domain.ScoringResult;
import com.momentumquant.rebalancer.domain.SyntheticPrices;
import com.momentumquant.rebalancer.domain.WeightCandidate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RankingService over in-memory prices.
 */
class RankingServiceTest {

    private static final LocalDate DATE = LocalDate.of(2024, 4, 30);

    private MomentumProperties properties;
    private RankingService rankingService;

    @BeforeEach
    void setUp() {
        List<LocalDate> days = SyntheticPrices.weekdaysBetween(LocalDate.of(2024, 1, 1), DATE);
        List<PriceBar> bars = new ArrayList<>();
        bars.addAll(SyntheticPrices.trend("UP", days, 100, 0.004));
        bars.addAll(SyntheticPrices.trend("FLAT", days, 100, 0.0));
        bars.addAll(SyntheticPrices.trend("DOWN", days, 100, -0.003));
        bars.addAll(SyntheticPrices.trend("HOT", days, 100, 0.006));
        bars.addAll(SyntheticPrices.trend("NEW", days.subList(days.size() - 5, days.size()), 100, 0.01));

        properties = new MomentumProperties();
        properties.setUniverse(List.of("UP", "FLAT", "DOWN", "HOT", "NEW"));
        properties.setReturnLookbacks(List.of(5, 10, 15));
        properties.setRsiLookbacks(List.of(5, 10, 15));
        properties.setProximityLookback(20);
        properties.setWarmupDays(60);

        rankingService = new RankingService(new InMemoryPriceHistoryProvider(PriceTable.of(bars)),
                date -> Set.of("HOT"), properties);
    }

    @Test
    void testRank_OrdersByCompositeAndReportsExclusions() {
        // Act
        ScoringResult result = rankingService.rank(DATE, null);

        // Assert
        assertEquals(List.of("UP", "FLAT", "DOWN"), result.getRanked().stream().map(RankedSymbol::getSymbol).toList());
        assertEquals(List.of(1, 2, 3), result.getRanked().stream().map(RankedSymbol::getRank).toList());
        assertEquals(ExclusionReason.RESTRICTED, result.getExcluded().get("HOT"));
        assertEquals(ExclusionReason.INSUFFICIENT_HISTORY, result.getExcluded().get("NEW"));
        assertEquals(WeightCandidate.of(0.8, 0.1, 0.1), result.getWeights(), "Configured weights by default");
        assertEquals(DATE, result.getAsOfDate());
    }

    @Test
    void testRank_UsesGivenWeights() {
        // Arrange
        WeightCandidate proximityOnly = WeightCandidate.of(0.0, 0.0, 1.0);

        // Act
        ScoringResult result = rankingService.rank(DATE, proximityOnly);

        // Assert
        assertEquals(proximityOnly, result.getWeights());
        assertEquals(3, result.size());
    }
}
