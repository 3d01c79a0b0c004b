package com.momentumquant.rebalancer.domain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for one rebalance step from prices to decision.
 */
class RebalancePlannerTest {

    private static final List<String> UNIVERSE = List.of("AAA", "BBB", "CCC", "DDD");

    private List<LocalDate> days;
    private LocalDate asOf;
    private RebalancePlanner planner;
    private Portfolio portfolio;

    @BeforeEach
    void setUp() {
        days = SyntheticPrices.weekdays(LocalDate.of(2024, 1, 1), 40);
        asOf = days.get(days.size() - 1);
        ScoringParameters scoring = ScoringParameters.builder()
                .returnLookbacks(List.of(5, 10, 15))
                .rsiLookbacks(List.of(5, 10, 15))
                .proximityLookback(20)
                .build();
        planner = new RebalancePlanner(WeightCandidate.of(0.8, 0.1, 0.1), scoring,
                RebalanceRules.builder().topN(2).band(0).build(), null, 200);
        portfolio = Portfolio.of(new BigDecimal("10000"), List.of(new Holding("AAA", 100, new BigDecimal("100"))));
    }

    @Test
    void testPlan_HeldLeaderMissingOneBarIsKept() {
        // Arrange - AAA leads but has no bar on the rebalance date
        PriceTable prices = prices(days.subList(0, days.size() - 1));

        // Act
        RebalancePlan plan = planner.plan(asOf, UNIVERSE, portfolio, prices, Set.of(), BigDecimal.ZERO);

        // Assert
        RebalanceDecision decision = plan.getDecision();
        assertEquals(RebalanceEvent.Outcome.EXECUTED, plan.getOutcome());
        assertTrue(decision.getSells().isEmpty(), "A one-day gap must not force an exit");
        assertEquals(1, plan.getRanking().find("AAA").orElseThrow().getRank(),
                "Ranked on its latest bar before the date");
        assertTrue(decision.getHolds().stream().anyMatch(h -> h.getSymbol().equals("AAA")));
        assertEquals(Set.of("BBB"), decision.buySymbols());
    }

    @Test
    void testPlan_HeldLeaderWithStaleDataIsKept() {
        // Arrange - AAA stopped printing two weeks ago
        PriceTable prices = prices(days.subList(0, days.size() - 10));

        // Act
        RebalancePlan plan = planner.plan(asOf, UNIVERSE, portfolio, prices, Set.of(), BigDecimal.ZERO);

        // Assert
        RebalanceDecision decision = plan.getDecision();
        assertEquals(ExclusionReason.NO_PRICE_ON_DATE, plan.getRanking().getExcluded().get("AAA"));
        assertTrue(decision.getSells().isEmpty());
        assertTrue(decision.getWarnings().stream().anyMatch(w -> w.startsWith("AAA not ranked")));
        assertFalse(decision.buySymbols().contains("AAA"), "An unranked holding is not topped up");
    }

    @Test
    void testPlan_RestrictedHoldingIsSold() {
        // Arrange
        PriceTable prices = prices(days);

        // Act
        RebalancePlan plan = planner.plan(asOf, UNIVERSE, portfolio, prices, Set.of("AAA"), BigDecimal.ZERO);

        // Assert
        RebalanceDecision decision = plan.getDecision();
        assertEquals(ExclusionReason.RESTRICTED, plan.getRanking().getExcluded().get("AAA"));
        assertEquals(1, decision.getSells().size());
        assertEquals("AAA", decision.getSells().get(0).getSymbol());
        assertEquals(RebalanceDecision.SellReason.NOT_RANKED, decision.getSells().get(0).getReason());
        assertEquals(Set.of("BBB", "CCC"), decision.buySymbols());
    }

    /**
     * AAA is the strongest trend and trades on the given days only; the
     * other names trade every day.
     */
    private PriceTable prices(List<LocalDate> aaaDays) {
        List<PriceBar> bars = new ArrayList<>(SyntheticPrices.trend("AAA", aaaDays, 100, 0.006));
        bars.addAll(SyntheticPrices.trend("BBB", days, 100, 0.002));
        bars.addAll(SyntheticPrices.trend("CCC", days, 100, 0.001));
        bars.addAll(SyntheticPrices.trend("DDD", days, 100, -0.002));
        return PriceTable.of(bars);
    }
}
