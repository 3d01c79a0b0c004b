package com.momentumquant.rebalancer.service;

import com.momentumquant.rebalancer.config.MomentumProperties;
import com.momentumquant.rebalancer.domain.EligibleUniverse;
import com.momentumquant.rebalancer.domain.MomentumScorer;
import com.momentumquant.rebalancer.domain.PriceHistoryProvider;
import com.momentumquant.rebalancer.domain.PriceTable;
import com.momentumquant.rebalancer.domain.RestrictionListProvider;
import com.momentumquant.rebalancer.domain.ScoringParameters;
import com.momentumquant.rebalancer.domain.ScoringResult;
import com.momentumquant.rebalancer.domain.UniverseFilter;
import com.momentumquant.rebalancer.domain.WeightCandidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;

/**
 * Composite momentum ranking of the configured universe on one date.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RankingService {

    private final PriceHistoryProvider priceHistory;
    private final RestrictionListProvider restrictions;
    private final MomentumProperties properties;

    /**
     * Rank the universe as of the date. Restricted and short-history names
     * appear in the excluded map together with the scorer's own exclusions.
     *
     * @param weights factor weights, or null for the configured default
     */
    public ScoringResult rank(LocalDate date, WeightCandidate weights) {
        WeightCandidate effective = weights != null ? weights : properties.defaultWeights();
        ScoringParameters scoring = properties.scoringParameters();

        PriceTable prices = priceHistory.getPrices(properties.getUniverse(),
                date.minusDays(properties.getWarmupDays()), date);
        EligibleUniverse eligible = new UniverseFilter(scoring.requiredHistory())
                .filter(properties.getUniverse(), date, restrictions.getRestrictedSymbols(date), prices);
        ScoringResult scored = new MomentumScorer(scoring).score(date, eligible.getSymbols(), prices, effective)
                .withExclusions(eligible.getExcluded());

        log.info("Ranked {} symbols on {} with weights {} ({} excluded)",
                scored.size(), date, effective.format(), scored.getExcluded().size());
        return scored;
    }
}
