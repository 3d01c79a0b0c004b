package com.momentumquant.rebalancer.service;

import com.momentumquant.rebalancer.config.MomentumProperties;
import com.momentumquant.rebalancer.domain.RestrictionListProvider;
import com.momentumquant.rebalancer.domain.TradingRestriction;
import com.momentumquant.rebalancer.repository.TradingRestrictionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Set;
import java.util.TreeSet;

/**
 * Surveillance listings stored in the database. Long-term and graded
 * listings always exclude a symbol; short-term listings exclude it from the
 * configured stage upward.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DatabaseRestrictionListProvider implements RestrictionListProvider {

    private final TradingRestrictionRepository restrictionRepository;
    private final MomentumProperties properties;

    @Override
    @Transactional(readOnly = true)
    public Set<String> getRestrictedSymbols(LocalDate date) {
        int exclusionStage = properties.getRestrictions().getShortTermExclusionStage();
        Set<String> restricted = new TreeSet<>();
        for (TradingRestriction restriction : restrictionRepository.findEffectiveOn(date)) {
            if (restriction.isEffectiveOn(date) && restriction.excludes(exclusionStage)) {
                restricted.add(restriction.getSymbol());
            }
        }
        log.debug("{} symbols restricted on {}", restricted.size(), date);
        return restricted;
    }
}
