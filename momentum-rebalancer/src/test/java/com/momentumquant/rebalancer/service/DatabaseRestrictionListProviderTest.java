package com.momentumquant.rebalancer.service;

import com.momentumquant.rebalancer.config.MomentumProperties;
import com.momentumquant.rebalancer.domain.RestrictionType;
import com.momentumquant.rebalancer.domain.TradingRestriction;
import com.momentumquant.rebalancer.repository.TradingRestrictionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for surveillance-list exclusion rules.
 */
@ExtendWith(MockitoExtension.class)
class DatabaseRestrictionListProviderTest {

    private static final LocalDate DATE = LocalDate.of(2024, 3, 6);

    @Mock
    private TradingRestrictionRepository restrictionRepository;

    private MomentumProperties properties;
    private DatabaseRestrictionListProvider provider;

    @BeforeEach
    void setUp() {
        properties = new MomentumProperties();
        provider = new DatabaseRestrictionListProvider(restrictionRepository, properties);
    }

    @Test
    void testGetRestrictedSymbols_AppliesStageThreshold() {
        // Arrange
        when(restrictionRepository.findEffectiveOn(DATE)).thenReturn(List.of(
                restriction("LONG", RestrictionType.LONG_TERM, null, null),
                restriction("GRADED", RestrictionType.GRADED, null, null),
                restriction("ST1", RestrictionType.SHORT_TERM, 1, null),
                restriction("ST2", RestrictionType.SHORT_TERM, 2, null)));

        // Act
        Set<String> restricted = provider.getRestrictedSymbols(DATE);

        // Assert
        assertEquals(Set.of("LONG", "GRADED", "ST2"), restricted,
                "Short-term stage 1 should stay tradable with the default threshold of 2");
    }

    @Test
    void testGetRestrictedSymbols_LowerThresholdExcludesEarlierStages() {
        // Arrange
        properties.getRestrictions().setShortTermExclusionStage(1);
        when(restrictionRepository.findEffectiveOn(DATE)).thenReturn(List.of(
                restriction("ST1", RestrictionType.SHORT_TERM, 1, null)));

        // Act & Assert
        assertEquals(Set.of("ST1"), provider.getRestrictedSymbols(DATE));
    }

    @Test
    void testGetRestrictedSymbols_ExpiredListingIgnored() {
        // Arrange
        when(restrictionRepository.findEffectiveOn(DATE)).thenReturn(List.of(
                restriction("OLD", RestrictionType.LONG_TERM, null, DATE.minusDays(1)),
                restriction("LAST", RestrictionType.LONG_TERM, null, DATE)));

        // Act
        Set<String> restricted = provider.getRestrictedSymbols(DATE);

        // Assert
        assertEquals(Set.of("LAST"), restricted, "A listing ending on the date is still in force");
    }

    private static TradingRestriction restriction(String symbol, RestrictionType type, Integer stage,
                                                  LocalDate effectiveTo) {
        return TradingRestriction.builder()
                .symbol(symbol)
                .type(type)
                .stage(stage)
                .effectiveFrom(DATE.minusMonths(1))
                .effectiveTo(effectiveTo)
                .build();
    }
}
