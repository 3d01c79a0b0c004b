package com.momentumquant.rebalancer.repository;

import com.momentumquant.rebalancer.domain.TradingRestriction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

/**
 * Repository for surveillance listings.
 */
@Repository
public interface TradingRestrictionRepository extends JpaRepository<TradingRestriction, Long> {

    /**
     * Listings in force on the given date.
     */
    @Query("SELECT r FROM TradingRestriction r WHERE r.effectiveFrom <= :date " +
            "AND (r.effectiveTo IS NULL OR r.effectiveTo >= :date)")
    List<TradingRestriction> findEffectiveOn(@Param("date") LocalDate date);

    List<TradingRestriction> findBySymbol(String symbol);
}
