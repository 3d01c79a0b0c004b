package com.momentumquant.rebalancer.repository;

import com.momentumquant.rebalancer.domain.HistoricalMarketData;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

/**
 * Repository for stored daily price bars.
 */
@Repository
public interface HistoricalMarketDataRepository extends JpaRepository<HistoricalMarketData, Long> {

    /**
     * Find bars for a symbol within a date range, ordered by date.
     */
    @Query("SELECT h FROM HistoricalMarketData h WHERE h.symbol = :symbol " +
            "AND h.date >= :startDate AND h.date <= :endDate ORDER BY h.date ASC")
    List<HistoricalMarketData> findBySymbolAndDateRange(
            @Param("symbol") String symbol,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate);

    /**
     * Find bars for several symbols within a date range, ordered by symbol then date.
     */
    @Query("SELECT h FROM HistoricalMarketData h WHERE h.symbol IN :symbols " +
            "AND h.date >= :startDate AND h.date <= :endDate ORDER BY h.symbol ASC, h.date ASC")
    List<HistoricalMarketData> findBySymbolsAndDateRange(
            @Param("symbols") Collection<String> symbols,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate);

    boolean existsBySymbolAndDate(String symbol, LocalDate date);

    long countBySymbol(String symbol);

    void deleteBySymbol(String symbol);
}
