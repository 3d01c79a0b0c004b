package com.momentumquant.rebalancer.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Daily price bar stored in PostgreSQL. Only the close is mandatory.
 */
@Entity
@Table(name = "historical_market_data", uniqueConstraints = {
        @UniqueConstraint(name = "uk_symbol_date", columnNames = { "symbol", "date" })
}, indexes = {
        @Index(name = "idx_symbol_date", columnList = "symbol, date"),
        @Index(name = "idx_date", columnList = "date")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HistoricalMarketData {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "symbol", nullable = false, length = 32)
    private String symbol;

    @Column(name = "date", nullable = false)
    private LocalDate date;

    @Column(name = "open", precision = 14, scale = 4)
    private BigDecimal open;

    @Column(name = "high", precision = 14, scale = 4)
    private BigDecimal high;

    @Column(name = "low", precision = 14, scale = 4)
    private BigDecimal low;

    @Column(name = "close", nullable = false, precision = 14, scale = 4)
    private BigDecimal close;

    @Column(name = "volume")
    private Long volume;

    public PriceBar toPriceBar() {
        return PriceBar.builder()
                .date(this.date)
                .symbol(this.symbol)
                .open(this.open)
                .high(this.high)
                .low(this.low)
                .close(this.close)
                .volume(this.volume)
                .build();
    }
}
