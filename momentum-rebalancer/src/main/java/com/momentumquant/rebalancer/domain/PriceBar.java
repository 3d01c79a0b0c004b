package com.momentumquant.rebalancer.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One trading day of prices for a single symbol.
 * Only the close is mandatory; open, high, low and volume may be missing.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PriceBar {

    private LocalDate date;
    private String symbol;
    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal close;
    private Long volume;

    public boolean hasVolume() {
        return volume != null;
    }
}
