package com.momentumquant.rebalancer.controller.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;

/**
 * Request DTO for a backtest run. Omitted fields fall back to the configured defaults.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestRequest {

    private List<String> universe;

    @NotNull(message = "Start date is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate startDate;

    @NotNull(message = "End date is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate endDate;

    @Pattern(regexp = "^\\s*[0-9.]+\\s*,\\s*[0-9.]+\\s*,\\s*[0-9.]+\\s*$",
            message = "Weights must be three comma separated numbers")
    private String weights;

    @Positive(message = "Initial capital must be positive")
    private BigDecimal initialCapital;

    @Positive(message = "Top-N must be positive")
    private Integer topN;

    @PositiveOrZero(message = "Band must not be negative")
    private Integer band;

    @PositiveOrZero(message = "Transaction cost must not be negative")
    @DecimalMax(value = "100", message = "Transaction cost is a percentage")
    private BigDecimal transactionCostPct;

    private DayOfWeek rebalanceDay;

    private String benchmarkSymbol;
}
