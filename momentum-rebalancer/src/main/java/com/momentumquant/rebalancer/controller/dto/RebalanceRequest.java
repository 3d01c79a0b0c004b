package com.momentumquant.rebalancer.controller.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Request DTO for a live rebalance. Defaults to a dry run as of today.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RebalanceRequest {

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate date;

    @PositiveOrZero(message = "Additional capital must not be negative")
    private BigDecimal additionalCapital;

    @Builder.Default
    private boolean dryRun = true;
}
