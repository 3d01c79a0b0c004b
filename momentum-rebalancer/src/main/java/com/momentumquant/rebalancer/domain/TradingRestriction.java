package com.momentumquant.rebalancer.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * A surveillance listing of one symbol over a date range.
 * A missing end date means the listing is still in force.
 */
@Entity
@Table(name = "trading_restrictions", indexes = {
        @Index(name = "idx_restriction_symbol", columnList = "symbol"),
        @Index(name = "idx_restriction_effective", columnList = "effective_from, effective_to")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradingRestriction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "symbol", nullable = false, length = 32)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 16)
    private RestrictionType type;

    @Column(name = "stage")
    private Integer stage;

    @Column(name = "effective_from", nullable = false)
    private LocalDate effectiveFrom;

    @Column(name = "effective_to")
    private LocalDate effectiveTo;

    public boolean isEffectiveOn(LocalDate date) {
        return !date.isBefore(effectiveFrom) && (effectiveTo == null || !date.isAfter(effectiveTo));
    }

    /**
     * Whether this listing bars buying, given the short-term stage from which
     * names are excluded.
     */
    public boolean excludes(int shortTermExclusionStage) {
        return switch (type) {
            case LONG_TERM, GRADED -> true;
            case SHORT_TERM -> stage != null && stage >= shortTermExclusionStage;
        };
    }
}
