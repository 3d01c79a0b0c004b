package com.momentumquant.rebalancer.controller.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.momentumquant.rebalancer.domain.ExclusionReason;
import com.momentumquant.rebalancer.domain.RankedSymbol;
import com.momentumquant.rebalancer.domain.ScoringResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for the composite ranking on a date.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RankingResponse {

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate date;
    private String weights;
    private List<Entry> ranking;
    private Map<String, ExclusionReason> excluded;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Entry {
        private int rank;
        private String symbol;
        private double compositeScore;
        private double returnScore;
        private double rsiScore;
        private double percentFromHigh;
    }

    public static RankingResponse from(ScoringResult result) {
        return RankingResponse.builder()
                .date(result.getAsOfDate())
                .weights(result.getWeights().format())
                .ranking(result.getRanked().stream().map(RankingResponse::entry).toList())
                .excluded(result.getExcluded())
                .build();
    }

    private static Entry entry(RankedSymbol ranked) {
        return Entry.builder()
                .rank(ranked.getRank())
                .symbol(ranked.getSymbol())
                .compositeScore(ranked.getCompositeScore())
                .returnScore(ranked.getSnapshot().getReturnScore())
                .rsiScore(ranked.getSnapshot().getRsiScore())
                .percentFromHigh(ranked.getSnapshot().getPercentFromHigh())
                .build();
    }
}
