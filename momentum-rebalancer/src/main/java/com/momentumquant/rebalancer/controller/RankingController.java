package com.momentumquant.rebalancer.controller;

import com.momentumquant.rebalancer.controller.dto.RankingResponse;
import com.momentumquant.rebalancer.domain.ScoringResult;
import com.momentumquant.rebalancer.domain.WeightCandidate;
import com.momentumquant.rebalancer.service.RankingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

/**
 * REST controller for the composite momentum ranking.
 */
@RestController
@RequestMapping("/rankings")
@RequiredArgsConstructor
@Slf4j
public class RankingController {

    private final RankingService rankingService;

    /**
     * Rank the configured universe as of a date.
     *
     * @param date    ranking date
     * @param weights optional "r,s,p" weights; the configured default otherwise
     */
    @GetMapping
    public ResponseEntity<RankingResponse> getRanking(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) String weights) {

        log.info("GET /rankings - Date: {}, Weights: {}", date, weights);

        WeightCandidate candidate = weights != null ? WeightCandidate.parse(weights) : null;
        ScoringResult result = rankingService.rank(date, candidate);

        return ResponseEntity.ok(RankingResponse.from(result));
    }
}
