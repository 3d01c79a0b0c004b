package com.momentumquant.rebalancer.controller;

import com.momentumquant.rebalancer.broker.ExecutionReport;
import com.momentumquant.rebalancer.controller.dto.RebalanceRequest;
import com.momentumquant.rebalancer.controller.dto.RebalanceResponse;
import com.momentumquant.rebalancer.service.LiveRebalanceService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

/**
 * REST controller for live rebalancing against the broker account.
 */
@RestController
@RequestMapping("/rebalances")
@RequiredArgsConstructor
@Slf4j
public class RebalanceController {

    private final LiveRebalanceService liveRebalanceService;

    /**
     * Plan a rebalance and, when {@code dryRun} is false, submit the orders.
     */
    @PostMapping
    public ResponseEntity<RebalanceResponse> rebalance(@Valid @RequestBody RebalanceRequest request) {

        LocalDate date = request.getDate() != null ? request.getDate() : LocalDate.now();
        log.info("POST /rebalances - Date: {}, Additional capital: {}, Dry run: {}",
                date, request.getAdditionalCapital(), request.isDryRun());

        ExecutionReport report = liveRebalanceService.execute(date, request.getAdditionalCapital(),
                request.isDryRun());

        return ResponseEntity.ok(RebalanceResponse.from(report));
    }
}
