package com.momentumquant.rebalancer.controller;

import com.momentumquant.rebalancer.service.IngestionResult;
import com.momentumquant.rebalancer.service.PriceDataIngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for loading and removing daily price history.
 */
@RestController
@RequestMapping("/prices")
@RequiredArgsConstructor
@Slf4j
public class PriceDataController {

    private final PriceDataIngestionService ingestionService;

    /**
     * Ingest a CSV export for one symbol. Rows already stored are skipped.
     */
    @PostMapping(value = "/{symbol}", consumes = {"text/csv", MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<IngestionResult> ingest(@PathVariable String symbol, @RequestBody String csv) {

        log.info("POST /prices/{} - {} characters", symbol, csv.length());

        IngestionResult result = ingestionService.ingestCsv(symbol, csv);

        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @DeleteMapping("/{symbol}")
    public ResponseEntity<Void> delete(@PathVariable String symbol) {

        log.info("DELETE /prices/{}", symbol);

        ingestionService.deleteSymbolData(symbol);

        return ResponseEntity.noContent().build();
    }
}
