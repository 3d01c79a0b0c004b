package com.momentumquant.rebalancer.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.momentumquant.rebalancer.controller.dto.BacktestRequest;
import com.momentumquant.rebalancer.domain.BacktestConfig;
import com.momentumquant.rebalancer.domain.BacktestResult;
import com.momentumquant.rebalancer.domain.CatastrophicDataException;
import com.momentumquant.rebalancer.domain.PerformanceSummary;
import com.momentumquant.rebalancer.domain.RebalanceEvent;
import com.momentumquant.rebalancer.domain.SimulatorState;
import com.momentumquant.rebalancer.domain.WeightCandidate;
import com.momentumquant.rebalancer.service.BacktestService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Tests for BacktestController REST endpoints and error mapping.
 */
@ExtendWith(MockitoExtension.class)
class BacktestControllerTest {

    private static final LocalDate START = LocalDate.of(2023, 1, 2);
    private static final LocalDate END = LocalDate.of(2023, 12, 29);

    @Mock
    private BacktestService backtestService;

    private MockMvc mockMvc;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        objectMapper.findAndRegisterModules();
        mockMvc = MockMvcBuilders.standaloneSetup(new BacktestController(backtestService))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void testRunBacktest_Success() throws Exception {
        // Arrange
        BacktestConfig config = BacktestConfig.builder().universe(List.of("AAA")).startDate(START).endDate(END).build();
        when(backtestService.toConfig(any())).thenReturn(config);
        when(backtestService.runBacktest(config)).thenReturn(result());

        // Act & Assert
        mockMvc.perform(post("/backtests")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(validRequest())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.weights").value("0.8000,0.1000,0.1000"))
                .andExpect(jsonPath("$.finalState").value("FINALIZED"))
                .andExpect(jsonPath("$.summary.cagr").value(12.5))
                .andExpect(jsonPath("$.finalHoldings.AAA").value(10))
                .andExpect(jsonPath("$.skippedRebalances").value(1))
                .andExpect(jsonPath("$.rebalances[0].outcome").value("SKIPPED"))
                .andExpect(jsonPath("$.warnings[0]").value("No price data on rebalance date 2023-01-04"));
    }

    @Test
    void testRunBacktest_MissingStartDate() throws Exception {
        // Arrange
        BacktestRequest request = validRequest();
        request.setStartDate(null);

        // Act & Assert
        mockMvc.perform(post("/backtests")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reason").value("validation_error"))
                .andExpect(jsonPath("$.fields.startDate").value("Start date is required"));

        verifyNoInteractions(backtestService);
    }

    @Test
    void testRunBacktest_MalformedWeights() throws Exception {
        // Arrange
        BacktestRequest request = validRequest();
        request.setWeights("heavy on returns");

        // Act & Assert
        mockMvc.perform(post("/backtests")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fields.weights").exists());
    }

    @Test
    void testRunBacktest_InvalidConfigurationIsBadRequest() throws Exception {
        // Arrange
        when(backtestService.toConfig(any()))
                .thenThrow(new IllegalArgumentException("Weights must sum to 1.0 but sum to 1.5"));

        // Act & Assert
        mockMvc.perform(post("/backtests")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(validRequest())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reason").value("bad_request"))
                .andExpect(jsonPath("$.message").value("Weights must sum to 1.0 but sum to 1.5"));
    }

    @Test
    void testRunBacktest_MissingDataIsUnprocessable() throws Exception {
        // Arrange
        BacktestConfig config = BacktestConfig.builder().universe(List.of("AAA")).startDate(START).endDate(END).build();
        when(backtestService.toConfig(any())).thenReturn(config);
        when(backtestService.runBacktest(config))
                .thenThrow(new CatastrophicDataException("No price data for the universe"));

        // Act & Assert
        mockMvc.perform(post("/backtests")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(validRequest())))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.reason").value("insufficient_data"));
    }

    @Test
    void testRunBacktest_UnreadableBody() throws Exception {
        mockMvc.perform(post("/backtests")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"startDate\": \"not a date\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reason").value("bad_request"));
    }

    private static BacktestRequest validRequest() {
        return BacktestRequest.builder()
                .universe(List.of("AAA"))
                .startDate(START)
                .endDate(END)
                .weights("0.8,0.1,0.1")
                .initialCapital(new BigDecimal("100000"))
                .build();
    }

    private static BacktestResult result() {
        return BacktestResult.builder()
                .weights(WeightCandidate.of(0.8, 0.1, 0.1))
                .finalState(SimulatorState.FINALIZED)
                .finalCash(new BigDecimal("250.00"))
                .finalHoldings(Map.of("AAA", 10))
                .rebalance(RebalanceEvent.builder()
                        .date(LocalDate.of(2023, 1, 4))
                        .outcome(RebalanceEvent.Outcome.SKIPPED)
                        .message("No price data on rebalance date 2023-01-04")
                        .build())
                .warning("No price data on rebalance date 2023-01-04")
                .summary(PerformanceSummary.builder()
                        .cagr(new BigDecimal("12.5"))
                        .maxDrawdown(new BigDecimal("-8.3"))
                        .build())
                .build();
    }
}
