package com.momentumquant.rebalancer.validation;

import com.momentumquant.rebalancer.config.MomentumProperties;
import com.momentumquant.rebalancer.controller.dto.BacktestRequest;
import com.momentumquant.rebalancer.controller.dto.OptimizationRequest;
import com.momentumquant.rebalancer.controller.dto.RebalanceRequest;
import com.momentumquant.rebalancer.domain.OptimizationResult;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for input validation and constraint violations.
 */
class ValidationTest {

    private static Validator validator;

    @BeforeAll
    static void setUp() {
        ValidatorFactory factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @Test
    void testValidRequest_NoViolations() {
        // Arrange
        BacktestRequest request = createValidRequest();

        // Act
        Set<ConstraintViolation<BacktestRequest>> violations = validator.validate(request);

        // Assert
        assertTrue(violations.isEmpty(), "Valid request should have no violations");
    }

    @Test
    void testDatesOnly_Valid() {
        // Arrange - every other field falls back to configuration
        BacktestRequest request = BacktestRequest.builder()
                .startDate(LocalDate.of(2024, 1, 1))
                .endDate(LocalDate.of(2024, 12, 31))
                .build();

        // Act & Assert
        assertTrue(validator.validate(request).isEmpty());
    }

    @Test
    void testMissingStartDate_Violation() {
        // Arrange
        BacktestRequest request = createValidRequest();
        request.setStartDate(null);

        // Act
        Set<ConstraintViolation<BacktestRequest>> violations = validator.validate(request);

        // Assert
        assertEquals(1, violations.size());
        ConstraintViolation<BacktestRequest> violation = violations.iterator().next();
        assertEquals("startDate", violation.getPropertyPath().toString());
        assertTrue(violation.getMessage().contains("required"));
    }

    @Test
    void testMissingEndDate_Violation() {
        // Arrange
        BacktestRequest request = createValidRequest();
        request.setEndDate(null);

        // Act
        Set<ConstraintViolation<BacktestRequest>> violations = validator.validate(request);

        // Assert
        assertEquals(1, violations.size());
        assertEquals("endDate", violations.iterator().next().getPropertyPath().toString());
    }

    @Test
    void testWeightsFormat() {
        BacktestRequest spaced = createValidRequest();
        spaced.setWeights(" 0.6 , 0.2 , 0.2 ");
        assertTrue(validator.validate(spaced).isEmpty(), "Whitespace around numbers is allowed");

        BacktestRequest twoParts = createValidRequest();
        twoParts.setWeights("0.5,0.5");
        assertEquals(1, validator.validate(twoParts).size());

        BacktestRequest negative = createValidRequest();
        negative.setWeights("-0.2,0.6,0.6");
        assertEquals(1, validator.validate(negative).size(), "Sign is rejected by the pattern");

        // Sum is checked when the weights are parsed, not here
        BacktestRequest badSum = createValidRequest();
        badSum.setWeights("0.5,0.5,0.5");
        assertTrue(validator.validate(badSum).isEmpty());
    }

    @Test
    void testZeroInitialCapital_Violation() {
        // Arrange
        BacktestRequest request = createValidRequest();
        request.setInitialCapital(BigDecimal.ZERO);

        // Act
        Set<ConstraintViolation<BacktestRequest>> violations = validator.validate(request);

        // Assert
        assertEquals(1, violations.size());
        assertEquals("initialCapital", violations.iterator().next().getPropertyPath().toString());
        assertTrue(violations.iterator().next().getMessage().contains("positive"));
    }

    @Test
    void testTopNAndBand() {
        BacktestRequest zeroTopN = createValidRequest();
        zeroTopN.setTopN(0);
        assertEquals(1, validator.validate(zeroTopN).size());

        BacktestRequest zeroBand = createValidRequest();
        zeroBand.setBand(0);
        assertTrue(validator.validate(zeroBand).isEmpty(), "A band of zero is a plain top-N rule");

        BacktestRequest negativeBand = createValidRequest();
        negativeBand.setBand(-1);
        assertEquals(1, validator.validate(negativeBand).size());
    }

    @Test
    void testTransactionCostRange() {
        BacktestRequest realistic = createValidRequest();
        realistic.setTransactionCostPct(new BigDecimal("0.1192"));
        assertTrue(validator.validate(realistic).isEmpty());

        BacktestRequest negative = createValidRequest();
        negative.setTransactionCostPct(new BigDecimal("-0.01"));
        assertEquals(1, validator.validate(negative).size());

        BacktestRequest tooHigh = createValidRequest();
        tooHigh.setTransactionCostPct(new BigDecimal("100.5"));
        assertEquals(1, validator.validate(tooHigh).size());
    }

    @Test
    void testOptimizationRequest_CascadesToBacktest() {
        // Arrange
        BacktestRequest backtest = createValidRequest();
        backtest.setEndDate(null);
        OptimizationRequest request = OptimizationRequest.builder()
                .method(OptimizationResult.Method.GRID)
                .backtest(backtest)
                .build();

        // Act
        Set<ConstraintViolation<OptimizationRequest>> violations = validator.validate(request);

        // Assert
        assertEquals(1, violations.size());
        assertEquals("backtest.endDate", violations.iterator().next().getPropertyPath().toString());
    }

    @Test
    void testOptimizationRequest_Bounds() {
        OptimizationRequest valid = OptimizationRequest.builder()
                .method(OptimizationResult.Method.COMPARE)
                .backtest(createValidRequest())
                .gridStep(0.05)
                .maxDrawdown(-20.0)
                .maxEvaluations(50)
                .candidates(List.of("0.8,0.1,0.1"))
                .build();
        assertTrue(validator.validate(valid).isEmpty());

        OptimizationRequest missingMethod = OptimizationRequest.builder().backtest(createValidRequest()).build();
        assertEquals(1, validator.validate(missingMethod).size());

        OptimizationRequest bigStep = OptimizationRequest.builder()
                .method(OptimizationResult.Method.GRID).backtest(createValidRequest()).gridStep(1.5).build();
        assertEquals(1, validator.validate(bigStep).size());

        OptimizationRequest positiveDrawdown = OptimizationRequest.builder()
                .method(OptimizationResult.Method.GRID).backtest(createValidRequest()).maxDrawdown(10.0).build();
        assertEquals(1, validator.validate(positiveDrawdown).size());

        OptimizationRequest noBudget = OptimizationRequest.builder()
                .method(OptimizationResult.Method.DIRECTED).backtest(createValidRequest()).maxEvaluations(0).build();
        assertEquals(1, validator.validate(noBudget).size());
    }

    @Test
    void testRebalanceRequest() {
        RebalanceRequest defaults = new RebalanceRequest();
        assertTrue(validator.validate(defaults).isEmpty());
        assertTrue(RebalanceRequest.builder().build().isDryRun(), "Live orders must be requested explicitly");

        RebalanceRequest negative = RebalanceRequest.builder().additionalCapital(new BigDecimal("-500")).build();
        assertEquals(1, validator.validate(negative).size());
    }

    @Test
    void testMomentumProperties_Defaults() {
        // Act
        Set<ConstraintViolation<MomentumProperties>> violations = validator.validate(new MomentumProperties());

        // Assert
        assertTrue(violations.isEmpty(), "Built-in defaults should be valid");
    }

    @Test
    void testMomentumProperties_NestedViolation() {
        // Arrange
        MomentumProperties properties = new MomentumProperties();
        properties.setTopN(0);
        properties.getOptimizer().setWorkerThreads(0);

        // Act
        Set<ConstraintViolation<MomentumProperties>> violations = validator.validate(properties);

        // Assert
        assertEquals(2, violations.size());
        assertTrue(violations.stream().anyMatch(v -> v.getPropertyPath().toString().equals("optimizer.workerThreads")));
    }

    private BacktestRequest createValidRequest() {
        return BacktestRequest.builder()
                .universe(List.of("INFY.NS", "TCS.NS"))
                .startDate(LocalDate.of(2024, 1, 1))
                .endDate(LocalDate.of(2024, 12, 31))
                .weights("0.8,0.1,0.1")
                .initialCapital(new BigDecimal("100000.00"))
                .topN(15)
                .band(5)
                .build();
    }
}
