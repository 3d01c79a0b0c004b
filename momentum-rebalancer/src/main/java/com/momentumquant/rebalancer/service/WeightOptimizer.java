package com.momentumquant.rebalancer.service;

import com.momentumquant.rebalancer.config.MomentumProperties;
import com.momentumquant.rebalancer.domain.BacktestConfig;
import com.momentumquant.rebalancer.domain.BacktestResult;
import com.momentumquant.rebalancer.domain.BacktestSimulator;
import com.momentumquant.rebalancer.domain.CandidateOutcome;
import com.momentumquant.rebalancer.domain.CatastrophicDataException;
import com.momentumquant.rebalancer.domain.OptimizationResult;
import com.momentumquant.rebalancer.domain.PriceHistoryProvider;
import com.momentumquant.rebalancer.domain.PriceTable;
import com.momentumquant.rebalancer.domain.WeightCandidate;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Tunes the factor weights by running the simulator once per candidate.
 * <p>
 * Prices are loaded once per optimization and shared read-only by every
 * candidate run. A candidate whose run aborts on missing data is recorded as
 * failed and the search moves on. Cancellation is checked between candidates
 * only; a running simulation always completes.
 */
@Service
@Slf4j
public class WeightOptimizer {

    static final double FAILED_PENALTY = 1000.0;
    static final double BREACH_PENALTY = 100.0;
    private static final double INITIAL_STEP = 0.1;
    private static final int WEIGHT_SCALE = 4;

    private final BacktestSimulator simulator;
    private final PriceHistoryProvider priceHistory;
    private final ExecutorService executor;
    private final int workerThreads;
    private final EngineMetricsService metricsService;

    @Autowired
    public WeightOptimizer(BacktestSimulator simulator,
                           PriceHistoryProvider priceHistory,
                           @Qualifier("optimizerExecutorService") ExecutorService executor,
                           MomentumProperties properties,
                           EngineMetricsService metricsService) {
        this(simulator, priceHistory, executor, properties.getOptimizer().getWorkerThreads(), metricsService);
    }

    WeightOptimizer(BacktestSimulator simulator, PriceHistoryProvider priceHistory, ExecutorService executor,
                    int workerThreads, EngineMetricsService metricsService) {
        this.simulator = simulator;
        this.priceHistory = priceHistory;
        this.executor = executor;
        this.workerThreads = workerThreads;
        this.metricsService = metricsService;
    }

    public OptimizationResult gridSearch(BacktestConfig base, double step, double maxDrawdown) {
        return gridSearch(base, step, maxDrawdown, new AtomicBoolean(false));
    }

    /**
     * Evaluate every simplex point on the given step.
     *
     * @throws IllegalArgumentException when the step does not divide 1.0
     */
    public OptimizationResult gridSearch(BacktestConfig base, double step, double maxDrawdown,
                                         AtomicBoolean cancelled) {
        List<WeightCandidate> grid = WeightCandidate.gridOf(step);
        log.info("Grid search over {} weight candidates (step {}), max drawdown {}%",
                grid.size(), step, maxDrawdown);
        return evaluateAll(OptimizationResult.Method.GRID, base, grid, maxDrawdown, cancelled);
    }

    public OptimizationResult compare(BacktestConfig base, List<WeightCandidate> candidates, double maxDrawdown) {
        return compare(base, candidates, maxDrawdown, new AtomicBoolean(false));
    }

    /**
     * Evaluate an explicit list of weight triples under the same ranking rules as the grid.
     */
    public OptimizationResult compare(BacktestConfig base, List<WeightCandidate> candidates, double maxDrawdown,
                                      AtomicBoolean cancelled) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("At least one weight candidate is required");
        }
        log.info("Comparing {} weight candidates, max drawdown {}%", candidates.size(), maxDrawdown);
        return evaluateAll(OptimizationResult.Method.COMPARE, base, candidates, maxDrawdown, cancelled);
    }

    public OptimizationResult directedSearch(BacktestConfig base, double maxDrawdown, int maxEvaluations) {
        return directedSearch(base, maxDrawdown, maxEvaluations, new AtomicBoolean(false));
    }

    /**
     * Nelder-Mead over (return weight, RSI weight) with the proximity weight
     * as the remainder, starting from the base configuration's weights.
     * Minimizes negated CAGR plus a penalty per point of drawdown beyond the
     * threshold. Points are projected onto the simplex and rounded to four
     * decimals, so revisited points reuse the earlier run.
     */
    public OptimizationResult directedSearch(BacktestConfig base, double maxDrawdown, int maxEvaluations,
                                             AtomicBoolean cancelled) {
        if (maxEvaluations < 1) {
            throw new IllegalArgumentException("Maximum evaluations must be positive: " + maxEvaluations);
        }
        PriceTable prices = loadPrices(base);
        Map<String, CandidateOutcome> evaluated = new LinkedHashMap<>();
        WeightCandidate start = base.getWeights();

        ObjectiveFunction objective = new ObjectiveFunction(point -> {
            WeightCandidate candidate = project(point[0], point[1]);
            CandidateOutcome outcome = evaluated.get(candidate.format());
            if (outcome == null) {
                if (cancelled.get()) {
                    throw new CancellationException("Directed search cancelled");
                }
                outcome = evaluate(evaluated.size(), base, candidate, prices, maxDrawdown);
                evaluated.put(candidate.format(), outcome);
            }
            return objectiveValue(outcome, maxDrawdown);
        });

        boolean stopped = false;
        try {
            new SimplexOptimizer(1e-6, 1e-6).optimize(
                    new MaxEval(maxEvaluations),
                    objective,
                    GoalType.MINIMIZE,
                    new InitialGuess(new double[]{start.getReturnWeight(), start.getRsiWeight()}),
                    new NelderMeadSimplex(new double[]{INITIAL_STEP, INITIAL_STEP}));
        } catch (TooManyEvaluationsException e) {
            log.info("Directed search reached {} objective evaluations", maxEvaluations);
        } catch (CancellationException e) {
            log.warn("Directed search cancelled after {} candidates", evaluated.size());
            stopped = true;
        }

        OptimizationResult result = new OptimizationResult(OptimizationResult.Method.DIRECTED, maxDrawdown,
                new ArrayList<>(evaluated.values()), stopped);
        logBest(result);
        return result;
    }

    /**
     * Clamp onto the simplex and round to four decimals; proximity takes the remainder.
     */
    static WeightCandidate project(double returnWeight, double rsiWeight) {
        double r = Math.max(0.0, Double.isNaN(returnWeight) ? 0.0 : returnWeight);
        double s = Math.max(0.0, Double.isNaN(rsiWeight) ? 0.0 : rsiWeight);
        if (r + s > 1.0) {
            double total = r + s;
            r = r / total;
            s = s / total;
        }
        BigDecimal rounded = BigDecimal.valueOf(r).setScale(WEIGHT_SCALE, RoundingMode.HALF_UP);
        BigDecimal roundedRsi = BigDecimal.valueOf(s).setScale(WEIGHT_SCALE, RoundingMode.HALF_UP);
        if (rounded.add(roundedRsi).compareTo(BigDecimal.ONE) > 0) {
            roundedRsi = BigDecimal.ONE.subtract(rounded);
        }
        BigDecimal proximity = BigDecimal.ONE.subtract(rounded).subtract(roundedRsi);
        return WeightCandidate.of(rounded.doubleValue(), roundedRsi.doubleValue(), proximity.doubleValue());
    }

    static double objectiveValue(CandidateOutcome outcome, double maxDrawdown) {
        if (!outcome.isCompleted()) {
            return FAILED_PENALTY;
        }
        double breach = Math.max(0.0, maxDrawdown - outcome.getMaxDrawdown().doubleValue());
        return -outcome.getCagr().doubleValue() + BREACH_PENALTY * breach;
    }

    private OptimizationResult evaluateAll(OptimizationResult.Method method, BacktestConfig base,
                                           List<WeightCandidate> candidates, double maxDrawdown,
                                           AtomicBoolean cancelled) {
        PriceTable prices = loadPrices(base);
        List<CandidateOutcome> outcomes = workerThreads > 1 && executor != null
                ? evaluateParallel(base, candidates, prices, maxDrawdown, cancelled)
                : evaluateSequential(base, candidates, prices, maxDrawdown, cancelled);

        boolean stopped = outcomes.size() < candidates.size();
        if (stopped) {
            log.warn("Optimization cancelled after {} of {} candidates", outcomes.size(), candidates.size());
        }
        OptimizationResult result = new OptimizationResult(method, maxDrawdown, outcomes, stopped);
        logBest(result);
        return result;
    }

    private List<CandidateOutcome> evaluateSequential(BacktestConfig base, List<WeightCandidate> candidates,
                                                      PriceTable prices, double maxDrawdown,
                                                      AtomicBoolean cancelled) {
        List<CandidateOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            if (cancelled.get()) {
                break;
            }
            outcomes.add(evaluate(i, base, candidates.get(i), prices, maxDrawdown));
        }
        return outcomes;
    }

    /**
     * Submit every candidate to the pool and collect in enumeration order, so
     * the outcome list matches a sequential run.
     */
    private List<CandidateOutcome> evaluateParallel(BacktestConfig base, List<WeightCandidate> candidates,
                                                    PriceTable prices, double maxDrawdown,
                                                    AtomicBoolean cancelled) {
        List<Future<CandidateOutcome>> futures = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            int index = i;
            WeightCandidate candidate = candidates.get(i);
            futures.add(executor.submit(() -> cancelled.get()
                    ? null
                    : evaluate(index, base, candidate, prices, maxDrawdown)));
        }

        List<CandidateOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            CandidateOutcome outcome;
            try {
                outcome = futures.get(i).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.subList(i, futures.size()).forEach(f -> f.cancel(false));
                break;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Candidate {} crashed: {}", candidates.get(i).format(), cause.getMessage(), cause);
                outcome = CandidateOutcome.failed(i, candidates.get(i), cause.getMessage());
            }
            if (outcome == null) {
                break;
            }
            outcomes.add(outcome);
        }
        return outcomes;
    }

    private CandidateOutcome evaluate(int index, BacktestConfig base, WeightCandidate candidate, PriceTable prices,
                                      double maxDrawdown) {
        MDC.put("candidate", candidate.format());
        try {
            BacktestResult result = simulator.run(base.withWeights(candidate), prices);
            CandidateOutcome outcome = CandidateOutcome.completed(index, candidate, result.getSummary(),
                    maxDrawdown);
            log.info("Candidate {} [{}] - CAGR: {}%, Max DD: {}%{}", index, candidate.format(),
                    outcome.getCagr(), outcome.getMaxDrawdown(), outcome.isFeasible() ? "" : " (infeasible)");
            return outcome;
        } catch (CatastrophicDataException e) {
            log.warn("Candidate {} [{}] failed: {}", index, candidate.format(), e.getMessage());
            return CandidateOutcome.failed(index, candidate, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Candidate {} [{}] crashed: {}", index, candidate.format(), e.getMessage(), e);
            return CandidateOutcome.failed(index, candidate, e.getMessage());
        } finally {
            metricsService.recordCandidateEvaluated();
            MDC.remove("candidate");
        }
    }

    private PriceTable loadPrices(BacktestConfig base) {
        return priceHistory.getPrices(base.symbolsToLoad(), base.dataStart(), base.getEndDate());
    }

    private static void logBest(OptimizationResult result) {
        result.getBest().ifPresentOrElse(
                best -> log.info("Best weights [{}] - CAGR: {}%, Max DD: {}% ({} of {} feasible)",
                        best.getWeights().format(), best.getCagr(), best.getMaxDrawdown(),
                        result.getRanked().size(), result.getEvaluated().size()),
                () -> log.warn("No candidate met the {}% drawdown limit ({} evaluated)",
                        result.getMaxDrawdownThreshold(), result.getEvaluated().size()));
    }
}
