package com.momentumquant.rebalancer.config;

import com.momentumquant.rebalancer.domain.BacktestConfig;
import com.momentumquant.rebalancer.domain.RebalanceRules;
import com.momentumquant.rebalancer.domain.ScoringParameters;
import com.momentumquant.rebalancer.domain.WeightCandidate;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.List;

/**
 * Strategy settings bound from the {@code momentum.*} keys of application.yml.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "momentum")
public class MomentumProperties {

    private List<String> universe = new ArrayList<>();

    @Positive
    private int topN = RebalanceRules.DEFAULT_TOP_N;

    @PositiveOrZero
    private int band = RebalanceRules.DEFAULT_BAND;

    @NotBlank
    private String cashEquivalent = RebalanceRules.DEFAULT_CASH_EQUIVALENT;

    /** Return, RSI and proximity weights as "r,s,p". */
    @NotBlank
    private String weights = "0.8,0.1,0.1";

    @NotEmpty
    private List<@Positive Integer> returnLookbacks = new ArrayList<>(ScoringParameters.DEFAULT_LOOKBACKS);

    @NotEmpty
    private List<@Positive Integer> rsiLookbacks = new ArrayList<>(ScoringParameters.DEFAULT_LOOKBACKS);

    @Positive
    private int proximityLookback = ScoringParameters.DEFAULT_PROXIMITY_LOOKBACK;

    @PositiveOrZero
    private int warmupDays = BacktestConfig.DEFAULT_WARMUP_DAYS;

    @NotNull
    private DayOfWeek rebalanceDay = DayOfWeek.WEDNESDAY;

    @NotNull
    @Positive
    private BigDecimal initialCapital = BacktestConfig.DEFAULT_INITIAL_CAPITAL;

    /** Charged on each trade, in percent (0.1192 = 0.1192%). */
    @NotNull
    @PositiveOrZero
    @DecimalMax("100")
    private BigDecimal transactionCostPct = BigDecimal.ZERO;

    /** Benchmark for the market-regime filter; blank disables the filter. */
    private String benchmarkSymbol;

    @Positive
    private int regimeWindow = BacktestConfig.DEFAULT_REGIME_WINDOW;

    /** One-day return above which a new entry is postponed; 0 disables. */
    @PositiveOrZero
    private double jumpThreshold = RebalanceRules.DEFAULT_JUMP_THRESHOLD;

    private double riskFreeRate = 0.0;

    @Valid
    private Screens screens = new Screens();

    @Valid
    private Optimizer optimizer = new Optimizer();

    @Valid
    private Restrictions restrictions = new Restrictions();

    @Data
    public static class Screens {
        @PositiveOrZero
        private BigDecimal minPrice = BigDecimal.ZERO;
        @PositiveOrZero
        private BigDecimal maxPrice = BigDecimal.ZERO;
        @PositiveOrZero
        private BigDecimal minMedianTradedValue = BigDecimal.ZERO;
        @PositiveOrZero
        private long minAverageVolume = 0;
        @Positive
        private int lookback = ScoringParameters.DEFAULT_LIQUIDITY_LOOKBACK;
        /** Calendar days a symbol's latest bar may lag the scoring date. */
        @PositiveOrZero
        private int maxStaleDays = ScoringParameters.DEFAULT_MAX_STALE_DAYS;
    }

    @Data
    public static class Optimizer {
        /** Worst acceptable drawdown in percent, e.g. -20. */
        private double maxDrawdown = -20.0;
        @Positive
        private double gridStep = 0.1;
        @Positive
        private int workerThreads = 1;
        @Positive
        private int maxEvaluations = 100;
    }

    @Data
    public static class Restrictions {
        /** Short-term surveillance stage from which names are excluded. */
        @Positive
        private int shortTermExclusionStage = 2;
    }

    public WeightCandidate defaultWeights() {
        return WeightCandidate.parse(weights);
    }

    public ScoringParameters scoringParameters() {
        return ScoringParameters.builder()
                .returnLookbacks(returnLookbacks)
                .rsiLookbacks(rsiLookbacks)
                .proximityLookback(proximityLookback)
                .minPrice(screens.getMinPrice())
                .maxPrice(screens.getMaxPrice())
                .minMedianTradedValue(screens.getMinMedianTradedValue())
                .minAverageVolume(screens.getMinAverageVolume())
                .liquidityLookback(screens.getLookback())
                .maxStaleDays(screens.getMaxStaleDays())
                .build();
    }

    public RebalanceRules rebalanceRules() {
        return RebalanceRules.builder()
                .topN(topN)
                .band(band)
                .cashEquivalentSymbol(cashEquivalent)
                .transactionCostRate(transactionCostPct.divide(BigDecimal.valueOf(100), 10, RoundingMode.HALF_UP)
                        .stripTrailingZeros())
                .jumpThreshold(jumpThreshold)
                .build();
    }

    /**
     * Builder pre-filled with every configured default; callers add dates and
     * any per-request overrides.
     */
    public BacktestConfig.BacktestConfigBuilder backtestDefaults() {
        return BacktestConfig.builder()
                .universe(universe)
                .rebalanceDay(rebalanceDay)
                .initialCapital(initialCapital)
                .weights(defaultWeights())
                .scoring(scoringParameters())
                .rules(rebalanceRules())
                .warmupDays(warmupDays)
                .benchmarkSymbol(benchmarkSymbol)
                .regimeWindow(regimeWindow)
                .riskFreeRate(riskFreeRate);
    }
}
