package com.momentumquant.rebalancer.domain;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns a ranking and the current portfolio into a rebalance decision using a
 * hysteresis band: a held name is kept while its rank is within top-N plus the
 * band, and only names ranked inside the top N are bought. A held name that
 * is unranked because of a data gap is kept and not topped up; one that is
 * restricted, screened out or gone from the universe is sold.
 * <p>
 * Sizing aims for an equal value per slot (total value / N) in whole shares.
 * New entries are funded first, underweight positions are then topped up
 * lowest value first, and any capital for slots that stay empty is parked in
 * the cash-equivalent placeholder. When every slot is filled, cash still left
 * buys single shares of the lowest-value slot until no share is affordable.
 * Buys are sized net of the transaction cost so executing the decision never
 * drives cash negative.
 * <p>
 * Applying a decision and reconciling again against the same ranking and
 * prices yields an empty decision.
 */
@Slf4j
public class PortfolioReconciler {

    private static final int MONEY_SCALE = 8;

    @Getter
    private final RebalanceRules rules;

    public PortfolioReconciler(RebalanceRules rules) {
        this.rules = rules;
    }

    /**
     * @param prices            execution price per symbol on the date; symbols without a
     *                          price are neither bought nor sold
     * @param additionalCapital fresh cash to deploy, zero for none
     */
    public RebalanceDecision reconcile(LocalDate date, Portfolio portfolio, ScoringResult ranking,
                                       Map<String, BigDecimal> prices, BigDecimal additionalCapital) {
        RebalanceDecision.RebalanceDecisionBuilder decision = RebalanceDecision.builder().date(date);
        BigDecimal sellFactor = BigDecimal.ONE.subtract(rules.getTransactionCostRate());
        BigDecimal buyFactor = BigDecimal.ONE.add(rules.getTransactionCostRate());
        String cashEquivalent = rules.getCashEquivalentSymbol();
        int topN = rules.getTopN();

        Map<String, RankedSymbol> ranks = ranking.bySymbol();
        BigDecimal freeCash = portfolio.getCash().add(nonNull(additionalCapital));
        BigDecimal heldValue = BigDecimal.ZERO;
        Map<String, BigDecimal> slotValues = new LinkedHashMap<>();
        Map<String, Integer> slotRanks = new LinkedHashMap<>();
        int keptPositions = 0;

        // Band rule over current equity holdings
        for (Holding holding : portfolio.getHoldings()) {
            String symbol = holding.getSymbol();
            if (rules.isCashEquivalent(symbol)) {
                continue;
            }
            BigDecimal price = priceOf(prices, symbol);
            RankedSymbol ranked = ranks.get(symbol);
            Integer rank = ranked == null ? null : ranked.getRank();
            boolean withinBand = rank != null && rank <= rules.retentionLimit();
            ExclusionReason exclusion = rank == null ? ranking.getExcluded().get(symbol) : null;
            boolean dataGap = exclusion != null && exclusion.isDataGap();

            if (!withinBand && !dataGap && price != null) {
                decision.sell(RebalanceDecision.SellOrder.builder()
                        .symbol(symbol)
                        .quantity(holding.getQuantity())
                        .price(price)
                        .rank(rank)
                        .reason(rank == null
                                ? RebalanceDecision.SellReason.NOT_RANKED
                                : RebalanceDecision.SellReason.OUT_OF_BAND)
                        .build());
                freeCash = freeCash.add(holding.valueAt(price).multiply(sellFactor));
                continue;
            }
            if (dataGap) {
                decision.warning(String.format("%s not ranked on %s (%s), position kept", symbol, date, exclusion));
            } else if (!withinBand) {
                decision.warning(String.format("No price for %s on %s, position kept", symbol, date));
            }
            keptPositions++;
            BigDecimal value = holding.valueAt(price != null ? price : holding.getAverageCost());
            heldValue = heldValue.add(value);
            decision.hold(RebalanceDecision.HeldPosition.builder()
                    .symbol(symbol)
                    .quantity(holding.getQuantity())
                    .rank(rank)
                    .build());
            if (price != null && !dataGap) {
                slotValues.put(symbol, value);
                slotRanks.put(symbol, rank);
            }
        }

        // New entries from the top N
        int freeSlots = topN - keptPositions;
        List<RankedSymbol> entries = new ArrayList<>();
        if (freeSlots > 0) {
            for (RankedSymbol candidate : ranking.topN(topN)) {
                if (entries.size() == freeSlots) {
                    break;
                }
                String symbol = candidate.getSymbol();
                if (portfolio.holds(symbol) || rules.isCashEquivalent(symbol)) {
                    continue;
                }
                if (priceOf(prices, symbol) == null) {
                    decision.warning(String.format("No price for %s on %s, entry skipped", symbol, date));
                    continue;
                }
                Double jump = candidate.getSnapshot() == null ? null : candidate.getSnapshot().getDailyReturn();
                if (rules.getJumpThreshold() > 0 && jump != null && jump > rules.getJumpThreshold()) {
                    decision.warning(String.format("%s skipped on %s after a %.1f%% one-day move",
                            symbol, date, jump * 100));
                    continue;
                }
                entries.add(candidate);
            }
            if (entries.size() < freeSlots) {
                decision.warning(String.format("Only %d of %d open slots can be filled on %s (%d symbols ranked)",
                        entries.size(), freeSlots, date, ranking.size()));
            }
        }

        int cashEquivalentQuantity = portfolio.quantityOf(cashEquivalent);
        BigDecimal cashEquivalentPrice = priceOf(prices, cashEquivalent);
        BigDecimal cashEquivalentValue = BigDecimal.ZERO;
        if (cashEquivalentQuantity > 0) {
            BigDecimal mark = cashEquivalentPrice != null ? cashEquivalentPrice
                    : portfolio.holding(cashEquivalent).map(Holding::getAverageCost).orElse(BigDecimal.ZERO);
            cashEquivalentValue = mark.multiply(BigDecimal.valueOf(cashEquivalentQuantity));
        }

        BigDecimal totalValue = freeCash.add(heldValue).add(cashEquivalentValue);
        BigDecimal target = totalValue.divide(BigDecimal.valueOf(topN), MONEY_SCALE, RoundingMode.DOWN);
        double slotWeight = 1.0 / topN;

        BigDecimal budget = freeCash;
        boolean canRedeployCashEquivalent = !entries.isEmpty() && cashEquivalentQuantity > 0
                && cashEquivalentPrice != null;
        if (canRedeployCashEquivalent) {
            budget = budget.add(cashEquivalentPrice.multiply(BigDecimal.valueOf(cashEquivalentQuantity))
                    .multiply(sellFactor));
        }

        // Size new entries
        Map<String, Integer> buyQuantities = new LinkedHashMap<>();
        BigDecimal spent = BigDecimal.ZERO;
        if (!entries.isEmpty()) {
            BigDecimal share = budget.divide(BigDecimal.valueOf(entries.size()), MONEY_SCALE, RoundingMode.DOWN);
            BigDecimal allocation = share.min(target);
            for (RankedSymbol entry : entries) {
                BigDecimal price = priceOf(prices, entry.getSymbol());
                int quantity = wholeShares(allocation, price.multiply(buyFactor));
                if (quantity == 0) {
                    decision.warning(String.format("Allocation %s too small for one share of %s at %s on %s",
                            allocation.setScale(2, RoundingMode.DOWN), entry.getSymbol(), price, date));
                    continue;
                }
                buyQuantities.put(entry.getSymbol(), quantity);
                slotRanks.put(entry.getSymbol(), entry.getRank());
                slotValues.put(entry.getSymbol(), price.multiply(BigDecimal.valueOf(quantity)));
                spent = spent.add(price.multiply(BigDecimal.valueOf(quantity)).multiply(buyFactor));
            }
        }

        // Top up underweight slots, lowest value first
        BigDecimal remaining = budget.subtract(spent);
        List<Map.Entry<String, BigDecimal>> bySize = new ArrayList<>(slotValues.entrySet());
        bySize.sort(Map.Entry.<String, BigDecimal>comparingByValue().thenComparing(Map.Entry.comparingByKey()));
        for (Map.Entry<String, BigDecimal> slot : bySize) {
            BigDecimal gap = target.subtract(slot.getValue());
            if (gap.signum() <= 0 || remaining.signum() <= 0) {
                continue;
            }
            BigDecimal price = priceOf(prices, slot.getKey());
            int quantity = Math.min(wholeShares(gap, price), wholeShares(remaining, price.multiply(buyFactor)));
            if (quantity == 0) {
                continue;
            }
            buyQuantities.merge(slot.getKey(), quantity, Integer::sum);
            BigDecimal cost = price.multiply(BigDecimal.valueOf(quantity)).multiply(buyFactor);
            spent = spent.add(cost);
            remaining = remaining.subtract(cost);
        }

        long newPositions = buyQuantities.keySet().stream().filter(s -> !portfolio.holds(s)).count();
        int unfilled = topN - keptPositions - (int) newPositions;

        // Every slot filled: spread what is left one share at a time
        if (unfilled == 0 && remaining.signum() > 0) {
            BigDecimal left = distributeLeftover(slotValues.keySet(), portfolio, prices, buyQuantities, remaining,
                    buyFactor);
            spent = spent.add(remaining.subtract(left));
        }

        // Fund any shortfall from the cash-equivalent
        boolean cashEquivalentSold = false;
        if (spent.compareTo(freeCash) > 0) {
            BigDecimal netPerUnit = cashEquivalentPrice.multiply(sellFactor);
            int quantity = Math.min(cashEquivalentQuantity,
                    spent.subtract(freeCash).divide(netPerUnit, 0, RoundingMode.UP).intValue());
            decision.sell(RebalanceDecision.SellOrder.builder()
                    .symbol(cashEquivalent)
                    .quantity(quantity)
                    .price(cashEquivalentPrice)
                    .reason(RebalanceDecision.SellReason.CASH_REDEPLOYED)
                    .build());
            freeCash = freeCash.add(netPerUnit.multiply(BigDecimal.valueOf(quantity)));
            cashEquivalentSold = true;
        }

        for (Map.Entry<String, Integer> buy : buyQuantities.entrySet()) {
            String symbol = buy.getKey();
            decision.buy(RebalanceDecision.BuyOrder.builder()
                    .symbol(symbol)
                    .quantity(buy.getValue())
                    .price(priceOf(prices, symbol))
                    .rank(slotRanks.get(symbol))
                    .targetWeight(slotWeight)
                    .kind(portfolio.holds(symbol)
                            ? RebalanceDecision.BuyKind.TOP_UP
                            : RebalanceDecision.BuyKind.NEW_ENTRY)
                    .build());
        }

        // Park capital for unfilled slots in the cash-equivalent
        BigDecimal leftover = freeCash.subtract(spent);
        if (unfilled > 0 && !cashEquivalentSold && leftover.signum() > 0) {
            if (cashEquivalentPrice == null) {
                decision.warning(String.format("No price for %s on %s, uninvested cash kept",
                        cashEquivalent, date));
            } else {
                int quantity = wholeShares(leftover, cashEquivalentPrice.multiply(buyFactor));
                if (quantity > 0) {
                    decision.buy(cashEquivalentOrder(cashEquivalentPrice, quantity, totalValue));
                }
            }
        }

        RebalanceDecision result = decision.build();
        log.debug("Decision for {}: {} sells, {} buys, {} holds, {} warnings", date,
                result.getSells().size(), result.getBuys().size(), result.getHolds().size(),
                result.getWarnings().size());
        return result;
    }

    /**
     * Weak-market decision: exit every equity position and park all cash in the
     * cash-equivalent placeholder.
     */
    public RebalanceDecision moveToCash(LocalDate date, Portfolio portfolio, Map<String, BigDecimal> prices,
                                        BigDecimal additionalCapital) {
        RebalanceDecision.RebalanceDecisionBuilder decision = RebalanceDecision.builder()
                .date(date)
                .weakMarket(true);
        BigDecimal sellFactor = BigDecimal.ONE.subtract(rules.getTransactionCostRate());
        BigDecimal buyFactor = BigDecimal.ONE.add(rules.getTransactionCostRate());
        String cashEquivalent = rules.getCashEquivalentSymbol();

        BigDecimal freeCash = portfolio.getCash().add(nonNull(additionalCapital));
        BigDecimal totalValue = freeCash;
        for (Holding holding : portfolio.getHoldings()) {
            String symbol = holding.getSymbol();
            BigDecimal price = priceOf(prices, symbol);
            BigDecimal mark = price != null ? price : holding.getAverageCost();
            totalValue = totalValue.add(holding.valueAt(mark));
            if (rules.isCashEquivalent(symbol)) {
                continue;
            }
            if (price == null) {
                decision.warning(String.format("No price for %s on %s, position kept", symbol, date));
                decision.hold(RebalanceDecision.HeldPosition.builder()
                        .symbol(symbol)
                        .quantity(holding.getQuantity())
                        .build());
                continue;
            }
            decision.sell(RebalanceDecision.SellOrder.builder()
                    .symbol(symbol)
                    .quantity(holding.getQuantity())
                    .price(price)
                    .reason(RebalanceDecision.SellReason.WEAK_MARKET)
                    .build());
            freeCash = freeCash.add(holding.valueAt(price).multiply(sellFactor));
        }

        BigDecimal cashEquivalentPrice = priceOf(prices, cashEquivalent);
        if (cashEquivalentPrice == null) {
            decision.warning(String.format("No price for %s on %s, proceeds kept as cash", cashEquivalent, date));
        } else {
            int quantity = wholeShares(freeCash, cashEquivalentPrice.multiply(buyFactor));
            if (quantity > 0) {
                decision.buy(cashEquivalentOrder(cashEquivalentPrice, quantity, totalValue));
            }
        }
        return decision.build();
    }

    /**
     * Buys one share at a time of the slot with the lowest value that is still
     * affordable, ties by symbol, until no share fits. Returns the cash left.
     */
    private static BigDecimal distributeLeftover(Collection<String> slots, Portfolio portfolio,
                                                 Map<String, BigDecimal> prices, Map<String, Integer> buyQuantities,
                                                 BigDecimal remaining, BigDecimal buyFactor) {
        Set<String> ordered = new TreeSet<>(slots);
        while (true) {
            String pick = null;
            BigDecimal pickValue = null;
            for (String symbol : ordered) {
                BigDecimal price = priceOf(prices, symbol);
                if (price.multiply(buyFactor).compareTo(remaining) > 0) {
                    continue;
                }
                int quantity = portfolio.quantityOf(symbol) + buyQuantities.getOrDefault(symbol, 0);
                BigDecimal value = price.multiply(BigDecimal.valueOf(quantity));
                if (pick == null || value.compareTo(pickValue) < 0) {
                    pick = symbol;
                    pickValue = value;
                }
            }
            if (pick == null) {
                return remaining;
            }
            buyQuantities.merge(pick, 1, Integer::sum);
            remaining = remaining.subtract(priceOf(prices, pick).multiply(buyFactor));
        }
    }

    private RebalanceDecision.BuyOrder cashEquivalentOrder(BigDecimal price, int quantity, BigDecimal totalValue) {
        double weight = totalValue.signum() > 0
                ? price.multiply(BigDecimal.valueOf(quantity)).divide(totalValue, MONEY_SCALE, RoundingMode.HALF_UP)
                        .doubleValue()
                : 0.0;
        return RebalanceDecision.BuyOrder.builder()
                .symbol(rules.getCashEquivalentSymbol())
                .quantity(quantity)
                .price(price)
                .targetWeight(weight)
                .kind(RebalanceDecision.BuyKind.CASH_EQUIVALENT)
                .build();
    }

    private static BigDecimal priceOf(Map<String, BigDecimal> prices, String symbol) {
        BigDecimal price = prices.get(symbol);
        return price == null || price.signum() <= 0 ? null : price;
    }

    private static int wholeShares(BigDecimal amount, BigDecimal perShare) {
        if (amount.signum() <= 0) {
            return 0;
        }
        return amount.divide(perShare, 0, RoundingMode.DOWN).intValue();
    }

    private static BigDecimal nonNull(BigDecimal amount) {
        return amount == null ? BigDecimal.ZERO : amount;
    }
}
