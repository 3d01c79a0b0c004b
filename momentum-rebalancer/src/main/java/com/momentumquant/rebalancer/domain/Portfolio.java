package com.momentumquant.rebalancer.domain;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Cash plus whole-share holdings, with the history of executed trades.
 * Cash never goes negative: orders that cannot be paid for are rejected.
 */
@Slf4j
public class Portfolio {

    @Getter
    private BigDecimal cash;

    private final Map<String, Holding> holdings = new TreeMap<>();

    private final List<Trade> trades = new ArrayList<>();

    public Portfolio(BigDecimal cash) {
        if (cash == null || cash.signum() < 0) {
            throw new IllegalArgumentException("Starting cash must not be negative: " + cash);
        }
        this.cash = cash;
    }

    public static Portfolio of(BigDecimal cash, Collection<Holding> positions) {
        Portfolio portfolio = new Portfolio(cash);
        for (Holding holding : positions) {
            if (holding.getQuantity() > 0) {
                portfolio.holdings.put(holding.getSymbol(), holding);
            }
        }
        return portfolio;
    }

    public Portfolio copy() {
        Portfolio copy = of(cash, holdings.values());
        copy.trades.addAll(trades);
        return copy;
    }

    /**
     * Buy whole shares at the given price plus commission.
     *
     * @return false when cash does not cover the cost, in which case nothing changes
     */
    public boolean buy(LocalDate date, String symbol, BigDecimal price, int quantity, BigDecimal costRate) {
        if (quantity <= 0) {
            return false;
        }
        BigDecimal gross = price.multiply(BigDecimal.valueOf(quantity));
        BigDecimal commission = gross.multiply(costRate);
        BigDecimal cost = gross.add(commission);
        if (cash.compareTo(cost) < 0) {
            log.warn("Rejected buy of {} x {} on {}: cost {} exceeds cash {}", quantity, symbol, date, cost, cash);
            return false;
        }

        cash = cash.subtract(cost);
        Holding current = holdings.get(symbol);
        holdings.put(symbol, current == null
                ? new Holding(symbol, quantity, price)
                : current.add(quantity, price));
        trades.add(Trade.builder()
                .date(date)
                .symbol(symbol)
                .type(Trade.TradeType.BUY)
                .price(price)
                .quantity(quantity)
                .commission(commission)
                .build());
        log.debug("BUY {} x {} @ {} on {}", quantity, symbol, price, date);
        return true;
    }

    /**
     * Sell whole shares at the given price less commission.
     *
     * @return false when fewer shares are held, in which case nothing changes
     */
    public boolean sell(LocalDate date, String symbol, BigDecimal price, int quantity, BigDecimal costRate) {
        Holding current = holdings.get(symbol);
        if (quantity <= 0 || current == null || current.getQuantity() < quantity) {
            return false;
        }
        BigDecimal gross = price.multiply(BigDecimal.valueOf(quantity));
        BigDecimal commission = gross.multiply(costRate);

        cash = cash.add(gross.subtract(commission));
        Holding remaining = current.remove(quantity);
        if (remaining.getQuantity() == 0) {
            holdings.remove(symbol);
        } else {
            holdings.put(symbol, remaining);
        }
        trades.add(Trade.builder()
                .date(date)
                .symbol(symbol)
                .type(Trade.TradeType.SELL)
                .price(price)
                .quantity(quantity)
                .commission(commission)
                .build());
        log.debug("SELL {} x {} @ {} on {}", quantity, symbol, price, date);
        return true;
    }

    /**
     * Execute a decision: all sells first, then all buys, at the order prices.
     *
     * @return the trades that were filled
     */
    public List<Trade> execute(RebalanceDecision decision, BigDecimal costRate) {
        int before = trades.size();
        for (RebalanceDecision.SellOrder order : decision.getSells()) {
            if (!sell(decision.getDate(), order.getSymbol(), order.getPrice(), order.getQuantity(), costRate)) {
                log.warn("Sell of {} x {} on {} could not be filled", order.getQuantity(), order.getSymbol(),
                        decision.getDate());
            }
        }
        for (RebalanceDecision.BuyOrder order : decision.getBuys()) {
            if (!buy(decision.getDate(), order.getSymbol(), order.getPrice(), order.getQuantity(), costRate)) {
                log.warn("Buy of {} x {} on {} could not be filled", order.getQuantity(), order.getSymbol(),
                        decision.getDate());
            }
        }
        return List.copyOf(trades.subList(before, trades.size()));
    }

    public boolean holds(String symbol) {
        return holdings.containsKey(symbol);
    }

    public int quantityOf(String symbol) {
        Holding holding = holdings.get(symbol);
        return holding == null ? 0 : holding.getQuantity();
    }

    public Optional<Holding> holding(String symbol) {
        return Optional.ofNullable(holdings.get(symbol));
    }

    public Collection<Holding> getHoldings() {
        return Collections.unmodifiableCollection(holdings.values());
    }

    public Set<String> heldSymbols() {
        return Collections.unmodifiableSet(holdings.keySet());
    }

    public List<Trade> getTrades() {
        return Collections.unmodifiableList(trades);
    }

    /**
     * Symbol to share count, in symbol order.
     */
    public Map<String, Integer> positions() {
        Map<String, Integer> positions = new LinkedHashMap<>();
        holdings.values().forEach(h -> positions.put(h.getSymbol(), h.getQuantity()));
        return positions;
    }

    /**
     * Cash plus holdings marked at the looked-up price, or at average cost
     * when no price is known.
     */
    public BigDecimal totalValue(Function<String, Optional<BigDecimal>> priceLookup) {
        BigDecimal total = cash;
        for (Holding holding : holdings.values()) {
            BigDecimal price = priceLookup.apply(holding.getSymbol()).orElse(holding.getAverageCost());
            total = total.add(holding.valueAt(price));
        }
        return total;
    }
}
