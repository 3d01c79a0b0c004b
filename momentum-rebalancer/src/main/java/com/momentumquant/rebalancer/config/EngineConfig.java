package com.momentumquant.rebalancer.config;

import com.momentumquant.rebalancer.domain.BacktestSimulator;
import com.momentumquant.rebalancer.domain.PriceHistoryProvider;
import com.momentumquant.rebalancer.domain.RestrictionListProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the Spring-free engine classes to the database-backed providers.
 */
@Configuration
@EnableConfigurationProperties(MomentumProperties.class)
public class EngineConfig {

    @Bean
    public BacktestSimulator backtestSimulator(PriceHistoryProvider priceHistoryProvider,
                                               RestrictionListProvider restrictionListProvider) {
        return new BacktestSimulator(priceHistoryProvider, restrictionListProvider);
    }
}
