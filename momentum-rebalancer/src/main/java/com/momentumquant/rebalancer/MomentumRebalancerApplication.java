package com.momentumquant.rebalancer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the momentum rebalancer service.
 * Ranks the universe, plans live rebalances and runs backtests and weight optimizations.
 */
@SpringBootApplication
public class MomentumRebalancerApplication {

    public static void main(String[] args) {
        SpringApplication.run(MomentumRebalancerApplication.class, args);
    }

}
