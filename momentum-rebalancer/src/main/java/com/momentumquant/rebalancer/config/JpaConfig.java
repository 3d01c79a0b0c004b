package com.momentumquant.rebalancer.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * JPA configuration for price history and surveillance-list storage.
 */
@Configuration
@EnableJpaRepositories(basePackages = "com.momentumquant.rebalancer.repository")
@EnableTransactionManagement
public class JpaConfig {
}
