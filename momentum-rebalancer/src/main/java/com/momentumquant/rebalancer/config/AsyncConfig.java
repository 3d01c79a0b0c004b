package com.momentumquant.rebalancer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pool for evaluating optimizer candidates in parallel.
 * Sized by {@code momentum.optimizer.worker-threads}.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "optimizerExecutorService", destroyMethod = "shutdown")
    public ExecutorService optimizerExecutorService(MomentumProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.getOptimizer().getWorkerThreads(),
                r -> {
                    Thread thread = new Thread(r);
                    thread.setName("OptimizerWorker-" + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                });
    }
}
