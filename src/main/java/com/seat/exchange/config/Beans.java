package com.seat.exchange.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;


@Configuration
@Slf4j
public class Beans {

    @Bean(name = "matchingExecutor")
    public ThreadPoolTaskExecutor matchingExecutor(
            @Value("${exchange.matching.executor.core-pool-size:3}") int corePoolSize,
            @Value("${exchange.matching.executor.max-pool-size:6}") int maxPoolSize
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("match-lookup-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    @Bean(name = "solverExecutor", destroyMethod = "shutdown")
    public ExecutorService solverExecutor(
            MeterRegistry meterRegistry,
            @Value("${exchange.optimizer.executor.pool-size:2}") int poolSize
    ) {
        ThreadFactory threadFactory = new ThreadFactoryBuilder()
                .setNameFormat("cycle-solver-%d")
                .setUncaughtExceptionHandler((t, e) -> log.error("Uncaught exception in {}", t.getName(), e))
                .build();

        return new ThreadPoolExecutor(
                poolSize, poolSize,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(16),
                threadFactory,
                new ThreadPoolExecutor.AbortPolicy() {
                    @Override
                    public void rejectedExecution(Runnable r, ThreadPoolExecutor e) {
                        meterRegistry.counter("solver_executor_rejections").increment();
                        log.warn("solver task rejected: queue size={}", e.getQueue().size());
                        super.rejectedExecution(r, e);
                    }
                }
        );
    }

    @Bean(name = "optimisticLockRetryTemplate")
    public RetryTemplate optimisticLockRetryTemplate() {
        SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(3, Map.of(
                OptimisticLockingFailureException.class, true
        ));
        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(50);
        backOffPolicy.setMultiplier(2.0);
        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(retryPolicy);
        template.setBackOffPolicy(backOffPolicy);
        return template;
    }
}
