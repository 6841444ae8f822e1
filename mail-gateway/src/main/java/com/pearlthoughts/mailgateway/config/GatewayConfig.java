package com.pearlthoughts.mailgateway.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
@EnableScheduling
public class GatewayConfig {

    @Value("${mail.gateway.bulk.parallelism:1}")
    private int bulkParallelism;

    @Value("${mail.relay.pool-size:5}")
    private int poolSize;

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Workers for concurrent bulk sends; never wider than the relay pool.
     */
    @Bean(name = "bulkDispatchExecutor")
    public ThreadPoolTaskExecutor bulkDispatchExecutor() {
        int threads = Math.max(1, Math.min(bulkParallelism, poolSize));
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("bulk-dispatch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
