package com.example.webhookscheduler.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools and the clock used by the scheduling core.
 * <p>
 * - pollerExecutor: processes the candidates of one poller tick, bounded by executor-pool-size
 * - workerExecutor: runs webhook calls taken from the task queue
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Bean(name = "pollerExecutor", destroyMethod = "shutdown")
    public ExecutorService pollerExecutor(WebhookSchedulerProperties properties) {
        log.info("Creating poller executor with {} threads", properties.getExecutorPoolSize());
        return Executors.newFixedThreadPool(properties.getExecutorPoolSize(), namedThreads("poller-"));
    }

    @Bean(name = "workerExecutor", destroyMethod = "shutdown")
    public ExecutorService workerExecutor(WebhookSchedulerProperties properties) {
        log.info("Creating webhook worker executor with {} threads", properties.getWorker().getPoolSize());
        return Executors.newFixedThreadPool(properties.getWorker().getPoolSize(), namedThreads("webhook-worker-"));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private static ThreadFactory namedThreads(String prefix) {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
