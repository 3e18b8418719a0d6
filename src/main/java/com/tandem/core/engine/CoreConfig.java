package com.tandem.core.engine;

import com.tandem.core.wait.WaitProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared infrastructure beans for the interaction engine.
 */
@Configuration
public class CoreConfig {

    private static final Logger log = LoggerFactory.getLogger(CoreConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Scheduler shared by all pending waits. It runs periodic re-checks and expiry
     * timers, and evaluates waits woken by events; no thread is held between evaluations.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService waitScheduler(WaitProperties waitProperties) {
        int threads = Math.max(1, waitProperties.getSchedulerThreads());
        log.info("Starting wait scheduler with {} thread(s)", threads);
        AtomicInteger counter = new AtomicInteger();
        return Executors.newScheduledThreadPool(threads, r -> {
            Thread t = new Thread(r, "tandem-wait-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
