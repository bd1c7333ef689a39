package io.agentrecall.config;

import io.agentrecall.memory.retrieval.ImportanceSignal;
import io.agentrecall.memory.retrieval.MemoryRetrievalProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Memory subsystem wiring: retrieval tuning, the clock used for recency and expiry,
 * the executor that bounds store and embedding calls, and the default importance signal.
 */
@Configuration
@EnableConfigurationProperties(MemoryRetrievalProperties.class)
public class MemoryConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService memoryRetrievalExecutor() {
        var counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "memory-retrieval-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    @ConditionalOnMissingBean
    public ImportanceSignal importanceSignal(MemoryRetrievalProperties properties) {
        return ImportanceSignal.constant(properties.defaultImportance());
    }
}
