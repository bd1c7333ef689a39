package io.agentrecall.config;

import io.agentrecall.memory.Embedding;
import io.agentrecall.memory.MemoryCategory;
import io.agentrecall.memory.MemoryRecord;
import io.agentrecall.memory.retrieval.EmbeddingFailurePolicy;
import io.agentrecall.memory.retrieval.ImportanceSignal;
import io.agentrecall.memory.retrieval.MemoryRetrievalProperties;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;

import static org.junit.jupiter.api.Assertions.*;

class MemoryConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(MemoryConfig.class);

    @Test
    void shouldBindDefaults() {
        contextRunner.run(context -> {
            var properties = context.getBean(MemoryRetrievalProperties.class);
            assertEquals(30, properties.bulkThreshold());
            assertEquals(10, properties.maxContextualResults());
            assertEquals(0.3, properties.minScore(), 1e-12);
            assertEquals(0.6, properties.semanticWeight(), 1e-12);
            assertEquals(0.3, properties.recencyWeight(), 1e-12);
            assertEquals(0.1, properties.importanceWeight(), 1e-12);
            assertEquals(30.0, properties.recencyHalfLifeDays(), 1e-12);
            assertEquals(EmbeddingFailurePolicy.FAIL, properties.embeddingFailurePolicy());
            assertEquals(Duration.ofSeconds(10), properties.dependencyTimeout());
        });
    }

    @Test
    void shouldBindOverrides() {
        contextRunner
                .withPropertyValues(
                        "agent.memory.retrieval.bulk-threshold=12",
                        "agent.memory.retrieval.min-score=0.45",
                        "agent.memory.retrieval.default-importance=0.8",
                        "agent.memory.retrieval.embedding-failure-policy=CORE_ONLY",
                        "agent.memory.retrieval.dependency-timeout=250ms")
                .run(context -> {
                    var properties = context.getBean(MemoryRetrievalProperties.class);
                    assertEquals(12, properties.bulkThreshold());
                    assertEquals(0.45, properties.minScore(), 1e-12);
                    assertEquals(EmbeddingFailurePolicy.CORE_ONLY, properties.embeddingFailurePolicy());
                    assertEquals(Duration.ofMillis(250), properties.dependencyTimeout());
                    assertEquals(10, properties.maxContextualResults());

                    var record = new MemoryRecord("k", "v", MemoryCategory.GENERAL, Instant.EPOCH)
                            .withEmbedding(Embedding.of(1f));
                    assertEquals(0.8, context.getBean(ImportanceSignal.class).importanceOf(record), 1e-12);
                });
    }

    @Test
    void shouldRejectNonPositiveHalfLife() {
        contextRunner
                .withPropertyValues("agent.memory.retrieval.recency-half-life-days=0")
                .run(context -> assertNotNull(context.getStartupFailure()));
    }

    @Test
    void shouldProvideClockAndExecutor() {
        contextRunner.run(context -> {
            assertNotNull(context.getBean(Clock.class));
            assertNotNull(context.getBean("memoryRetrievalExecutor", ExecutorService.class));
        });
    }

    @Test
    void shouldKeepCustomImportanceSignal() {
        contextRunner
                .withBean(ImportanceSignal.class, () -> record -> 1.0)
                .run(context -> {
                    var record = new MemoryRecord("k", "v", MemoryCategory.HISTORY, Instant.EPOCH);
                    assertEquals(1.0, context.getBean(ImportanceSignal.class).importanceOf(record));
                });
    }
}
