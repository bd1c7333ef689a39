package io.agentrecall.memory;

import io.agentrecall.embedding.EmbeddingProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Write path for agent memories: embeds each memory as {@code "key: value"} and upserts it.
 *
 * <p>If the embedding cannot be computed the memory is still stored, without an embedding;
 * retrieval then treats it as moderately relevant.</p>
 */
@Component
public class MemoryWriter {

    private static final Logger log = LoggerFactory.getLogger(MemoryWriter.class);

    private final MutableMemoryStore store;
    private final EmbeddingProvider embeddingProvider;
    private final Clock clock;

    public MemoryWriter(MutableMemoryStore store, EmbeddingProvider embeddingProvider, Clock clock) {
        this.store = store;
        this.embeddingProvider = embeddingProvider;
        this.clock = clock;
    }

    /**
     * Stores or overwrites a memory.
     *
     * @param agentId  owning agent
     * @param key      memory key, reusing an existing key overwrites it
     * @param value    memory content
     * @param category memory category
     * @param ttl      time to live, null for a memory that never expires
     * @return the stored memory
     */
    public MemoryRecord remember(String agentId, String key, String value, MemoryCategory category, Duration ttl) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId must not be blank");
        }
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("value must not be blank");
        }

        Instant now = clock.instant();
        Instant expiresAt = ttl == null ? null : now.plus(ttl);
        MemoryCategory resolved = category == null ? MemoryCategory.GENERAL : category;

        var record = new MemoryRecord(key, value.trim(), resolved, embed(key, value.trim()), now, expiresAt);
        store.upsert(agentId, record);
        log.debug("Remembered memory: agent={}, key='{}', category={}, embedded={}",
                agentId, key, resolved, record.embedding().isPresent());
        return record;
    }

    /**
     * Deletes a memory.
     *
     * @return true if it existed
     */
    public boolean forget(String agentId, String key) {
        return store.forget(agentId, key);
    }

    private Optional<Embedding> embed(String key, String value) {
        try {
            Embedding embedding = embeddingProvider.embed("%s: %s".formatted(key, value));
            if (embedding == null || embedding.dimensions() == 0) {
                log.warn("Embedding provider returned no vector for memory '{}', storing without embedding", key);
                return Optional.empty();
            }
            return Optional.of(embedding);
        } catch (RuntimeException e) {
            log.warn("Failed to embed memory '{}', storing without embedding: {}", key, e.getMessage());
            return Optional.empty();
        }
    }
}
