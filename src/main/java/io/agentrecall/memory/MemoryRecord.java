package io.agentrecall.memory;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A single durable fact about an agent.
 *
 * @param key       identity of the memory within one agent's set
 * @param value     the content injected verbatim into the prompt
 * @param category  memory category, decides the retrieval tier
 * @param embedding embedding of the memory, empty when not computed yet
 * @param updatedAt time of the last write, drives recency scoring
 * @param expiresAt optional expiry; the record is inactive from this instant on (null = never)
 */
public record MemoryRecord(
        String key,
        String value,
        MemoryCategory category,
        Optional<Embedding> embedding,
        Instant updatedAt,
        Instant expiresAt
) {
    public MemoryRecord {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(updatedAt, "updatedAt");
        value = value == null ? "" : value;
        embedding = embedding == null ? Optional.empty() : embedding;
    }

    public MemoryRecord(String key, String value, MemoryCategory category, Instant updatedAt) {
        this(key, value, category, Optional.empty(), updatedAt, null);
    }

    public MemoryRecord withEmbedding(Embedding embedding) {
        return new MemoryRecord(key, value, category, Optional.ofNullable(embedding), updatedAt, expiresAt);
    }

    public MemoryRecord withExpiresAt(Instant expiresAt) {
        return new MemoryRecord(key, value, category, embedding, updatedAt, expiresAt);
    }

    public boolean isActive(Instant now) {
        return expiresAt == null || expiresAt.isAfter(now);
    }

    public RetrievedMemory toRetrieved() {
        return new RetrievedMemory(key, value, category);
    }
}
