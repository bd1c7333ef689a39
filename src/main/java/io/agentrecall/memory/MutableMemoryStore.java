package io.agentrecall.memory;

import java.util.Optional;

/**
 * Write side of the memory store, used by the write path and never by retrieval.
 */
public interface MutableMemoryStore extends MemoryStore {

    /**
     * Inserts or replaces the memory with the record's key. {@code updatedAt} is refreshed to the
     * store's current time regardless of the value carried by the record.
     */
    void upsert(String agentId, MemoryRecord record);

    /**
     * Gets a memory by key, whether active or expired.
     */
    Optional<MemoryRecord> get(String agentId, String key);

    /**
     * Deletes a memory by key.
     *
     * @return true if the memory was found and deleted
     */
    boolean forget(String agentId, String key);
}
