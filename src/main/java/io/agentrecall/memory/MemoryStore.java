package io.agentrecall.memory;

import java.util.List;

/**
 * Read side of an agent memory store. Only active records (not expired) are ever visible.
 *
 * <p>Implementations must return a consistent snapshot per call and a stable order,
 * since retrieval output order follows it.</p>
 */
public interface MemoryStore {

    /**
     * Counts the active memories of an agent.
     *
     * @param agentId the owning agent
     * @return number of memories whose expiry is unset or in the future
     */
    int countActive(String agentId);

    /**
     * Lists the active memories of an agent.
     *
     * @param agentId the owning agent
     * @param scope   which categories to include
     * @return active memories in store order
     */
    List<MemoryRecord> listActive(String agentId, MemoryScope scope);
}
