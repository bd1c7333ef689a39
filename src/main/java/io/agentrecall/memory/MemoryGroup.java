package io.agentrecall.memory;

/**
 * Retrieval tier a {@link MemoryCategory} belongs to.
 *
 * <ul>
 *   <li>{@code CORE} — always injected into the prompt.</li>
 *   <li>{@code CONTEXTUAL} — scored against the current message and injected only when relevant.</li>
 * </ul>
 */
public enum MemoryGroup {
    CORE,
    CONTEXTUAL
}
