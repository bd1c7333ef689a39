package io.agentrecall.memory.retrieval;

/**
 * What the retrieval engine does when the query embedding cannot be obtained on the hybrid path.
 */
public enum EmbeddingFailurePolicy {
    /** Propagate a {@link DependencyUnavailableException} to the caller. */
    FAIL,
    /** Log the failure and return the core memories only. */
    CORE_ONLY
}
