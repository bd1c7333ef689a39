package io.agentrecall.memory.retrieval;

/**
 * Base class for failures surfaced by {@link MemoryRetrievalEngine}.
 */
public class MemoryRetrievalException extends RuntimeException {

    public MemoryRetrievalException(String message) {
        super(message);
    }

    public MemoryRetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
