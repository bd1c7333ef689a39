package io.agentrecall.memory.retrieval;

/**
 * The caller passed an unusable argument, such as a blank agent id.
 */
public class MemoryValidationException extends MemoryRetrievalException {

    public MemoryValidationException(String message) {
        super(message);
    }
}
