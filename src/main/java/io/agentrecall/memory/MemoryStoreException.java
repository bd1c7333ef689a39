package io.agentrecall.memory;

/**
 * Raised by store implementations when the backing storage fails.
 */
public class MemoryStoreException extends RuntimeException {

    public MemoryStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
