package io.agentrecall.memory.retrieval;

/**
 * The memory store or the embedding provider failed, timed out or was interrupted.
 * The engine never retries; the caller decides whether to continue without memories.
 */
public class DependencyUnavailableException extends MemoryRetrievalException {

    public enum Dependency {
        STORE,
        EMBEDDING
    }

    private final Dependency dependency;

    public DependencyUnavailableException(Dependency dependency, String message, Throwable cause) {
        super(message, cause);
        this.dependency = dependency;
    }

    public DependencyUnavailableException(Dependency dependency, String message) {
        super(message);
        this.dependency = dependency;
    }

    public Dependency dependency() {
        return dependency;
    }
}
