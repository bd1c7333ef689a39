package io.agentrecall.memory;

/**
 * Filter applied by {@link MemoryStore#listActive(String, MemoryScope)}.
 */
public enum MemoryScope {
    ALL,
    CORE,
    CONTEXTUAL;

    public boolean includes(MemoryCategory category) {
        return switch (this) {
            case ALL -> true;
            case CORE -> category.isCore();
            case CONTEXTUAL -> !category.isCore();
        };
    }
}
