package io.agentrecall.memory.retrieval;

import io.agentrecall.memory.MemoryRecord;

/**
 * Per-memory importance in [0, 1], the third input of the composite score.
 */
@FunctionalInterface
public interface ImportanceSignal {

    double importanceOf(MemoryRecord record);

    /**
     * Same importance for every memory.
     */
    static ImportanceSignal constant(double importance) {
        return record -> importance;
    }
}
