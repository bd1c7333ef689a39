package io.agentrecall.memory.retrieval;

import io.agentrecall.memory.MemoryRecord;

/**
 * A contextual memory together with its score for the current query. Never persisted.
 */
record ScoredMemory(MemoryRecord record, MemoryScore score) {

    double composite() {
        return score.composite();
    }
}
