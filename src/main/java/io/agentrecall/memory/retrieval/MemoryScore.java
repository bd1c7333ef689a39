package io.agentrecall.memory.retrieval;

/**
 * Sub-scores and weighted composite of one contextual memory.
 *
 * @param semantic   cosine similarity to the query, or the default for memories without a usable embedding
 * @param recency    exponential decay of the memory's age
 * @param importance importance signal
 * @param composite  weighted sum of the three
 */
public record MemoryScore(double semantic, double recency, double importance, double composite) {
}
