package io.agentrecall.memory.retrieval;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tuning for hybrid memory retrieval.
 *
 * <p>Binds to {@code agent.memory.retrieval} in application.yml:</p>
 * <pre>
 * agent:
 *   memory:
 *     retrieval:
 *       bulk-threshold: 30
 *       max-contextual-results: 10
 *       min-score: 0.3
 *       semantic-weight: 0.6
 *       recency-weight: 0.3
 *       importance-weight: 0.1
 *       recency-half-life-days: 30
 *       embedding-failure-policy: FAIL
 *       dependency-timeout: 10s
 * </pre>
 *
 * <p>The three weights are expected to sum to 1.0 so that composite scores stay in [0, 1].
 * This is not checked.</p>
 *
 * @param bulkThreshold          agents with at most this many active memories get all of them, unscored
 * @param maxContextualResults   upper bound on contextual memories returned by the hybrid path
 * @param minScore               composite score a contextual memory needs to be returned
 * @param semanticWeight         weight of the cosine similarity sub-score
 * @param recencyWeight          weight of the recency decay sub-score
 * @param importanceWeight       weight of the importance sub-score
 * @param recencyHalfLifeDays    age in days at which the recency sub-score drops to 0.5
 * @param defaultSemanticScore   semantic sub-score for memories without a usable embedding
 * @param defaultImportance      importance used by the default {@link ImportanceSignal}
 * @param embeddingFailurePolicy behaviour when the query embedding cannot be obtained
 * @param dependencyTimeout      default time budget for one retrieval's store and embedding calls
 */
@ConfigurationProperties(prefix = "agent.memory.retrieval")
public record MemoryRetrievalProperties(
        Integer bulkThreshold,
        Integer maxContextualResults,
        Double minScore,
        Double semanticWeight,
        Double recencyWeight,
        Double importanceWeight,
        Double recencyHalfLifeDays,
        Double defaultSemanticScore,
        Double defaultImportance,
        EmbeddingFailurePolicy embeddingFailurePolicy,
        Duration dependencyTimeout
) {

    public MemoryRetrievalProperties {
        if (bulkThreshold == null) {
            bulkThreshold = 30;
        }
        if (maxContextualResults == null) {
            maxContextualResults = 10;
        }
        if (minScore == null) {
            minScore = 0.3;
        }
        if (semanticWeight == null) {
            semanticWeight = 0.6;
        }
        if (recencyWeight == null) {
            recencyWeight = 0.3;
        }
        if (importanceWeight == null) {
            importanceWeight = 0.1;
        }
        if (recencyHalfLifeDays == null) {
            recencyHalfLifeDays = 30.0;
        }
        if (defaultSemanticScore == null) {
            defaultSemanticScore = 0.5;
        }
        if (defaultImportance == null) {
            defaultImportance = 0.5;
        }
        if (embeddingFailurePolicy == null) {
            embeddingFailurePolicy = EmbeddingFailurePolicy.FAIL;
        }
        if (dependencyTimeout == null) {
            dependencyTimeout = Duration.ofSeconds(10);
        }
        if (recencyHalfLifeDays <= 0) {
            throw new IllegalArgumentException("recencyHalfLifeDays must be positive: " + recencyHalfLifeDays);
        }
        if (maxContextualResults < 0) {
            throw new IllegalArgumentException("maxContextualResults must not be negative: " + maxContextualResults);
        }
    }

    /**
     * Returns the built-in defaults.
     */
    public static MemoryRetrievalProperties defaults() {
        return new MemoryRetrievalProperties(null, null, null, null, null, null, null, null, null, null, null);
    }

    public MemoryRetrievalProperties withEmbeddingFailurePolicy(EmbeddingFailurePolicy policy) {
        return new MemoryRetrievalProperties(bulkThreshold, maxContextualResults, minScore, semanticWeight,
                recencyWeight, importanceWeight, recencyHalfLifeDays, defaultSemanticScore, defaultImportance,
                policy, dependencyTimeout);
    }

    public MemoryRetrievalProperties withDependencyTimeout(Duration timeout) {
        return new MemoryRetrievalProperties(bulkThreshold, maxContextualResults, minScore, semanticWeight,
                recencyWeight, importanceWeight, recencyHalfLifeDays, defaultSemanticScore, defaultImportance,
                embeddingFailurePolicy, timeout);
    }

    public MemoryRetrievalProperties withWeights(double semantic, double recency, double importance) {
        return new MemoryRetrievalProperties(bulkThreshold, maxContextualResults, minScore, semantic,
                recency, importance, recencyHalfLifeDays, defaultSemanticScore, defaultImportance,
                embeddingFailurePolicy, dependencyTimeout);
    }
}
