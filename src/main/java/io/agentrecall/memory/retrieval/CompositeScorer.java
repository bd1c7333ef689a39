package io.agentrecall.memory.retrieval;

import io.agentrecall.memory.Embedding;
import io.agentrecall.memory.MemoryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Scores contextual memories against a query embedding.
 *
 * <pre>
 * composite = semanticWeight * semantic + recencyWeight * recency + importanceWeight * importance
 * recency   = 0.5 ^ (ageDays / halfLifeDays)
 * </pre>
 *
 * <p>A memory whose embedding is missing, of a different dimension than the query, or of zero
 * norm gets the default semantic score instead of being excluded.</p>
 */
@Component
public class CompositeScorer {

    private static final Logger log = LoggerFactory.getLogger(CompositeScorer.class);
    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final MemoryRetrievalProperties properties;
    private final ImportanceSignal importanceSignal;

    public CompositeScorer(MemoryRetrievalProperties properties, ImportanceSignal importanceSignal) {
        this.properties = properties;
        this.importanceSignal = importanceSignal;
    }

    public MemoryScore score(MemoryRecord record, Embedding query, Instant now) {
        double semantic = semanticScore(record, query);
        double recency = recencyScore(record.updatedAt(), now);
        double importance = importanceSignal.importanceOf(record);

        double composite = properties.semanticWeight() * semantic
                + properties.recencyWeight() * recency
                + properties.importanceWeight() * importance;

        if (log.isDebugEnabled()) {
            log.debug("Scored memory '{}': semantic={}, recency={}, importance={}, composite={}",
                    record.key(), "%.3f".formatted(semantic), "%.3f".formatted(recency),
                    "%.3f".formatted(importance), "%.3f".formatted(composite));
        }
        return new MemoryScore(semantic, recency, importance, composite);
    }

    /**
     * Cosine similarity clamped to [0, 1], or the default when the memory has no usable embedding.
     */
    double semanticScore(MemoryRecord record, Embedding query) {
        Optional<Embedding> embedding = record.embedding();
        if (embedding.isEmpty()) {
            return properties.defaultSemanticScore();
        }
        if (!embedding.get().isComparableTo(query)) {
            log.warn("Memory '{}' has an unusable embedding ({} vs query {}), using default semantic score",
                    record.key(), embedding.get().dimensions(), query.dimensions());
            return properties.defaultSemanticScore();
        }
        double similarity = query.cosineSimilarity(embedding.get());
        return Math.max(0.0, Math.min(1.0, similarity));
    }

    /**
     * 1.0 at age zero, 0.5 after one half-life. Writes dated in the future count as age zero.
     */
    double recencyScore(Instant updatedAt, Instant now) {
        long ageMillis = Math.max(0L, Duration.between(updatedAt, now).toMillis());
        double ageDays = ageMillis / MILLIS_PER_DAY;
        return Math.pow(0.5, ageDays / properties.recencyHalfLifeDays());
    }
}
