package io.agentrecall.memory.retrieval;

import io.agentrecall.embedding.EmbeddingProvider;
import io.agentrecall.memory.Embedding;
import io.agentrecall.memory.MemoryRecord;
import io.agentrecall.memory.MemoryScope;
import io.agentrecall.memory.MemoryStore;
import io.agentrecall.memory.RetrievedMemory;
import io.agentrecall.memory.retrieval.DependencyUnavailableException.Dependency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Selects the memories of an agent to inject into the next prompt.
 *
 * <p>Small memory sets (at most {@code bulkThreshold} active memories) are returned whole, in
 * store order, without an embedding call. Larger sets use hybrid retrieval:</p>
 * <ul>
 *   <li>core memories (INSTRUCTION, PREFERENCE, STYLE_CORRECTION) are always included</li>
 *   <li>contextual memories (GENERAL, CONTEXT, HISTORY) are scored against the user message,
 *       filtered by {@code minScore}, ranked and capped at {@code maxContextualResults}</li>
 * </ul>
 *
 * <p>The output lists core memories first, then contextual ones by descending score; equal scores
 * keep store order. Keys are unique, a core memory wins over a contextual one with the same key.</p>
 *
 * <p>Stateless and read-only, so concurrent calls need no coordination. Each store and embedding
 * call runs on the retrieval executor and is bounded by the call's deadline.</p>
 */
@Service
public class MemoryRetrievalEngine {

    private static final Logger log = LoggerFactory.getLogger(MemoryRetrievalEngine.class);

    private final MemoryStore store;
    private final EmbeddingProvider embeddingProvider;
    private final CompositeScorer scorer;
    private final MemoryRetrievalProperties properties;
    private final Clock clock;
    private final ExecutorService executor;

    public MemoryRetrievalEngine(
            MemoryStore store,
            EmbeddingProvider embeddingProvider,
            CompositeScorer scorer,
            MemoryRetrievalProperties properties,
            Clock clock,
            @Qualifier("memoryRetrievalExecutor") ExecutorService executor
    ) {
        this.store = store;
        this.embeddingProvider = embeddingProvider;
        this.scorer = scorer;
        this.properties = properties;
        this.clock = clock;
        this.executor = executor;
        log.info("Memory retrieval: bulk threshold {}, max {} contextual results, min score {}, failure policy {}",
                properties.bulkThreshold(), properties.maxContextualResults(), properties.minScore(),
                properties.embeddingFailurePolicy());
    }

    /**
     * Retrieves the memories for an agent turn within the configured dependency timeout.
     *
     * @param agentId     the agent whose memories to load
     * @param userMessage the current user message, used as the semantic query
     * @return memories ready for prompt injection
     * @throws MemoryValidationException      if {@code agentId} is null or blank
     * @throws DependencyUnavailableException if the store or the embedding provider fails
     */
    public List<RetrievedMemory> retrieve(String agentId, String userMessage) {
        return retrieve(agentId, userMessage, clock.instant().plus(properties.dependencyTimeout()));
    }

    /**
     * Retrieves the memories for an agent turn, giving up on external calls at {@code deadline}.
     *
     * @param agentId     the agent whose memories to load
     * @param userMessage the current user message, used as the semantic query
     * @param deadline    instant after which pending store or embedding calls are abandoned
     * @return memories ready for prompt injection
     * @throws MemoryValidationException      if {@code agentId} is null or blank
     * @throws DependencyUnavailableException if the store or the embedding provider fails or the deadline passes
     */
    public List<RetrievedMemory> retrieve(String agentId, String userMessage, Instant deadline) {
        if (agentId == null || agentId.isBlank()) {
            throw new MemoryValidationException("agentId must not be blank");
        }
        String query = userMessage == null ? "" : userMessage;

        int activeCount = call(Dependency.STORE, "count memories", () -> store.countActive(agentId), deadline);

        if (activeCount <= properties.bulkThreshold()) {
            List<MemoryRecord> all = call(Dependency.STORE, "list memories",
                    () -> store.listActive(agentId, MemoryScope.ALL), deadline);
            log.debug("Agent {}: {} active memories, loading all", agentId, activeCount);
            return toRetrieved(all);
        }

        return hybridRetrieve(agentId, query, activeCount, deadline);
    }

    private List<RetrievedMemory> hybridRetrieve(String agentId, String query, int activeCount, Instant deadline) {
        requireTimeLeft(Dependency.STORE, "list memories", deadline);
        Future<List<MemoryRecord>> coreFuture = executor.submit(() -> store.listActive(agentId, MemoryScope.CORE));
        Future<List<MemoryRecord>> contextualFuture =
                executor.submit(() -> store.listActive(agentId, MemoryScope.CONTEXTUAL));

        List<MemoryRecord> core;
        List<MemoryRecord> contextual;
        try {
            core = await(Dependency.STORE, "list core memories", coreFuture, deadline);
            contextual = await(Dependency.STORE, "list contextual memories", contextualFuture, deadline);
        } catch (DependencyUnavailableException e) {
            coreFuture.cancel(true);
            contextualFuture.cancel(true);
            throw e;
        }

        if (contextual.isEmpty()) {
            log.debug("Agent {}: {} active memories, no contextual ones, returning {} core",
                    agentId, activeCount, core.size());
            return toRetrieved(core);
        }

        Embedding queryEmbedding;
        try {
            queryEmbedding = embedQuery(query, deadline);
        } catch (DependencyUnavailableException e) {
            if (properties.embeddingFailurePolicy() == EmbeddingFailurePolicy.CORE_ONLY) {
                log.warn("Agent {}: query embedding unavailable, returning {} core memories only: {}",
                        agentId, core.size(), e.getMessage());
                return toRetrieved(core);
            }
            throw e;
        }

        List<ScoredMemory> ranked = rank(contextual, queryEmbedding);
        log.debug("Agent {}: {} active memories, {} core + {}/{} contextual selected",
                agentId, activeCount, core.size(), ranked.size(), contextual.size());
        return merge(core, ranked);
    }

    private Embedding embedQuery(String query, Instant deadline) {
        Embedding embedding = call(Dependency.EMBEDDING, "embed query", () -> embeddingProvider.embed(query), deadline);
        if (embedding == null || embedding.dimensions() == 0) {
            throw new DependencyUnavailableException(Dependency.EMBEDDING, "embed query returned an empty embedding");
        }
        if (!embedding.isUsable()) {
            throw new DependencyUnavailableException(Dependency.EMBEDDING,
                    "embed query returned a zero or non-finite vector of " + embedding.dimensions() + " dimensions");
        }
        return embedding;
    }

    /**
     * Scores, filters, sorts (stable, so ties keep store order) and truncates contextual memories.
     */
    List<ScoredMemory> rank(List<MemoryRecord> contextual, Embedding queryEmbedding) {
        Instant now = clock.instant();
        return contextual.stream()
                .map(record -> new ScoredMemory(record, scorer.score(record, queryEmbedding, now)))
                .filter(scored -> scored.composite() >= properties.minScore())
                .sorted(Comparator.comparingDouble(ScoredMemory::composite).reversed())
                .limit(properties.maxContextualResults())
                .toList();
    }

    private List<RetrievedMemory> merge(List<MemoryRecord> core, List<ScoredMemory> contextual) {
        Set<String> seen = new HashSet<>();
        List<RetrievedMemory> result = new ArrayList<>(core.size() + contextual.size());

        for (MemoryRecord record : core) {
            if (seen.add(record.key())) {
                result.add(record.toRetrieved());
            }
        }
        for (ScoredMemory scored : contextual) {
            if (seen.add(scored.record().key())) {
                result.add(scored.record().toRetrieved());
            } else {
                log.debug("Dropping contextual memory '{}' shadowed by an earlier entry", scored.record().key());
            }
        }

        return List.copyOf(result);
    }

    private List<RetrievedMemory> toRetrieved(List<MemoryRecord> records) {
        Set<String> seen = new HashSet<>();
        List<RetrievedMemory> result = new ArrayList<>(records.size());
        for (MemoryRecord record : records) {
            if (seen.add(record.key())) {
                result.add(record.toRetrieved());
            }
        }
        return List.copyOf(result);
    }

    private <T> T call(Dependency dependency, String operation, Callable<T> task, Instant deadline) {
        requireTimeLeft(dependency, operation, deadline);
        return await(dependency, operation, executor.submit(task), deadline);
    }

    private <T> T await(Dependency dependency, String operation, Future<T> future, Instant deadline) {
        long remainingMillis = Duration.between(clock.instant(), deadline).toMillis();
        try {
            return future.get(Math.max(0L, remainingMillis), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new DependencyUnavailableException(dependency, operation + " timed out", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new DependencyUnavailableException(dependency, operation + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new DependencyUnavailableException(dependency, operation + " failed: " + cause.getMessage(), cause);
        }
    }

    private void requireTimeLeft(Dependency dependency, String operation, Instant deadline) {
        if (!clock.instant().isBefore(deadline)) {
            throw new DependencyUnavailableException(dependency, operation + " not attempted: deadline has passed");
        }
    }
}
