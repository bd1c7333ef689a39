package io.agentrecall.core;

import io.agentrecall.memory.RetrievedMemory;
import io.agentrecall.memory.retrieval.MemoryRetrievalEngine;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.StringJoiner;

/**
 * Builds the memory section of an agent's system prompt.
 *
 * <pre>
 * ## Memories
 * - preferred_language: French
 * - target_companies: Acme, Globex
 * </pre>
 */
@Component
public class MemoryContextBuilder {

    private final MemoryRetrievalEngine retrievalEngine;

    public MemoryContextBuilder(MemoryRetrievalEngine retrievalEngine) {
        this.retrievalEngine = retrievalEngine;
    }

    /**
     * Retrieves the agent's memories for this turn and renders them.
     *
     * @param agentId     the agent
     * @param userMessage the current user message
     * @return the rendered section, or an empty string if the agent has no memories to inject
     */
    public String build(String agentId, String userMessage) {
        return render(retrievalEngine.retrieve(agentId, userMessage));
    }

    public String render(List<RetrievedMemory> memories) {
        if (memories.isEmpty()) {
            return "";
        }

        StringJoiner section = new StringJoiner("\n", "## Memories\n", "");
        for (RetrievedMemory memory : memories) {
            section.add("- %s: %s".formatted(memory.key(), memory.value()));
        }
        return section.toString();
    }
}
