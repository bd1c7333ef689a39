package io.agentrecall.core;

import io.agentrecall.memory.MemoryCategory;
import io.agentrecall.memory.RetrievedMemory;
import io.agentrecall.memory.retrieval.DependencyUnavailableException;
import io.agentrecall.memory.retrieval.MemoryRetrievalEngine;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MemoryContextBuilderTest {

    private final MemoryRetrievalEngine engine = mock(MemoryRetrievalEngine.class);
    private final MemoryContextBuilder builder = new MemoryContextBuilder(engine);

    @Test
    void shouldRenderMemoriesSection() {
        when(engine.retrieve("agent-1", "hi")).thenReturn(List.of(
                new RetrievedMemory("preferred_language", "French", MemoryCategory.PREFERENCE),
                new RetrievedMemory("target_companies", "Acme, Globex", MemoryCategory.CONTEXT)));

        String section = builder.build("agent-1", "hi");

        assertEquals("""
                ## Memories
                - preferred_language: French
                - target_companies: Acme, Globex""", section);
    }

    @Test
    void shouldRenderNothingWithoutMemories() {
        when(engine.retrieve("agent-1", "hi")).thenReturn(List.of());

        assertEquals("", builder.build("agent-1", "hi"));
    }

    @Test
    void shouldKeepValuesVerbatim() {
        String value = "line one\nline two with \"quotes\"";

        String section = builder.render(List.of(new RetrievedMemory("note", value, MemoryCategory.GENERAL)));

        assertTrue(section.endsWith("- note: " + value));
    }

    @Test
    void shouldPropagateRetrievalFailures() {
        when(engine.retrieve("agent-1", "hi")).thenThrow(
                new DependencyUnavailableException(DependencyUnavailableException.Dependency.STORE, "down"));

        assertThrows(DependencyUnavailableException.class, () -> builder.build("agent-1", "hi"));
    }
}
