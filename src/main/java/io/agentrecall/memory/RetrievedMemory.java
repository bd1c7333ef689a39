package io.agentrecall.memory;

/**
 * A memory selected for prompt injection.
 *
 * @param key      memory key
 * @param value    memory content
 * @param category memory category
 */
public record RetrievedMemory(String key, String value, MemoryCategory category) {
}
