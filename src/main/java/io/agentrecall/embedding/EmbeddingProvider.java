package io.agentrecall.embedding;

import io.agentrecall.memory.Embedding;

/**
 * Maps text to an embedding of a fixed dimension shared with the stored memory embeddings.
 */
@FunctionalInterface
public interface EmbeddingProvider {

    /**
     * Embeds a piece of text. Empty text is passed through; how it is embedded is up to the provider.
     *
     * @param text the text to embed
     * @return the embedding
     * @throws RuntimeException if the provider cannot be reached or rejects the request
     */
    Embedding embed(String text);
}
