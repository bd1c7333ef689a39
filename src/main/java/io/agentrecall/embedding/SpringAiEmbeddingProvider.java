package io.agentrecall.embedding;

import io.agentrecall.memory.Embedding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Component;

/**
 * {@link EmbeddingProvider} backed by the Spring AI {@link EmbeddingModel} configured for the
 * application (OpenAI text-embedding-3-small by default).
 */
@Component
public class SpringAiEmbeddingProvider implements EmbeddingProvider {

    private static final Logger log = LoggerFactory.getLogger(SpringAiEmbeddingProvider.class);

    private final EmbeddingModel embeddingModel;

    public SpringAiEmbeddingProvider(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    @Override
    public Embedding embed(String text) {
        float[] vector = embeddingModel.embed(text == null ? "" : text);
        log.debug("Embedded {} chars into {} dimensions", text == null ? 0 : text.length(),
                vector == null ? 0 : vector.length);
        return new Embedding(vector);
    }
}
