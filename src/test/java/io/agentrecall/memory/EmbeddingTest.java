package io.agentrecall.memory;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EmbeddingTest {

    @Test
    void shouldComputeCosineSimilarity() {
        assertEquals(1.0, Embedding.of(1f, 0f).cosineSimilarity(Embedding.of(3f, 0f)), 1e-9);
        assertEquals(0.0, Embedding.of(1f, 0f).cosineSimilarity(Embedding.of(0f, 2f)), 1e-9);
        assertEquals(-1.0, Embedding.of(1f, 1f).cosineSimilarity(Embedding.of(-1f, -1f)), 1e-9);
    }

    @Test
    void shouldReturnZeroSimilarityForZeroVector() {
        assertEquals(0.0, Embedding.of(0f, 0f).cosineSimilarity(Embedding.of(1f, 1f)));
    }

    @Test
    void shouldRejectMismatchedDimensions() {
        assertThrows(IllegalArgumentException.class,
                () -> Embedding.of(1f, 0f).cosineSimilarity(Embedding.of(1f, 0f, 0f)));
    }

    @Test
    void shouldOnlyCompareUsableVectorsOfSameDimension() {
        Embedding query = Embedding.of(1f, 0f);

        assertTrue(query.isComparableTo(Embedding.of(0.2f, 0.7f)));
        assertFalse(query.isComparableTo(Embedding.of(1f, 0f, 0f)));
        assertFalse(query.isComparableTo(Embedding.of()));
        assertFalse(query.isComparableTo(Embedding.of(0f, 0f)));
        assertFalse(query.isComparableTo(Embedding.of(Float.NaN, 1f)));
        assertFalse(query.isComparableTo(null));
    }

    @Test
    void shouldRejectEmptyZeroAndNonFiniteVectorsAsUnusable() {
        assertTrue(Embedding.of(0.1f, 0f).isUsable());
        assertFalse(Embedding.of().isUsable());
        assertFalse(Embedding.of(0f, 0f).isUsable());
        assertFalse(Embedding.of(Float.NaN, 1f).isUsable());
        assertFalse(Embedding.of(Float.POSITIVE_INFINITY, 1f).isUsable());
    }

    @Test
    void shouldCopyVectorOnConstructionAndAccess() {
        float[] raw = {1f, 2f};
        Embedding embedding = new Embedding(raw);
        raw[0] = 9f;
        embedding.vector()[1] = 9f;

        assertArrayEquals(new float[]{1f, 2f}, embedding.vector());
    }

    @Test
    void shouldCompareByValue() {
        assertEquals(Embedding.of(1f, 2f), Embedding.of(1f, 2f));
        assertEquals(Embedding.of(1f, 2f).hashCode(), Embedding.of(1f, 2f).hashCode());
        assertNotEquals(Embedding.of(1f, 2f), Embedding.of(2f, 1f));
    }
}
