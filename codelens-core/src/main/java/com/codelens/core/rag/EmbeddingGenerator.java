package com.codelens.core.rag;

import java.util.List;

/**
 * Computes embedding vectors for text.
 */
public interface EmbeddingGenerator {

    /**
     * Embeds each text.
     *
     * @param texts texts to embed
     * @return one vector per text, in input order
     */
    List<float[]> embed(List<String> texts);
}
