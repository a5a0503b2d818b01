package com.codelens.core.rag;

import java.util.List;

/**
 * Stores chunk vectors and answers nearest-neighbour lookups.
 */
public interface VectorStore {

    /**
     * Adds chunks with their vectors; both lists have the same size.
     */
    void add(List<String> chunks, List<float[]> vectors);

    /**
     * Returns up to {@code limit} chunks closest to {@code query}, nearest first.
     */
    List<String> nearest(float[] query, int limit);
}
