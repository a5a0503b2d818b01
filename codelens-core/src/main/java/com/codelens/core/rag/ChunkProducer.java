package com.codelens.core.rag;

import com.codelens.core.model.FileAnalysis;

import java.util.List;

/**
 * Turns the analysis of one file into text chunks for embedding.
 */
public interface ChunkProducer {

    List<String> chunks(FileAnalysis analysis);
}
