package com.codelens.core.rag;

import com.codelens.core.model.FileAnalysis;
import com.codelens.core.model.ProjectAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Retrieval-augmented question answering over an analyzed project.
 *
 * <p>{@link #index(ProjectAnalysis)} chunks every file, embeds the chunks and stores them.
 * {@link #ask(String, int)} embeds the question, retrieves the nearest chunks and hands them
 * to the {@link AnswerGenerator} as context.
 */
public class RetrievalPipeline {

    private static final Logger log = LoggerFactory.getLogger(RetrievalPipeline.class);

    static final String NO_RELEVANT_CODE = "No relevant code found in the indexed codebase. "
        + "Make sure to index your code first: codelens index <project-root>";

    private final ChunkProducer chunkProducer;
    private final EmbeddingGenerator embeddings;
    private final VectorStore store;
    private final AnswerGenerator answers;

    public RetrievalPipeline(ChunkProducer chunkProducer, EmbeddingGenerator embeddings,
                             VectorStore store, AnswerGenerator answers) {
        this.chunkProducer = chunkProducer;
        this.embeddings = embeddings;
        this.store = store;
        this.answers = answers;
    }

    /**
     * Chunks, embeds and stores every file of the project.
     *
     * @param project analyzed project
     * @return number of chunks stored
     */
    public int index(ProjectAnalysis project) {
        List<String> chunks = new ArrayList<>();
        for (FileAnalysis file : project.fileAnalyses()) {
            chunks.addAll(chunkProducer.chunks(file));
        }
        if (chunks.isEmpty()) {
            log.warn("No chunks produced for {}", project.projectName());
            return 0;
        }
        List<float[]> vectors = embeddings.embed(chunks);
        if (vectors.size() != chunks.size()) {
            throw new IllegalStateException(
                "Embedding generator returned " + vectors.size() + " vectors for " + chunks.size() + " chunks");
        }
        store.add(chunks, vectors);
        log.info("Indexed {} chunks for {}", chunks.size(), project.projectName());
        return chunks.size();
    }

    /**
     * Answers a question from the stored chunks.
     *
     * @param question natural-language question
     * @param limit number of chunks to retrieve
     * @return generated answer, or a fixed message when nothing was retrieved
     */
    public String ask(String question, int limit) {
        log.info("Retrieval query: {}", question);
        float[] queryVector = embeddings.embed(List.of(question)).get(0);
        List<String> retrieved = store.nearest(queryVector, limit);
        if (retrieved.isEmpty()) {
            log.warn("No code chunks retrieved for query");
            return NO_RELEVANT_CODE;
        }
        String context = String.join("\n", retrieved);
        log.debug("Context size: {} characters", context.length());
        return answers.answer(question, context);
    }
}
