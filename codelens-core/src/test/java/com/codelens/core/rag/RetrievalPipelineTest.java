package com.codelens.core.rag;

import com.codelens.core.model.FileAnalysis;
import com.codelens.core.model.ProjectAnalysis;
import com.codelens.core.parser.PythonSourceParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RetrievalPipeline} with in-memory collaborators.
 */
class RetrievalPipelineTest {

    private InMemoryVectorStore store;
    private RecordingAnswerGenerator answers;
    private RetrievalPipeline pipeline;

    @BeforeEach
    void setUp() {
        store = new InMemoryVectorStore();
        answers = new RecordingAnswerGenerator();
        pipeline = new RetrievalPipeline(new DefaultChunkProducer(), new KeywordEmbeddings(), store, answers);
    }

    @Test
    void index_project_storesOneVectorPerChunk() {
        int count = pipeline.index(project());

        assertThat(count).isEqualTo(3);
        assertThat(store.chunks).hasSize(3);
    }

    @Test
    void ask_indexedProject_passesNearestChunksAsContext() {
        pipeline.index(project());

        String answer = pipeline.ask("where is the ledger posted?", 1);

        assertThat(answer).isEqualTo("answer");
        assertThat(answers.question).isEqualTo("where is the ledger posted?");
        assertThat(answers.context).isEqualTo("Function: post_ledger at line 1. Calls: write");
    }

    @Test
    void ask_emptyStore_returnsIndexingHint() {
        String answer = pipeline.ask("anything?", 3);

        assertThat(answer).isEqualTo(RetrievalPipeline.NO_RELEVANT_CODE);
        assertThat(answers.question).isNull();
    }

    @Test
    void index_mismatchedVectors_throws() {
        RetrievalPipeline broken = new RetrievalPipeline(new DefaultChunkProducer(), texts -> List.of(), store, answers);

        assertThatThrownBy(() -> broken.index(project()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("0 vectors for 3 chunks");
    }

    private static ProjectAnalysis project() {
        PythonSourceParser parser = new PythonSourceParser();
        FileAnalysis ledger = parser.parseSource("""
            def post_ledger(entry):
                write(entry)
            """, "ledger.py");
        FileAnalysis tax = parser.parseSource("""
            def compute_tax(amount):
                return amount

            def round_amount(amount):
                return amount
            """, "tax.py");
        return new ProjectAnalysis("books", List.of(ledger, tax), List.of(), List.of());
    }

    /**
     * Embeds text as counts of a few fixed words.
     */
    private static final class KeywordEmbeddings implements EmbeddingGenerator {
        private static final List<String> WORDS = List.of("ledger", "tax", "amount");

        @Override
        public List<float[]> embed(List<String> texts) {
            List<float[]> vectors = new ArrayList<>();
            for (String text : texts) {
                String lower = text.toLowerCase(Locale.ROOT);
                float[] vector = new float[WORDS.size()];
                for (int i = 0; i < WORDS.size(); i++) {
                    vector[i] = lower.contains(WORDS.get(i)) ? 1f : 0f;
                }
                vectors.add(vector);
            }
            return vectors;
        }
    }

    private static final class InMemoryVectorStore implements VectorStore {
        private final List<String> chunks = new ArrayList<>();
        private final List<float[]> vectors = new ArrayList<>();

        @Override
        public void add(List<String> newChunks, List<float[]> newVectors) {
            chunks.addAll(newChunks);
            vectors.addAll(newVectors);
        }

        @Override
        public List<String> nearest(float[] query, int limit) {
            List<Integer> order = new ArrayList<>();
            for (int i = 0; i < chunks.size(); i++) {
                order.add(i);
            }
            order.sort(Comparator.comparingDouble((Integer i) -> -dot(vectors.get(i), query)));
            return order.stream().limit(limit).map(chunks::get).toList();
        }

        private static double dot(float[] a, float[] b) {
            double sum = 0;
            for (int i = 0; i < a.length; i++) {
                sum += a[i] * b[i];
            }
            return sum;
        }
    }

    private static final class RecordingAnswerGenerator implements AnswerGenerator {
        private String question;
        private String context;

        @Override
        public String answer(String question, String context) {
            this.question = question;
            this.context = context;
            return "answer";
        }
    }
}
