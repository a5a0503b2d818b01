package com.codelens.core.rag;

/**
 * Produces a natural-language answer from a question and retrieved code context.
 */
public interface AnswerGenerator {

    String answer(String question, String context);
}
