package com.nevis.dossier.inference;

/**
 * Single-shot language-model call. Implementations throw
 * {@link com.nevis.dossier.exception.InferenceException} on any transport or model failure.
 */
public interface InferenceClient {

    String infer(InferenceContent content, String instructions, int maxTokens, boolean extendedReasoning);
}
