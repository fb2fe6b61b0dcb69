package com.ai.codeindex.service;

import java.util.List;

/**
 * Turns texts into vectors. One vector per input, in input order.
 */
public interface EmbeddingProvider {

    String modelId();

    int maxBatchSize();

    /**
     * @throws com.ai.codeindex.exception.EmbeddingProviderException     on endpoint failure
     * @throws com.ai.codeindex.exception.CredentialUnavailableException when no usable credential exists
     */
    List<float[]> embed(List<String> texts);
}
