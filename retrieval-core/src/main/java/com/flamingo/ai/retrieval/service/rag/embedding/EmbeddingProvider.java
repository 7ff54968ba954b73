package com.flamingo.ai.retrieval.service.rag.embedding;

import java.util.List;

/** External embedding model: turns a batch of texts into vectors and reports token usage. */
public interface EmbeddingProvider {

  /**
   * Embeds a batch of texts in one provider call.
   *
   * @param model model name, used for accounting and logging
   * @param texts non-empty batch
   * @return one vector per text, in input order, and the tokens the call consumed
   * @throws com.flamingo.ai.retrieval.exception.ProviderUnavailableException if the provider fails
   *     or returns fewer vectors than texts
   */
  ProviderBatch embed(String model, List<String> texts);

  /**
   * Vectors of one provider call.
   *
   * @param vectors one vector per input text
   * @param tokenUsage tokens billed for the call
   */
  record ProviderBatch(List<float[]> vectors, long tokenUsage) {}
}
