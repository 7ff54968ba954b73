package com.flamingo.ai.retrieval.service.rag.embedding;

import com.flamingo.ai.retrieval.service.rag.model.EmbeddingResult;
import com.flamingo.ai.retrieval.service.rag.model.EmbeddingStats;
import java.util.List;

/**
 * Turns text into vectors. Implementations compose: the caching client wraps the provider client
 * behind the same interface.
 */
public interface EmbeddingClient {

  /**
   * Embeds one text.
   *
   * @param text the text
   * @return its embedding
   */
  EmbeddingResult embed(String text);

  /**
   * Embeds many texts. Either every text gets a real vector or the call fails; no placeholder
   * vectors are ever returned.
   *
   * @param texts texts to embed
   * @return one result per text, in input order
   */
  List<EmbeddingResult> embedBatch(List<String> texts);

  /** Model name the vectors come from. */
  String model();

  /** Length of the vectors this client returns. */
  int dimensions();

  /** Cumulative usage since startup. */
  EmbeddingStats stats();
}
