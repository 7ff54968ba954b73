package com.flamingo.ai.retrieval.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the retrieval core. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Chunking chunking = new Chunking();
  private Embedding embedding = new Embedding();
  private Index index = new Index();
  private Retrieval retrieval = new Retrieval();
  private Reranking reranking = new Reranking();
  private Ingest ingest = new Ingest();

  @Getter
  @Setter
  public static class Chunking {
    /** Target chunk size in tokens. */
    private int size = 1000;

    /** Tokens shared between consecutive chunks. */
    private int overlap = 200;

    /** Chunks below this token count are merged into their successor. 0 disables merging. */
    private int minChunkTokens = 100;

    /** Default strategy: recursive, sliding_window, paragraph or sentence. */
    private String strategy = "recursive";

    /** Characters per token for the approximate counter and the BPE fallback. */
    private int charsPerToken = 4;

    /** Token counter: "jtokkit" (cl100k_base) or "ratio". */
    private String tokenizer = "jtokkit";

    /** Maximum conversation messages grouped into one chunk. */
    private int conversationMessagesPerChunk = 10;
  }

  @Getter
  @Setter
  public static class Embedding {
    private String model = "text-embedding-3-large";
    private int batchSize = 100;
    private Duration cacheTtl = Duration.ofDays(30);
    private long cacheMaxEntries = 100_000;
    private Map<String, Integer> dimensions = defaultDimensions();
    private Map<String, Double> pricePerMillionTokens = defaultPricing();

    /**
     * Returns the vector dimension of the configured model.
     *
     * @return dimension, or 1536 when the model is not in the table
     */
    public int dimensionsForModel() {
      return dimensions.getOrDefault(model, 1536);
    }

    private static Map<String, Integer> defaultDimensions() {
      Map<String, Integer> dims = new LinkedHashMap<>();
      dims.put("text-embedding-3-large", 3072);
      dims.put("text-embedding-3-small", 1536);
      return dims;
    }

    private static Map<String, Double> defaultPricing() {
      Map<String, Double> prices = new LinkedHashMap<>();
      prices.put("text-embedding-3-large", 0.13);
      prices.put("text-embedding-3-small", 0.02);
      return prices;
    }
  }

  @Getter
  @Setter
  public static class Index {
    /** Vector index backend: "memory" (default) or "elasticsearch". */
    private String backend = "memory";

    private String collection = "lumenai_knowledge";

    /** cosine, dot or euclidean. */
    private String distanceMetric = "cosine";

    private int upsertBatchSize = 100;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int topK = 10;
    private int candidatesMultiplier = 2;

    /** Weight of the lexical side in hybrid fusion; the vector side gets 1 - alpha. */
    private double alpha = 0.5;

    private int maxRerankCandidates = 50;
    private Duration lexicalTimeout = Duration.ofSeconds(2);
    private Duration vectorTimeout = Duration.ofSeconds(5);
    private Duration embeddingTimeout = Duration.ofSeconds(10);
    private Duration rerankTimeout = Duration.ofSeconds(5);
  }

  @Getter
  @Setter
  public static class Reranking {
    private boolean enabled = true;
    private Tei tei = new Tei();

    /** Configuration for TEI (Text Embeddings Inference) cross-encoder reranker. */
    @Getter
    @Setter
    public static class Tei {
      private String baseUrl = "http://localhost:8090";
      private String modelId = "BAAI/bge-reranker-v2-m3";
      private boolean truncate = true;
      private boolean rawScores = false;
      private int readTimeoutMs = 10000;
    }
  }

  @Getter
  @Setter
  public static class Ingest {
    /** Documents processed per partition in batch ingest. */
    private int batchSize = 16;

    private int maxConcurrentDocuments = 4;
  }
}
