package com.flamingo.ai.retrieval.service.rag.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.retrieval.exception.DimensionMismatchException;
import com.flamingo.ai.retrieval.service.rag.chunking.ChunkingEngine;
import com.flamingo.ai.retrieval.service.rag.model.CollectionConfig;
import com.flamingo.ai.retrieval.service.rag.model.DistanceMetric;
import com.flamingo.ai.retrieval.service.rag.model.IndexedVector;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryVectorIndex Tests")
class InMemoryVectorIndexTest {

  private InMemoryVectorIndex index;

  @BeforeEach
  void setUp() {
    index = new InMemoryVectorIndex();
    index.createCollection(new CollectionConfig("docs", 3, DistanceMetric.COSINE), false);
    index.upsert(
        "docs",
        List.of(
            new IndexedVector("p1", new float[] {1f, 0f, 0f}, "x axis", Map.of("lang", "en")),
            new IndexedVector("p2", new float[] {0.9f, 0.1f, 0f}, "near x", Map.of("lang", "de")),
            new IndexedVector("p3", new float[] {0f, 1f, 0f}, "y axis", Map.of("lang", "en"))));
  }

  @Nested
  @DisplayName("Search")
  class Search {

    @Test
    @DisplayName("Should find a stored vector with similarity close to one")
    void shouldFindSelfWithSimilarityOne() {
      List<IndexedVector> hits = index.search("docs", new float[] {1f, 0f, 0f}, 1, Map.of(), null);

      assertThat(hits).hasSize(1);
      assertThat(hits.get(0).id()).isEqualTo("p1");
      assertThat(hits.get(0).score()).isCloseTo(1.0, within(1e-6));
    }

    @Test
    @DisplayName("Should order by similarity descending")
    void shouldOrderBySimilarity() {
      List<IndexedVector> hits = index.search("docs", new float[] {1f, 0f, 0f}, 10, null, null);

      assertThat(hits).extracting(IndexedVector::id).containsExactly("p1", "p2", "p3");
    }

    @Test
    @DisplayName("Should apply the metadata filter")
    void shouldApplyFilter() {
      List<IndexedVector> hits =
          index.search("docs", new float[] {1f, 0f, 0f}, 10, Map.of("lang", "en"), null);

      assertThat(hits).extracting(IndexedVector::id).containsExactly("p1", "p3");
    }

    @Test
    @DisplayName("Should drop results below the score threshold")
    void shouldApplyThreshold() {
      List<IndexedVector> hits = index.search("docs", new float[] {1f, 0f, 0f}, 10, null, 0.5);

      assertThat(hits).extracting(IndexedVector::id).containsExactly("p1", "p2");
    }

    @Test
    @DisplayName("Should score euclidean collections as 1 / (1 + distance)")
    void shouldScoreEuclidean() {
      index.createCollection(new CollectionConfig("euc", 2, DistanceMetric.EUCLIDEAN), false);
      index.upsert(
          "euc", List.of(new IndexedVector("e1", new float[] {3f, 4f}, "point", Map.of())));

      List<IndexedVector> hits = index.search("euc", new float[] {0f, 0f}, 1, null, null);

      assertThat(hits.get(0).score()).isCloseTo(1.0 / 6.0, within(1e-9));
    }
  }

  @Nested
  @DisplayName("Dimensions")
  class Dimensions {

    @Test
    @DisplayName("Should reject points of the wrong dimension without writing any")
    void shouldRejectWrongDimensionOnUpsert() {
      assertThatThrownBy(
              () ->
                  index.upsert(
                      "docs",
                      List.of(
                          new IndexedVector("ok", new float[] {0f, 0f, 1f}, "ok", Map.of()),
                          new IndexedVector("bad", new float[] {1f, 1f}, "bad", Map.of()))))
          .isInstanceOf(DimensionMismatchException.class)
          .satisfies(
              e -> {
                DimensionMismatchException mismatch = (DimensionMismatchException) e;
                assertThat(mismatch.getExpected()).isEqualTo(3);
                assertThat(mismatch.getActual()).isEqualTo(2);
              });
      assertThat(index.collectionStats("docs").pointCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should reject a query of the wrong dimension")
    void shouldRejectWrongDimensionOnSearch() {
      assertThatThrownBy(() -> index.search("docs", new float[] {1f}, 5, null, null))
          .isInstanceOf(DimensionMismatchException.class);
    }

    @Test
    @DisplayName("Should refuse to reopen a collection with another dimension")
    void shouldRejectDimensionChange() {
      assertThatThrownBy(
              () ->
                  index.createCollection(
                      new CollectionConfig("docs", 4, DistanceMetric.COSINE), false))
          .isInstanceOf(DimensionMismatchException.class);
    }
  }

  @Nested
  @DisplayName("Documents")
  class Documents {

    @BeforeEach
    void setUp() {
      Map<String, Object> metadata = Map.of(ChunkingEngine.DOCUMENT_ID, "d1");
      index.upsert(
          "docs",
          List.of(
              new IndexedVector("d1-0", new float[] {0f, 0f, 1f}, "head", metadata),
              new IndexedVector("d1-1", new float[] {0f, 1f, 1f}, "tail", metadata)));
    }

    @Test
    @DisplayName("Should list a document's points with their vectors")
    void shouldListDocumentPoints() {
      List<IndexedVector> points = index.listDocument("docs", "d1");

      assertThat(points).extracting(IndexedVector::id).containsExactly("d1-0", "d1-1");
      assertThat(points.get(1).vector()).containsExactly(0f, 1f, 1f);
      assertThat(index.listDocument("docs", "unknown")).isEmpty();
      assertThat(index.listDocument("missing", "d1")).isEmpty();
    }

    @Test
    @DisplayName("Should delete every point of a document by its id")
    void shouldDeleteDocumentPoints() {
      assertThat(index.deleteDocument("docs", "d1")).isEqualTo(2);

      assertThat(index.collectionStats("docs").pointCount()).isEqualTo(3);
      assertThat(index.deleteDocument("docs", "d1")).isZero();
    }

    @Test
    @DisplayName("Should visit every stored point")
    void shouldScanAllPoints() {
      List<String> seen = new ArrayList<>();

      index.scan("docs", batch -> batch.forEach(point -> seen.add(point.id())));

      assertThat(seen).containsExactly("d1-0", "d1-1", "p1", "p2", "p3");
    }
  }

  @Test
  @DisplayName("Should delete points and empty the collection on recreate")
  void shouldDeleteAndRecreate() {
    index.delete("docs", List.of("p1", "unknown"));
    assertThat(index.collectionStats("docs").pointCount()).isEqualTo(2);

    index.createCollection(new CollectionConfig("docs", 3, DistanceMetric.COSINE), true);
    assertThat(index.collectionStats("docs").pointCount()).isZero();
    assertThat(index.healthCheck()).isTrue();
  }

  @Test
  @DisplayName("Should fail for an unknown collection")
  void shouldFailForUnknownCollection() {
    assertThatThrownBy(() -> index.search("missing", new float[] {1f, 0f, 0f}, 1, null, null))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Collection not found");
  }
}
