package com.flamingo.ai.retrieval.service.rag.index;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("LexicalIndex Tests")
class LexicalIndexTest {

  private final SimpleLexicalTokenizer tokenizer = new SimpleLexicalTokenizer();

  private LexicalDocument doc(String id, String text, Map<String, Object> metadata) {
    return new LexicalDocument(id, "doc-" + id, text, metadata);
  }

  @Nested
  @DisplayName("BM25 scoring")
  class Scoring {

    @Test
    @DisplayName("Should rank documents containing rare query terms first")
    void shouldRankRareTermsFirst() {
      LexicalIndex index =
          LexicalIndex.build(
              1,
              List.of(
                  doc("a", "alpha beta gamma", Map.of()),
                  doc("b", "beta delta", Map.of()),
                  doc("c", "delta epsilon", Map.of())),
              tokenizer);

      List<LexicalHit> hits = index.search("alpha beta", 10, Map.of());

      assertThat(hits).extracting(hit -> hit.document().id()).containsExactly("a", "b");
      assertThat(hits.get(0).score()).isGreaterThan(hits.get(1).score());
    }

    @Test
    @DisplayName("Should only return chunks with a positive score")
    void shouldOnlyReturnMatches() {
      LexicalIndex index =
          LexicalIndex.build(
              1, List.of(doc("a", "alpha", Map.of()), doc("b", "beta", Map.of())), tokenizer);

      assertThat(index.search("zeta", 10, Map.of())).isEmpty();
      assertThat(index.search("", 10, Map.of())).isEmpty();
    }

    @Test
    @DisplayName("Should count repeated query terms once")
    void shouldDeduplicateQueryTerms() {
      LexicalIndex index =
          LexicalIndex.build(
              1, List.of(doc("a", "alpha beta", Map.of()), doc("b", "gamma", Map.of())), tokenizer);

      double once = index.search("alpha", 10, Map.of()).get(0).score();
      double twice = index.search("alpha alpha ALPHA", 10, Map.of()).get(0).score();

      assertThat(twice).isEqualTo(once);
    }

    @Test
    @DisplayName("Should break score ties by id")
    void shouldBreakTiesById() {
      LexicalIndex index =
          LexicalIndex.build(
              1,
              List.of(
                  doc("z", "same words", Map.of()),
                  doc("m", "same words", Map.of()),
                  doc("a", "other text", Map.of())),
              tokenizer);

      assertThat(index.search("same", 10, Map.of()))
          .extracting(hit -> hit.document().id())
          .containsExactly("m", "z");
    }

    @Test
    @DisplayName("Should limit results to k")
    void shouldLimitToK() {
      LexicalIndex index =
          LexicalIndex.build(
              1,
              List.of(
                  doc("a", "term one", Map.of()),
                  doc("b", "term two", Map.of()),
                  doc("c", "term three", Map.of()),
                  doc("d", "nothing", Map.of())),
              tokenizer);

      assertThat(index.search("term", 2, Map.of())).hasSize(2);
    }
  }

  @Test
  @DisplayName("Should restrict results by metadata filter")
  void shouldApplyFilter() {
    LexicalIndex index =
        LexicalIndex.build(
            1,
            List.of(
                doc("a", "shared term", Map.of("lang", "en")),
                doc("b", "shared term", Map.of("lang", "de")),
                doc("c", "unrelated", Map.of("lang", "en"))),
            tokenizer);

    List<LexicalHit> hits = index.search("shared", 10, Map.of("lang", "de"));

    assertThat(hits).extracting(hit -> hit.document().id()).containsExactly("b");
  }

  @Test
  @DisplayName("Should report size and version")
  void shouldReportSizeAndVersion() {
    LexicalIndex empty = LexicalIndex.empty(tokenizer);
    LexicalIndex built =
        LexicalIndex.build(7, List.of(doc("a", "one two two", Map.of())), tokenizer);

    assertThat(empty.isEmpty()).isTrue();
    assertThat(empty.search("anything", 5, Map.of())).isEmpty();
    assertThat(built.size()).isEqualTo(1);
    assertThat(built.version()).isEqualTo(7);
    assertThat(built.vocabularySize()).isEqualTo(2);
  }
}
