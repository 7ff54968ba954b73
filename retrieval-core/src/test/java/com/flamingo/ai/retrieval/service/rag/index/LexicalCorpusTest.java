package com.flamingo.ai.retrieval.service.rag.index;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("LexicalCorpus Tests")
class LexicalCorpusTest {

  private final LexicalCorpus corpus = new LexicalCorpus("test", new SimpleLexicalTokenizer());

  private static LexicalDocument chunk(String id, String documentId, String text) {
    return new LexicalDocument(id, documentId, text, Map.of());
  }

  @Test
  @DisplayName("Should publish a new snapshot on every write")
  void shouldPublishNewSnapshot() {
    LexicalIndex before = corpus.snapshot();

    corpus.upsert(List.of(chunk("c1", "d1", "alpha beta")));
    LexicalIndex after = corpus.snapshot();

    assertThat(after).isNotSameAs(before);
    assertThat(after.version()).isGreaterThan(before.version());
    assertThat(before.isEmpty()).isTrue();
    assertThat(after.search("alpha", 5, Map.of())).hasSize(1);
  }

  @Test
  @DisplayName("Should replace every chunk of a document at once")
  void shouldReplaceDocument() {
    corpus.upsert(List.of(chunk("c1", "d1", "old text"), chunk("c2", "d1", "old more")));
    corpus.upsert(List.of(chunk("c3", "d2", "other document")));

    corpus.replaceDocument("d1", List.of(chunk("c4", "d1", "new text")));

    assertThat(corpus.idsForDocument("d1")).containsExactly("c4");
    assertThat(corpus.idsForDocument("d2")).containsExactly("c3");
    assertThat(corpus.snapshot().search("old", 5, Map.of())).isEmpty();
    assertThat(corpus.size()).isEqualTo(2);
  }

  @Test
  @DisplayName("Should remove chunks by id")
  void shouldRemoveChunks() {
    corpus.upsert(List.of(chunk("c1", "d1", "alpha"), chunk("c2", "d1", "beta")));
    long version = corpus.snapshot().version();

    corpus.remove(List.of("c1", "missing"));
    corpus.remove(List.of("missing"));

    assertThat(corpus.idsForDocument("d1")).containsExactly("c2");
    assertThat(corpus.snapshot().version()).isEqualTo(version + 1);
  }

  @Test
  @DisplayName("Should let readers search while writers publish")
  void shouldServeReadersDuringWrites() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(4);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<?>> futures = new ArrayList<>();
      futures.add(
          pool.submit(
              () -> {
                start.await();
                for (int i = 0; i < 200; i++) {
                  corpus.upsert(List.of(chunk("c" + i, "d" + (i % 10), "common term " + i)));
                }
                return null;
              }));
      for (int r = 0; r < 3; r++) {
        futures.add(
            pool.submit(
                () -> {
                  start.await();
                  for (int i = 0; i < 200; i++) {
                    LexicalIndex snapshot = corpus.snapshot();
                    List<LexicalHit> hits = snapshot.search("common", 1_000, Map.of());
                    assertThat(hits).hasSize(snapshot.size());
                  }
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertThat(corpus.size()).isEqualTo(200);
  }
}
