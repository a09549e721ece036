package com.github.spud.worksession.domain.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ActivityAccumulatorTest {

  private ActivityAccumulator accumulator;
  private UUID sessionId;

  @BeforeEach
  void setUp() {
    accumulator = new ActivityAccumulator();
    sessionId = UUID.randomUUID();
    accumulator.track(sessionId);
  }

  @Test
  @DisplayName("untracked session is neither counted nor created")
  void untrackedIsIgnored() {
    UUID other = UUID.randomUUID();

    assertThat(accumulator.recordTokenUsage(other, 1, 1)).isFalse();
    assertThat(accumulator.recordTaskCreated(other)).isFalse();
    assertThat(accumulator.isTracking(other)).isFalse();
    assertThat(accumulator.snapshot(other)).isEqualTo(SessionCounts.EMPTY);
  }

  @Test
  @DisplayName("tracking twice keeps the existing counters")
  void trackIsIdempotent() {
    accumulator.recordContextCreated(sessionId);

    accumulator.track(sessionId);

    assertThat(accumulator.snapshot(sessionId).activity().contextsCreated()).isEqualTo(1);
  }

  @Test
  @DisplayName("task updates count completions separately")
  void taskUpdates() {
    accumulator.recordTaskCreated(sessionId);
    accumulator.recordTaskUpdated(sessionId, false);
    accumulator.recordTaskUpdated(sessionId, true);

    assertThat(accumulator.snapshot(sessionId).activity())
      .isEqualTo(new ActivityCounts(1, 2, 1, 0));
  }

  @Test
  @DisplayName("negative token counts are rejected without changing totals")
  void negativeTokens() {
    accumulator.recordTokenUsage(sessionId, 5, 5);

    assertThatThrownBy(() -> accumulator.recordTokenUsage(sessionId, 1, -1))
      .isInstanceOf(IllegalArgumentException.class);
    assertThat(accumulator.snapshot(sessionId).tokens().total()).isEqualTo(10);
  }

  @Test
  @DisplayName("concurrent recording loses no updates")
  void concurrentRecording() throws Exception {
    int threads = 8;
    int perThread = 1_000;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch go = new CountDownLatch(1);
    try {
      for (int t = 0; t < threads; t++) {
        pool.submit(() -> {
          go.await();
          for (int i = 0; i < perThread; i++) {
            accumulator.recordTokenUsage(sessionId, 2, 1);
            accumulator.recordContextCreated(sessionId);
          }
          return null;
        });
      }
      go.countDown();
      pool.shutdown();
      assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
    } finally {
      pool.shutdownNow();
    }

    SessionCounts counts = accumulator.snapshot(sessionId);
    long calls = (long) threads * perThread;
    assertThat(counts.tokens()).isEqualTo(new TokenCounts(2 * calls, calls, 3 * calls));
    assertThat(counts.activity().contextsCreated()).isEqualTo(calls);
  }

  @Test
  @DisplayName("cleared session rejects late events")
  void clearedRejectsLateEvents() {
    accumulator.recordTokenUsage(sessionId, 1, 1);

    accumulator.clear(sessionId);

    assertThat(accumulator.recordTokenUsage(sessionId, 1, 1)).isFalse();
    assertThat(accumulator.snapshot(sessionId)).isEqualTo(SessionCounts.EMPTY);
  }
}
