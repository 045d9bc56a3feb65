package com.flamingo.ai.persona.service.lock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.persona.domain.model.PairKey;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PairLockRegistryTest {

  private static final PairKey PAIR = new PairKey("aino", "user-1");
  private static final PairKey OTHER_PAIR = new PairKey("mase", "user-1");

  private ExecutorService executor;
  private PairLockRegistry registry;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(3);
    registry = new PairLockRegistry();
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  /** Holds the pair lock on another thread until {@code release} opens. */
  private CompletableFuture<Void> holdLock(
      PairKey pair, CountDownLatch holding, CountDownLatch release) {
    return CompletableFuture.runAsync(
        () ->
            registry.runWithLock(
                pair,
                () -> {
                  holding.countDown();
                  await(release);
                }),
        executor);
  }

  private CompletableFuture<Void> enter(PairKey pair, CountDownLatch entered) {
    return CompletableFuture.runAsync(
        () -> registry.runWithLock(pair, entered::countDown), executor);
  }

  @Nested
  @DisplayName("mutual exclusion")
  class MutualExclusion {

    @Test
    @DisplayName("a second action on the same pair should wait for the first to release")
    void samePairShouldBlock() throws InterruptedException {
      CountDownLatch holding = new CountDownLatch(1);
      CountDownLatch release = new CountDownLatch(1);
      CountDownLatch entered = new CountDownLatch(1);

      CompletableFuture<Void> first = holdLock(PAIR, holding, release);
      assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();
      CompletableFuture<Void> second = enter(PAIR, entered);

      assertThat(entered.await(200, TimeUnit.MILLISECONDS)).isFalse();
      release.countDown();
      assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
      first.join();
      second.join();
    }

    @Test
    @DisplayName("an action on a different pair should proceed while the first is held")
    void differentPairShouldProceed() throws InterruptedException {
      CountDownLatch holding = new CountDownLatch(1);
      CountDownLatch release = new CountDownLatch(1);
      CountDownLatch entered = new CountDownLatch(1);

      CompletableFuture<Void> first = holdLock(PAIR, holding, release);
      assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();
      CompletableFuture<Void> other = enter(OTHER_PAIR, entered);

      assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
      other.join();
      assertThat(first).isNotDone();
      release.countDown();
      first.join();
    }

    @Test
    @DisplayName("the holding thread should be able to re-enter its own pair")
    void shouldBeReentrant() {
      String result = registry.withLock(PAIR, () -> registry.withLock(PAIR, () -> "inner"));

      assertThat(result).isEqualTo("inner");
    }
  }

  @Nested
  @DisplayName("lock lifecycle")
  class Lifecycle {

    @Test
    @DisplayName("should keep an entry only while the pair is held or awaited")
    void shouldDropIdleEntries() throws InterruptedException {
      CountDownLatch holding = new CountDownLatch(1);
      CountDownLatch release = new CountDownLatch(1);

      CompletableFuture<Void> first = holdLock(PAIR, holding, release);
      assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();
      assertThat(registry.activeLocks()).isEqualTo(1);

      release.countDown();
      first.join();
      for (int i = 0; i < 100; i++) {
        registry.runWithLock(new PairKey("aino", "user-" + i), () -> {});
      }

      assertThat(registry.activeLocks()).isZero();
    }

    @Test
    @DisplayName("a failing action should still release the pair")
    void failureShouldRelease() throws InterruptedException {
      assertThatThrownBy(
              () ->
                  registry.runWithLock(
                      PAIR,
                      () -> {
                        throw new IllegalStateException("boom");
                      }))
          .isInstanceOf(IllegalStateException.class);

      CountDownLatch entered = new CountDownLatch(1);
      CompletableFuture<Void> next = enter(PAIR, entered);

      assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
      next.join();
      assertThat(registry.activeLocks()).isZero();
    }
  }

  private static void await(CountDownLatch latch) {
    try {
      latch.await(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
