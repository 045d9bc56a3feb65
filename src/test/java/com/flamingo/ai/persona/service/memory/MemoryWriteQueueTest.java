package com.flamingo.ai.persona.service.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.persona.domain.model.PairKey;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MemoryWriteQueueTest {

  private static final PairKey PAIR = new PairKey("aino", "user-1");

  private ExecutorService executor;
  private MemoryWriteQueue queue;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(4);
    queue = new MemoryWriteQueue(executor);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  @DisplayName("writes of one pair should run in submission order")
  void shouldKeepOrderPerPair() {
    List<Integer> order = Collections.synchronizedList(new ArrayList<>());
    CompletableFuture<Void> last = null;

    for (int i = 0; i < 20; i++) {
      int index = i;
      last =
          queue.submit(
              PAIR,
              () -> {
                sleepQuietly(index % 3);
                order.add(index);
              });
    }
    last.join();

    assertThat(order).hasSize(20).isSorted();
  }

  @Test
  @DisplayName("a failed write should not block later writes of the pair")
  void failureShouldNotBlockLaterWrites() {
    CompletableFuture<Void> failing =
        queue.submit(
            PAIR,
            () -> {
              throw new IllegalStateException("boom");
            });
    List<String> done = new ArrayList<>();
    CompletableFuture<Void> next = queue.submit(PAIR, () -> done.add("next"));

    next.join();
    assertThat(done).containsExactly("next");
    assertThatThrownBy(failing::join).isInstanceOf(CompletionException.class);
  }

  @Test
  @DisplayName("different pairs should not wait for each other")
  void pairsShouldRunIndependently() throws InterruptedException {
    CountDownLatch release = new CountDownLatch(1);
    CompletableFuture<Void> blocked =
        queue.submit(
            PAIR,
            () -> {
              try {
                release.await(5, TimeUnit.SECONDS);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
            });

    CompletableFuture<Void> other = queue.submit(new PairKey("mase", "user-1"), () -> {});

    other.join();
    assertThat(blocked).isNotDone();
    release.countDown();
    blocked.join();
  }

  private static void sleepQuietly(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
