package com.flamingo.ai.persona.service.memory;

import com.flamingo.ai.persona.domain.model.PairKey;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs memory writes off the response path while keeping them in submission order per pair.
 *
 * <p>Each pair has a tail future; a new write is chained after it. Writes for different pairs run
 * in parallel on the shared executor.
 */
@Slf4j
@Component
public class MemoryWriteQueue {

  private final Executor executor;
  private final ConcurrentMap<PairKey, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

  public MemoryWriteQueue(@Qualifier("memoryWriteExecutor") Executor executor) {
    this.executor = executor;
  }

  /**
   * Queues a write for the pair.
   *
   * @return a future completed once this write (and every earlier write of the pair) has run
   */
  public CompletableFuture<Void> submit(PairKey pair, Runnable write) {
    CompletableFuture<Void> next =
        tails.compute(
            pair,
            (key, tail) -> {
              CompletableFuture<Void> previous =
                  tail == null ? CompletableFuture.completedFuture(null) : tail;
              return previous
                  .exceptionally(error -> null)
                  .thenRunAsync(write, executor)
                  .whenComplete(
                      (ignored, error) -> {
                        if (error != null) {
                          log.warn("Memory write for {} failed: {}", key, error.getMessage());
                        }
                      });
            });
    next.whenComplete((ignored, error) -> tails.remove(pair, next));
    return next;
  }

  /** Number of pairs with a write in flight. */
  int pendingPairs() {
    return tails.size();
  }
}
