package com.flamingo.ai.persona.service.lock;

import com.flamingo.ai.persona.domain.model.PairKey;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * One reentrant lock per character/user pair.
 *
 * <p>Turns of the same pair run one at a time; different pairs never block each other. The lock
 * is reentrant so a turn can call the adapter and the memory store, which take the same lock.
 *
 * <p>An entry lives only while some thread holds or waits for it. Every acquisition is counted
 * under {@link ConcurrentMap#compute} and the entry is dropped when the count returns to zero.
 */
@Component
public class PairLockRegistry {

  private final ConcurrentMap<PairKey, CountedLock> locks = new ConcurrentHashMap<>();

  public <T> T withLock(PairKey pair, Supplier<T> action) {
    CountedLock entry = acquire(pair);
    entry.lock.lock();
    try {
      return action.get();
    } finally {
      entry.lock.unlock();
      release(pair);
    }
  }

  public void runWithLock(PairKey pair, Runnable action) {
    withLock(
        pair,
        () -> {
          action.run();
          return null;
        });
  }

  /** Number of pairs with a holder or waiter. */
  int activeLocks() {
    return locks.size();
  }

  private CountedLock acquire(PairKey pair) {
    return locks.compute(
        pair,
        (key, entry) -> {
          CountedLock counted = entry != null ? entry : new CountedLock();
          counted.users++;
          return counted;
        });
  }

  private void release(PairKey pair) {
    locks.computeIfPresent(pair, (key, entry) -> --entry.users == 0 ? null : entry);
  }

  /** Lock plus the number of acquisitions not yet released; only touched inside compute. */
  private static final class CountedLock {
    private final ReentrantLock lock = new ReentrantLock();
    private int users;
  }
}
