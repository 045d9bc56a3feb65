package com.flamingo.ai.persona.exception;

import com.flamingo.ai.persona.domain.model.PairKey;
import java.util.UUID;

/** Exception thrown when a memory is addressed through a pair that does not own it. */
public class MemoryAccessDeniedException extends RuntimeException {

  private final UUID memoryId;
  private final PairKey pair;

  public MemoryAccessDeniedException(UUID memoryId, PairKey pair) {
    super(String.format("Memory %s does not belong to %s", memoryId, pair));
    this.memoryId = memoryId;
    this.pair = pair;
  }

  public UUID getMemoryId() {
    return memoryId;
  }

  public PairKey getPair() {
    return pair;
  }
}
