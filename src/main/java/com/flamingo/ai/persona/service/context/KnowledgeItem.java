package com.flamingo.ai.persona.service.context;

import com.flamingo.ai.persona.domain.enums.MemoryCategory;
import com.flamingo.ai.persona.service.memory.ScoredMemory;
import java.util.UUID;

/** A retrieved memory placed in the knowledge layer. */
public record KnowledgeItem(UUID memoryId, MemoryCategory category, String content, double score) {

  public static KnowledgeItem from(ScoredMemory scored) {
    return new KnowledgeItem(
        scored.memory().getId(),
        scored.memory().getCategory(),
        scored.memory().getContent(),
        scored.score());
  }
}
