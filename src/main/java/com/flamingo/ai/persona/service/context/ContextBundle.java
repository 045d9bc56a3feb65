package com.flamingo.ai.persona.service.context;

import com.flamingo.ai.persona.service.session.SessionTurn;
import java.util.List;
import java.util.UUID;

/**
 * Everything the generation model sees for one turn, in layer order: system, session (oldest
 * first), knowledge (highest score first), user.
 */
public record ContextBundle(
    SystemLayer system,
    List<SessionTurn> session,
    List<KnowledgeItem> knowledge,
    String userMessage,
    int estimatedTokens,
    int tokenBudget,
    int droppedSessionTurns,
    int droppedKnowledgeItems) {

  public ContextBundle {
    session = List.copyOf(session);
    knowledge = List.copyOf(knowledge);
  }

  public List<UUID> knowledgeMemoryIds() {
    return knowledge.stream().map(KnowledgeItem::memoryId).toList();
  }

  public boolean isOverBudget() {
    return estimatedTokens > tokenBudget;
  }
}
