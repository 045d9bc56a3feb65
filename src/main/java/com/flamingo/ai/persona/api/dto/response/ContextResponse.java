package com.flamingo.ai.persona.api.dto.response;

import com.flamingo.ai.persona.service.context.ContextBundle;
import com.flamingo.ai.persona.service.context.KnowledgeItem;
import com.flamingo.ai.persona.service.context.SystemLayer;
import com.flamingo.ai.persona.service.session.SessionTurn;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an assembled context, with its plain-text rendering. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextResponse {

  private SystemLayer system;
  private List<SessionTurn> session;
  private List<KnowledgeItem> knowledge;
  private String userMessage;
  private int estimatedTokens;
  private int tokenBudget;
  private int droppedSessionTurns;
  private int droppedKnowledgeItems;
  private String rendered;

  public static ContextResponse from(ContextBundle bundle, String rendered) {
    return ContextResponse.builder()
        .system(bundle.system())
        .session(bundle.session())
        .knowledge(bundle.knowledge())
        .userMessage(bundle.userMessage())
        .estimatedTokens(bundle.estimatedTokens())
        .tokenBudget(bundle.tokenBudget())
        .droppedSessionTurns(bundle.droppedSessionTurns())
        .droppedKnowledgeItems(bundle.droppedKnowledgeItems())
        .rendered(rendered)
        .build();
  }
}
