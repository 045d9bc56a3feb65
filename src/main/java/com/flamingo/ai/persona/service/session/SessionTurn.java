package com.flamingo.ai.persona.service.session;

import com.flamingo.ai.persona.domain.entity.ChatTurn;
import com.flamingo.ai.persona.domain.enums.TurnRole;
import java.time.LocalDateTime;

/** One earlier message as it appears in the session layer. */
public record SessionTurn(TurnRole role, String content, LocalDateTime createdAt) {

  public static SessionTurn from(ChatTurn turn) {
    return new SessionTurn(turn.getRole(), turn.getContent(), turn.getCreatedAt());
  }
}
