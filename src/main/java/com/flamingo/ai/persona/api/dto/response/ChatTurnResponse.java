package com.flamingo.ai.persona.api.dto.response;

import com.flamingo.ai.persona.domain.entity.ChatTurn;
import com.flamingo.ai.persona.domain.enums.EmotionalCategory;
import com.flamingo.ai.persona.domain.enums.TurnRole;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one history entry. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatTurnResponse {

  private UUID id;
  private TurnRole role;
  private String content;
  private EmotionalCategory emotion;
  private LocalDateTime createdAt;

  public static ChatTurnResponse fromEntity(ChatTurn turn) {
    return ChatTurnResponse.builder()
        .id(turn.getId())
        .role(turn.getRole())
        .content(turn.getContent())
        .emotion(turn.getEmotion())
        .createdAt(turn.getCreatedAt())
        .build();
  }
}
