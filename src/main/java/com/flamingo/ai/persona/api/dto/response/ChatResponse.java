package com.flamingo.ai.persona.api.dto.response;

import com.flamingo.ai.persona.domain.enums.AdaptationMode;
import com.flamingo.ai.persona.domain.enums.EmotionalCategory;
import com.flamingo.ai.persona.domain.model.BehaviorVector;
import com.flamingo.ai.persona.service.chat.ChatReply;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a completed chat turn. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponse {

  private String characterId;
  private String userId;
  private String reply;
  private EmotionalCategory emotion;
  private double confidence;
  private BehaviorVector effectiveBehavior;
  private AdaptationMode mode;
  private int memoriesUsed;
  private int sessionTurnsUsed;
  private int estimatedTokens;

  public static ChatResponse from(ChatReply reply) {
    return ChatResponse.builder()
        .characterId(reply.characterId())
        .userId(reply.userId())
        .reply(reply.reply())
        .emotion(reply.emotion().emotion())
        .confidence(reply.emotion().confidence())
        .effectiveBehavior(reply.effectiveBehavior())
        .mode(reply.mode())
        .memoriesUsed(reply.memoriesUsed())
        .sessionTurnsUsed(reply.sessionTurnsUsed())
        .estimatedTokens(reply.estimatedTokens())
        .build();
  }
}
