package com.flamingo.ai.persona.api.dto.response;

import com.flamingo.ai.persona.domain.enums.AdaptationMode;
import com.flamingo.ai.persona.domain.enums.EmotionalCategory;
import com.flamingo.ai.persona.domain.model.BehaviorVector;
import com.flamingo.ai.persona.service.adaptation.AdaptationSnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for the adaptation state of a character/user pair. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BehaviorResponse {

  private String characterId;
  private String userId;
  private BehaviorVector baseline;
  private BehaviorVector delta;
  private BehaviorVector effective;
  private boolean adapted;
  private EmotionalCategory activeEmotion;
  private double activeConfidence;
  private int turnsSinceEmotion;
  private boolean topicNoveltyRequested;
  private AdaptationMode mode;

  public static BehaviorResponse from(AdaptationSnapshot snapshot) {
    return BehaviorResponse.builder()
        .characterId(snapshot.characterId())
        .userId(snapshot.userId())
        .baseline(snapshot.baseline())
        .delta(snapshot.delta())
        .effective(snapshot.effective())
        .adapted(snapshot.isAdapted())
        .activeEmotion(snapshot.activeEmotion())
        .activeConfidence(snapshot.activeConfidence())
        .turnsSinceEmotion(snapshot.turnsSinceEmotion())
        .topicNoveltyRequested(snapshot.topicNoveltyRequested())
        .mode(snapshot.mode())
        .build();
  }
}
