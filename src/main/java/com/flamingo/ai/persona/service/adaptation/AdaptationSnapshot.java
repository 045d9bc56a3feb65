package com.flamingo.ai.persona.service.adaptation;

import com.flamingo.ai.persona.domain.enums.AdaptationMode;
import com.flamingo.ai.persona.domain.enums.EmotionalCategory;
import com.flamingo.ai.persona.domain.model.BehaviorVector;

/** Read-only view of a pair's adaptation, as used by the system layer and the API. */
public record AdaptationSnapshot(
    String characterId,
    String userId,
    BehaviorVector baseline,
    BehaviorVector delta,
    BehaviorVector effective,
    EmotionalCategory activeEmotion,
    double activeConfidence,
    int turnsSinceEmotion,
    boolean topicNoveltyRequested,
    AdaptationMode mode) {

  public boolean isAdapted() {
    return delta.magnitude() > 0.0;
  }
}
