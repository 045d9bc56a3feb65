package com.flamingo.ai.persona.api.dto.response;

import com.flamingo.ai.persona.domain.enums.EmotionalCategory;
import com.flamingo.ai.persona.domain.model.EmotionalState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a detected emotion. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmotionResponse {

  private EmotionalCategory emotion;
  private double confidence;

  public static EmotionResponse from(EmotionalState state) {
    return EmotionResponse.builder()
        .emotion(state.emotion())
        .confidence(state.confidence())
        .build();
  }
}
