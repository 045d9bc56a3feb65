package com.flamingo.ai.persona.domain.model;

import com.flamingo.ai.persona.domain.enums.EmotionalCategory;
import java.util.Objects;

/**
 * Result of classifying one user message.
 *
 * @param emotion the winning category
 * @param confidence confidence in [0, 1]; always 0 for an unclassified (neutral) message
 */
public record EmotionalState(EmotionalCategory emotion, double confidence) {

  private static final EmotionalState NEUTRAL = new EmotionalState(EmotionalCategory.NEUTRAL, 0.0);

  public EmotionalState {
    Objects.requireNonNull(emotion, "emotion");
    if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
      throw new IllegalArgumentException("Confidence must be within [0, 1]: " + confidence);
    }
  }

  public static EmotionalState neutral() {
    return NEUTRAL;
  }

  public static EmotionalState of(EmotionalCategory emotion, double confidence) {
    return emotion.isNeutral() ? NEUTRAL : new EmotionalState(emotion, confidence);
  }

  public boolean isNeutral() {
    return emotion.isNeutral();
  }
}
