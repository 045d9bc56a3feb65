package com.flamingo.ai.persona.service.emotion;

import com.flamingo.ai.persona.domain.model.EmotionalState;
import java.util.List;

/**
 * Classifies a user message into an {@link EmotionalState}.
 *
 * <p>Implementations must be deterministic and side-effect free: the same text and history always
 * yield the same state. A message that cannot be classified is neutral with confidence 0.
 */
public interface EmotionDetector {

  /**
   * Detects the emotion of a user message.
   *
   * @param text the current user message
   * @param recentHistory earlier user messages of the conversation, oldest first; may be empty
   * @return the detected state
   */
  EmotionalState detect(String text, List<String> recentHistory);
}
