package com.flamingo.ai.persona.service.adaptation;

import com.flamingo.ai.persona.domain.model.BehaviorVector;
import com.flamingo.ai.persona.domain.model.EmotionalState;

/**
 * Turns detected emotions into a bounded, decaying overlay on a character's baseline.
 *
 * <p>Non-neutral emotions add their delta; neutral turns decay the delta toward zero. The returned
 * vector is always within each dimension's declared range.
 */
public interface BehaviorAdapter {

  /**
   * Applies one detected emotion to the pair's state and returns the effective behavior.
   *
   * @param characterId the character id
   * @param userId the user id
   * @param state the emotion detected for the current message
   * @return {@code clamp(baseline + delta)} after this turn
   * @throws com.flamingo.ai.persona.exception.CharacterNotFoundException if the character is
   *     unknown
   */
  BehaviorVector adapt(String characterId, String userId, EmotionalState state);

  /**
   * Current adaptation of the pair without changing it. A pair that never interacted is at
   * baseline.
   */
  AdaptationSnapshot currentState(String characterId, String userId);
}
