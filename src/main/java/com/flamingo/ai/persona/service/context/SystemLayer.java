package com.flamingo.ai.persona.service.context;

import com.flamingo.ai.persona.domain.enums.AdaptationMode;
import com.flamingo.ai.persona.domain.enums.EmotionalCategory;
import com.flamingo.ai.persona.domain.model.BehaviorVector;

/**
 * Persona identity plus the behavior the character should show this turn.
 *
 * @param instructions rendered persona prompt
 */
public record SystemLayer(
    String characterId,
    String characterName,
    String instructions,
    BehaviorVector effectiveBehavior,
    EmotionalCategory activeEmotion,
    AdaptationMode mode) {}
