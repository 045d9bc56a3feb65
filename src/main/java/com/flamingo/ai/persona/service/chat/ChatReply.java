package com.flamingo.ai.persona.service.chat;

import com.flamingo.ai.persona.domain.enums.AdaptationMode;
import com.flamingo.ai.persona.domain.model.BehaviorVector;
import com.flamingo.ai.persona.domain.model.EmotionalState;

/** Outcome of one completed turn. */
public record ChatReply(
    String characterId,
    String userId,
    String reply,
    EmotionalState emotion,
    BehaviorVector effectiveBehavior,
    AdaptationMode mode,
    int memoriesUsed,
    int sessionTurnsUsed,
    int estimatedTokens) {}
