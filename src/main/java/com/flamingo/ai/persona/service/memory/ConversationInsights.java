package com.flamingo.ai.persona.service.memory;

import java.util.List;

/** Suggestions for the next conversations of a pair, derived from its recent memories. */
public record ConversationInsights(
    String characterId,
    String userId,
    List<String> suggestedTopics,
    List<String> learningGaps,
    String engagementLevel,
    List<String> nextSteps) {}
