package com.flamingo.ai.persona.service.memory;

import com.flamingo.ai.persona.domain.enums.EmotionalCategory;
import com.flamingo.ai.persona.domain.enums.MemoryCategory;
import java.util.Map;

/**
 * Aggregate view of what a character remembers about one user.
 *
 * @param commonTopics topic tag to number of memories carrying it
 * @param relationshipStrength 0 to 10, one step per five memories
 * @param personalityUnderstanding 0 to 10, from category variety and high-importance memories
 * @param learningFocus dominant topic of the memories, or general learning when none dominates
 */
public record MemorySummary(
    String characterId,
    String userId,
    long total,
    Map<MemoryCategory, Long> byCategory,
    Map<EmotionalCategory, Long> byEmotion,
    double averageImportance,
    Map<String, Long> commonTopics,
    int relationshipStrength,
    int personalityUnderstanding,
    String learningFocus) {}
