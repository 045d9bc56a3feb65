package com.flamingo.ai.persona.service.memory;

import com.flamingo.ai.persona.domain.entity.Memory;
import com.flamingo.ai.persona.domain.enums.MemoryCategory;
import com.flamingo.ai.persona.domain.model.EmotionalState;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/** Scores, stores and retrieves what a character remembers about a user. */
public interface MemoryService {

  /**
   * Scores and stores one memory for the pair. A near-identical existing memory absorbs the new one
   * instead of being duplicated. Storage failures are logged and swallowed.
   *
   * @param characterId the character id
   * @param userId the user id
   * @param content the memory text
   * @param category the memory category
   * @param state the emotion active when the memory was formed
   * @return the stored (or merged-into) memory, empty if nothing was persisted
   */
  Optional<Memory> recordMemory(
      String characterId,
      String userId,
      String content,
      MemoryCategory category,
      EmotionalState state);

  /**
   * Extracts candidate memories from a completed turn and records them. The user message yields
   * preferences, goals, facts and emotional events; the character's reply adds corrections and
   * moments of understanding. Memories written by one call are never evicted by that same call.
   *
   * @param reply the generated reply of the turn, may be null
   * @return memories stored or merged into
   */
  List<Memory> extractAndRecord(
      String characterId, String userId, String userMessage, String reply, EmotionalState state);

  /**
   * Queues {@link #extractAndRecord} behind earlier writes of the same pair.
   *
   * @return a future completed when the write has run
   */
  CompletableFuture<Void> extractAndRecordAsync(
      String characterId, String userId, String userMessage, String reply, EmotionalState state);

  /**
   * Top memories for the current message by composite score, without side effects. Falls back to
   * an empty list when the store is unavailable.
   */
  List<ScoredMemory> rank(String characterId, String userId, String message, int limit);

  /** {@link #rank} followed by a last-access refresh of the returned memories. */
  List<ScoredMemory> retrieve(String characterId, String userId, String message, int limit);

  /** Refreshes last-access of the given memories. Importance is not changed. */
  void markAccessed(Collection<UUID> memoryIds);

  /** All memories of the pair ordered by importance. */
  List<Memory> getAllMemories(String characterId, String userId);

  /**
   * Gets a memory owned by the pair.
   *
   * @throws com.flamingo.ai.persona.exception.MemoryNotFoundException if not found
   * @throws com.flamingo.ai.persona.exception.MemoryAccessDeniedException if owned by another pair
   */
  Memory getMemory(String characterId, String userId, UUID memoryId);

  /** Deletes a memory owned by the pair. */
  void deleteMemory(String characterId, String userId, UUID memoryId);

  /** Explicit promotion: raises importance by the configured step. */
  Memory promoteMemory(String characterId, String userId, UUID memoryId);

  /** Counts, topics and relationship measures over all memories of the pair. */
  MemorySummary summarize(String characterId, String userId);

  /** Suggested topics, gaps, engagement and next steps from the pair's recent memories. */
  ConversationInsights insights(String characterId, String userId);

  /**
   * Validates that a memory belongs to the pair.
   *
   * @throws com.flamingo.ai.persona.exception.MemoryNotFoundException if not found
   * @throws com.flamingo.ai.persona.exception.MemoryAccessDeniedException if owned by another pair
   */
  void validateMemoryOwnership(UUID memoryId, String characterId, String userId);
}
