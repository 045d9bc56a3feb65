package com.flamingo.ai.persona.api.rest;

import com.flamingo.ai.persona.api.dto.request.CreateMemoryRequest;
import com.flamingo.ai.persona.api.dto.response.MemoryResponse;
import com.flamingo.ai.persona.domain.entity.Memory;
import com.flamingo.ai.persona.domain.model.EmotionalState;
import com.flamingo.ai.persona.service.character.CharacterProfileService;
import com.flamingo.ai.persona.service.memory.ConversationInsights;
import com.flamingo.ai.persona.service.memory.MemoryService;
import com.flamingo.ai.persona.service.memory.MemorySummary;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the memories a character keeps about a user. */
@RestController
@RequestMapping("/api/characters/{characterId}/users/{userId}/memories")
@RequiredArgsConstructor
@Slf4j
public class MemoryController {

  private final MemoryService memoryService;
  private final CharacterProfileService characterProfileService;

  /**
   * Lists all memories of the pair.
   *
   * @return memories ordered by importance
   */
  @GetMapping
  public ResponseEntity<List<MemoryResponse>> listMemories(
      @PathVariable String characterId, @PathVariable String userId) {
    List<Memory> memories = memoryService.getAllMemories(characterId, userId);
    return ResponseEntity.ok(memories.stream().map(MemoryResponse::fromEntity).toList());
  }

  /**
   * Records a memory. A write that the store could not persist is accepted and dropped.
   *
   * @return 201 with the stored memory, or 202 when nothing was persisted
   */
  @PostMapping
  public ResponseEntity<MemoryResponse> createMemory(
      @PathVariable String characterId,
      @PathVariable String userId,
      @Valid @RequestBody CreateMemoryRequest request) {
    characterProfileService.getProfile(characterId);
    log.info(
        "Recording {} memory for {}/{}", request.getCategory().label(), characterId, userId);

    EmotionalState state =
        request.getEmotion() == null
            ? EmotionalState.neutral()
            : EmotionalState.of(
                request.getEmotion(),
                request.getConfidence() != null ? request.getConfidence() : 0.0);
    Optional<Memory> memory =
        memoryService.recordMemory(
            characterId, userId, request.getContent(), request.getCategory(), state);

    return memory
        .map(m -> ResponseEntity.status(HttpStatus.CREATED).body(MemoryResponse.fromEntity(m)))
        .orElseGet(() -> ResponseEntity.accepted().build());
  }

  @GetMapping("/summary")
  public ResponseEntity<MemorySummary> getSummary(
      @PathVariable String characterId, @PathVariable String userId) {
    return ResponseEntity.ok(memoryService.summarize(characterId, userId));
  }

  @GetMapping("/insights")
  public ResponseEntity<ConversationInsights> getInsights(
      @PathVariable String characterId, @PathVariable String userId) {
    return ResponseEntity.ok(memoryService.insights(characterId, userId));
  }

  @GetMapping("/{memoryId}")
  public ResponseEntity<MemoryResponse> getMemory(
      @PathVariable String characterId,
      @PathVariable String userId,
      @PathVariable UUID memoryId) {
    Memory memory = memoryService.getMemory(characterId, userId, memoryId);
    return ResponseEntity.ok(MemoryResponse.fromEntity(memory));
  }

  /** Explicit promotion: raises the memory's importance by the configured step. */
  @PostMapping("/{memoryId}/promote")
  public ResponseEntity<MemoryResponse> promoteMemory(
      @PathVariable String characterId,
      @PathVariable String userId,
      @PathVariable UUID memoryId) {
    Memory memory = memoryService.promoteMemory(characterId, userId, memoryId);
    return ResponseEntity.ok(MemoryResponse.fromEntity(memory));
  }

  @DeleteMapping("/{memoryId}")
  public ResponseEntity<Void> deleteMemory(
      @PathVariable String characterId,
      @PathVariable String userId,
      @PathVariable UUID memoryId) {
    memoryService.validateMemoryOwnership(memoryId, characterId, userId);
    memoryService.deleteMemory(characterId, userId, memoryId);
    return ResponseEntity.noContent().build();
  }
}
