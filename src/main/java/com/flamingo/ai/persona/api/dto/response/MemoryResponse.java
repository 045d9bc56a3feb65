package com.flamingo.ai.persona.api.dto.response;

import com.flamingo.ai.persona.domain.entity.Memory;
import com.flamingo.ai.persona.domain.enums.EmotionalCategory;
import com.flamingo.ai.persona.domain.enums.MemoryCategory;
import java.time.LocalDateTime;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for memory data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemoryResponse {

  private UUID id;
  private String characterId;
  private String userId;
  private String content;
  private MemoryCategory category;
  private double importance;
  private EmotionalCategory emotion;
  private double emotionConfidence;
  private Set<String> topics;
  private int accessCount;
  private LocalDateTime createdAt;
  private LocalDateTime lastAccessedAt;

  /** Creates a MemoryResponse from a Memory entity. */
  public static MemoryResponse fromEntity(Memory memory) {
    return MemoryResponse.builder()
        .id(memory.getId())
        .characterId(memory.getCharacterId())
        .userId(memory.getUserId())
        .content(memory.getContent())
        .category(memory.getCategory())
        .importance(memory.getImportance())
        .emotion(memory.getEmotion())
        .emotionConfidence(memory.getEmotionConfidence())
        .topics(new TreeSet<>(memory.getTopics()))
        .accessCount(memory.getAccessCount())
        .createdAt(memory.getCreatedAt())
        .lastAccessedAt(memory.getLastAccessedAt())
        .build();
  }
}
