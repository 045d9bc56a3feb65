package com.flamingo.ai.persona.domain.entity;

import com.flamingo.ai.persona.domain.converter.TagSetConverter;
import com.flamingo.ai.persona.domain.enums.EmotionalCategory;
import com.flamingo.ai.persona.domain.enums.MemoryCategory;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A durable fact or observation a character keeps about one user. */
@Entity
@Table(name = "memories", indexes = @Index(columnList = "character_id, user_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Memory {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "character_id", nullable = false)
  private String characterId;

  @Column(name = "user_id", nullable = false)
  private String userId;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String content;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private MemoryCategory category;

  /** Importance score from 0.0 to 1.0, computed once at write time. */
  @Builder.Default private double importance = 0.5;

  /** Emotion detected when the memory was recorded. */
  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private EmotionalCategory emotion = EmotionalCategory.NEUTRAL;

  @Builder.Default private double emotionConfidence = 0.0;

  @Convert(converter = TagSetConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private Set<String> topics = new TreeSet<>();

  @Builder.Default private int accessCount = 0;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  private LocalDateTime lastAccessedAt;

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = LocalDateTime.now();
    }
    if (lastAccessedAt == null) {
      lastAccessedAt = createdAt;
    }
  }

  /** Records a read at the given time. Importance is left untouched. */
  public void touch(LocalDateTime now) {
    lastAccessedAt = now;
    accessCount++;
  }

  /** Increases the importance score (capped at 1.0). */
  public void promote(double step) {
    this.importance = Math.min(1.0, this.importance + step);
  }

  /** The later of creation and last access. */
  public LocalDateTime recencyReference() {
    if (lastAccessedAt == null || lastAccessedAt.isBefore(createdAt)) {
      return createdAt;
    }
    return lastAccessedAt;
  }

  public boolean belongsTo(String characterId, String userId) {
    return this.characterId.equals(characterId) && this.userId.equals(userId);
  }
}
