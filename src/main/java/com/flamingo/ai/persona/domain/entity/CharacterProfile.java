package com.flamingo.ai.persona.domain.entity;

import com.flamingo.ai.persona.domain.converter.TagSetConverter;
import com.flamingo.ai.persona.domain.enums.EmotionalCategory;
import com.flamingo.ai.persona.domain.enums.PatienceLevel;
import com.flamingo.ai.persona.domain.model.BehaviorVector;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.MapKeyColumn;
import jakarta.persistence.MapKeyEnumerated;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Static personality of a synthetic character. Runtime adaptation never touches this entity; it
 * changes only through an administrative edit.
 */
@Entity
@Table(name = "character_profiles")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CharacterProfile {

  /** URL-safe slug, e.g. {@code aino}. */
  @Id private String id;

  @Column(nullable = false)
  private String name;

  private String archetype;

  private String culturalBackground;

  private Integer age;

  private String occupation;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private PatienceLevel patienceLevel = PatienceLevel.MODERATE;

  @Builder.Default private double formality = 0.5;

  @Builder.Default private double enthusiasm = 0.5;

  @Builder.Default private double humor = 0.3;

  @Builder.Default private double expertiseConfidence = 0.8;

  @Builder.Default private double verbosity = 0.5;

  /** simple, technical or adaptive. */
  @Builder.Default private String explanationStyle = "adaptive";

  @Convert(converter = TagSetConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private Set<String> knowledgeDomains = new TreeSet<>();

  @Convert(converter = TagSetConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private Set<String> teachingSpecialties = new TreeSet<>();

  @ElementCollection(fetch = FetchType.EAGER)
  @CollectionTable(
      name = "character_conversation_starters",
      joinColumns = @JoinColumn(name = "character_id"))
  @OrderColumn(name = "position")
  @Column(name = "starter", columnDefinition = "TEXT")
  @Builder.Default
  private List<String> conversationStarters = new ArrayList<>();

  /** Extra persona instruction used while the character adapts to a given emotion. */
  @ElementCollection(fetch = FetchType.EAGER)
  @CollectionTable(
      name = "character_adaptation_notes",
      joinColumns = @JoinColumn(name = "character_id"))
  @MapKeyEnumerated(EnumType.STRING)
  @MapKeyColumn(name = "emotion")
  @Column(name = "note", columnDefinition = "TEXT")
  @Builder.Default
  private Map<EmotionalCategory, String> adaptationNotes = new EnumMap<>(EmotionalCategory.class);

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @Column(nullable = false)
  private LocalDateTime updatedAt;

  @PrePersist
  protected void onCreate() {
    validate();
    LocalDateTime now = LocalDateTime.now();
    createdAt = now;
    updatedAt = now;
  }

  @PreUpdate
  protected void onUpdate() {
    validate();
    updatedAt = LocalDateTime.now();
  }

  /** Baseline behavior vector; patience comes from the ordinal level. */
  public BehaviorVector baseline() {
    return new BehaviorVector(
        patienceLevel.value(), formality, enthusiasm, humor, expertiseConfidence, verbosity);
  }

  /** Note for the given emotion, or null when the character defines none. */
  public String adaptationNoteFor(EmotionalCategory emotion) {
    return adaptationNotes == null ? null : adaptationNotes.get(emotion);
  }

  /**
   * Checks that the baseline lies within every dimension's declared range.
   *
   * @throws IllegalArgumentException if any trait is out of range
   */
  public void validate() {
    baseline().requireWithinBounds();
  }
}
