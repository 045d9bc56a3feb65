package com.flamingo.ai.persona.domain.entity;

import com.flamingo.ai.persona.domain.enums.EmotionalCategory;
import com.flamingo.ai.persona.domain.model.BehaviorVector;
import com.flamingo.ai.persona.domain.model.EmotionalState;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Transient emotional overlay of one character for one user.
 *
 * <p>Holds a delta over the character's baseline. The pair is in the <em>baseline</em> state when
 * every delta component is zero and <em>adapted</em> otherwise. Invariant: {@code baseline +
 * delta} stays within each dimension's declared range.
 */
@Entity
@Table(
    name = "adaptation_states",
    uniqueConstraints = @UniqueConstraint(columnNames = {"character_id", "user_id"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AdaptationState {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "character_id", nullable = false)
  private String characterId;

  @Column(name = "user_id", nullable = false)
  private String userId;

  @Builder.Default private double deltaPatience = 0.0;
  @Builder.Default private double deltaFormality = 0.0;
  @Builder.Default private double deltaEnthusiasm = 0.0;
  @Builder.Default private double deltaHumor = 0.0;
  @Builder.Default private double deltaExpertiseConfidence = 0.0;
  @Builder.Default private double deltaVerbosity = 0.0;

  /** Neutral turns since the last non-neutral detection. */
  @Builder.Default private int turnsSinceEmotion = 0;

  /** Emotion that drives the current adaptation; neutral in the baseline state. */
  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private EmotionalCategory activeEmotion = EmotionalCategory.NEUTRAL;

  @Builder.Default private double activeConfidence = 0.0;

  /** Set by boredom; asks the character to steer toward a fresh topic. */
  @Builder.Default private boolean topicNoveltyRequested = false;

  private LocalDateTime createdAt;

  private LocalDateTime updatedAt;

  @PrePersist
  protected void onCreate() {
    LocalDateTime now = LocalDateTime.now();
    createdAt = now;
    updatedAt = now;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }

  public static AdaptationState initial(String characterId, String userId) {
    return AdaptationState.builder().characterId(characterId).userId(userId).build();
  }

  public BehaviorVector delta() {
    return new BehaviorVector(
        deltaPatience,
        deltaFormality,
        deltaEnthusiasm,
        deltaHumor,
        deltaExpertiseConfidence,
        deltaVerbosity);
  }

  private void replaceDelta(BehaviorVector delta) {
    deltaPatience = delta.patience();
    deltaFormality = delta.formality();
    deltaEnthusiasm = delta.enthusiasm();
    deltaHumor = delta.humor();
    deltaExpertiseConfidence = delta.expertiseConfidence();
    deltaVerbosity = delta.verbosity();
  }

  /**
   * Adds the emotion's delta to the accumulated delta, limited so the effective value cannot leave
   * the dimension's range.
   */
  public void applyEmotion(
      EmotionalState detected, BehaviorVector emotionDelta, BehaviorVector baseline) {
    replaceDelta(delta().plus(emotionDelta).boundedAround(baseline));
    turnsSinceEmotion = 0;
    activeEmotion = detected.emotion();
    activeConfidence = detected.confidence();
    topicNoveltyRequested = detected.emotion() == EmotionalCategory.BORED;
  }

  /**
   * Moves the delta toward zero by {@code factor}; once every component is below {@code epsilon}
   * the pair is back at baseline.
   */
  public void decay(double factor, double epsilon) {
    BehaviorVector decayed = delta().scale(factor);
    if (decayed.magnitude() < epsilon) {
      decayed = BehaviorVector.ZERO;
      activeEmotion = EmotionalCategory.NEUTRAL;
      activeConfidence = 0.0;
      topicNoveltyRequested = false;
    }
    replaceDelta(decayed);
    turnsSinceEmotion++;
  }

  public boolean isAdapted() {
    return delta().magnitude() > 0.0;
  }

  /** {@code clamp(baseline + delta)} per dimension. */
  public BehaviorVector effective(BehaviorVector baseline) {
    return baseline.plus(delta()).clamp();
  }
}
