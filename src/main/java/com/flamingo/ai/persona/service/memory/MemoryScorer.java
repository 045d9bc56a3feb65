package com.flamingo.ai.persona.service.memory;

import com.flamingo.ai.persona.config.PersonaConfig;
import com.flamingo.ai.persona.domain.entity.Memory;
import com.flamingo.ai.persona.domain.enums.MemoryCategory;
import com.flamingo.ai.persona.domain.model.EmotionalState;
import com.flamingo.ai.persona.service.text.TextTokens;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Importance at write time, similarity between memories, and the composite retrieval score. */
@Component
@RequiredArgsConstructor
public class MemoryScorer {

  static final List<String> HIGH_VALUE_KEYWORDS =
      List.of("goal", "important", "always", "never", "love", "hate", "struggling");

  static final List<String> HEDGES = List.of("i think", "maybe", "probably", "sometimes");

  /** Containment is a full match only when the shorter text has at least this many tokens. */
  private static final int MIN_CONTAINED_TOKENS = 3;

  private final PersonaConfig personaConfig;

  /**
   * Importance of a new memory: category base weight, plus emotional salience, plus high-value
   * keywords, minus hedges. Clamped to [0, 1].
   */
  public double importance(MemoryCategory category, String content, EmotionalState state) {
    PersonaConfig.Memory settings = personaConfig.getMemory();
    double score = settings.categoryWeight(category);

    if (state != null && !state.isNeutral()) {
      score += settings.getEmotionalBoost() * state.confidence();
    }

    String padded = " " + String.join(" ", TextTokens.tokenize(content)) + " ";
    for (String keyword : HIGH_VALUE_KEYWORDS) {
      if (padded.contains(" " + keyword + " ")) {
        score += settings.getKeywordBoost();
      }
    }
    for (String hedge : HEDGES) {
      if (padded.contains(" " + hedge + " ")) {
        score -= settings.getKeywordBoost();
      }
    }
    return Math.max(0.0, Math.min(1.0, score));
  }

  /** Similarity in [0, 1]: 1 for equal or contained text, token Jaccard otherwise. */
  public double similarity(String a, String b) {
    String left = TextTokens.normalizeWhitespace(a).toLowerCase(Locale.ROOT);
    String right = TextTokens.normalizeWhitespace(b).toLowerCase(Locale.ROOT);
    if (left.isEmpty() || right.isEmpty()) {
      return 0.0;
    }
    if (left.equals(right)) {
      return 1.0;
    }

    Set<String> leftTokens = TextTokens.tokenSet(left);
    Set<String> rightTokens = TextTokens.tokenSet(right);
    String shorter = left.length() <= right.length() ? left : right;
    String longer = shorter == left ? right : left;
    int shorterTokens = Math.min(leftTokens.size(), rightTokens.size());
    if (shorterTokens >= MIN_CONTAINED_TOKENS && longer.contains(shorter)) {
      return 1.0;
    }

    Set<String> union = new HashSet<>(leftTokens);
    union.addAll(rightTokens);
    if (union.isEmpty()) {
      return 0.0;
    }
    Set<String> intersection = new HashSet<>(leftTokens);
    intersection.retainAll(rightTokens);
    return (double) intersection.size() / union.size();
  }

  /** Weight in (0, 1] that halves every {@code recencyHalfLifeHours} since last creation/access. */
  public double recency(Memory memory, LocalDateTime now) {
    double hours = Duration.between(memory.recencyReference(), now).toMillis() / 3_600_000.0;
    if (hours <= 0) {
      return 1.0;
    }
    return Math.pow(0.5, hours / personaConfig.getMemory().getRecencyHalfLifeHours());
  }

  /**
   * Retrieval key combining importance and recency, with a bonus when the memory's topics overlap
   * the current message's topics. An empty {@code queryTopics} disables the bonus.
   */
  public double composite(Memory memory, LocalDateTime now, Set<String> queryTopics) {
    PersonaConfig.Memory settings = personaConfig.getMemory();
    double score =
        settings.getImportanceWeight() * memory.getImportance()
            + settings.getRecencyWeight() * recency(memory, now);
    if (queryTopics != null && !queryTopics.isEmpty() && memory.getTopics() != null) {
      for (String topic : memory.getTopics()) {
        if (queryTopics.contains(topic)) {
          score += settings.getTopicBoost();
          break;
        }
      }
    }
    return score;
  }
}
