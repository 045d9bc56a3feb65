package com.flamingo.ai.persona.service.emotion;

import com.flamingo.ai.persona.config.PersonaConfig;
import com.flamingo.ai.persona.domain.enums.EmotionalCategory;
import com.flamingo.ai.persona.domain.model.EmotionalState;
import com.flamingo.ai.persona.service.text.TextTokens;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Keyword detector over {@link EmotionLexicon}.
 *
 * <p>Every category is scored over the same token stream. Phrases are matched longest first and a
 * token counts toward at most one phrase per category. A negator within the configured window
 * before a phrase discards the match; an intensifier right before it multiplies the weight. Recent
 * history only reinforces categories the current message already shows, so an old complaint cannot
 * make a neutral message look frustrated.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LexicalEmotionDetector implements EmotionDetector {

  private final PersonaConfig personaConfig;

  @Override
  public EmotionalState detect(String text, List<String> recentHistory) {
    PersonaConfig.Emotion settings = personaConfig.getEmotion();
    Map<EmotionalCategory, Double> scores = score(text, settings);
    if (scores.isEmpty()) {
      return EmotionalState.neutral();
    }

    if (recentHistory != null && !recentHistory.isEmpty()) {
      int from = Math.max(0, recentHistory.size() - settings.getHistoryWindow());
      for (String previous : recentHistory.subList(from, recentHistory.size())) {
        Map<EmotionalCategory, Double> previousScores = score(previous, settings);
        previousScores.forEach(
            (category, value) -> {
              if (scores.containsKey(category)) {
                scores.merge(category, settings.getHistoryWeight() * value, Double::sum);
              }
            });
      }
    }

    EmotionalCategory winner = null;
    double best = 0.0;
    for (EmotionalCategory category : EmotionalCategory.byPriority()) {
      double value = scores.getOrDefault(category, 0.0);
      if (value > best) {
        best = value;
        winner = category;
      }
    }

    if (winner == null || best < settings.getMinScore()) {
      log.debug("Below threshold (best={}), neutral", best);
      return EmotionalState.neutral();
    }
    double confidence = Math.min(1.0, best / settings.getSaturationScore());
    log.debug("Detected {} with score {} (confidence {})", winner, best, confidence);
    return EmotionalState.of(winner, confidence);
  }

  /** Non-zero scores of the message alone, without history. */
  Map<EmotionalCategory, Double> score(String text, PersonaConfig.Emotion settings) {
    Map<EmotionalCategory, Double> scores = new EnumMap<>(EmotionalCategory.class);
    if (text == null || text.isBlank()) {
      return scores;
    }
    List<String> tokens = TextTokens.tokenize(text);

    for (EmotionalCategory category : EmotionalCategory.values()) {
      if (category.isNeutral()) {
        continue;
      }
      double total = matchCategory(tokens, EmotionLexicon.triggers(category), settings);
      if (total > 0.0) {
        scores.put(category, total);
      }
    }

    long questionMarks = text.chars().filter(c -> c == '?').count();
    if (questionMarks > 1) {
      scores.merge(
          EmotionalCategory.CONFUSED,
          (questionMarks - 1) * EmotionLexicon.EXTRA_QUESTION_MARK_WEIGHT,
          Double::sum);
    }
    long exclamations = text.chars().filter(c -> c == '!').count();
    if (exclamations > 0 && scores.containsKey(EmotionalCategory.EXCITED)) {
      scores.merge(
          EmotionalCategory.EXCITED, exclamations * EmotionLexicon.EXCLAMATION_WEIGHT, Double::sum);
    }
    return scores;
  }

  private double matchCategory(
      List<String> tokens, List<EmotionLexicon.Trigger> triggers, PersonaConfig.Emotion settings) {
    boolean[] used = new boolean[tokens.size()];
    double total = 0.0;
    for (EmotionLexicon.Trigger trigger : triggers) {
      int length = trigger.length();
      for (int start = 0; start + length <= tokens.size(); start++) {
        if (!matchesAt(tokens, used, trigger.tokens(), start)) {
          continue;
        }
        for (int i = start; i < start + length; i++) {
          used[i] = true;
        }
        if (isNegated(tokens, start, settings.getNegationWindow())) {
          continue;
        }
        double weight = trigger.weight();
        if (start > 0 && EmotionLexicon.INTENSIFIERS.contains(tokens.get(start - 1))) {
          weight *= settings.getIntensifierMultiplier();
        }
        total += weight;
      }
    }
    return total;
  }

  private static boolean matchesAt(
      List<String> tokens, boolean[] used, List<String> phrase, int start) {
    for (int i = 0; i < phrase.size(); i++) {
      if (used[start + i] || !tokens.get(start + i).equals(phrase.get(i))) {
        return false;
      }
    }
    return true;
  }

  private static boolean isNegated(List<String> tokens, int start, int window) {
    for (int i = Math.max(0, start - window); i < start; i++) {
      if (EmotionLexicon.NEGATORS.contains(tokens.get(i))) {
        return true;
      }
    }
    return false;
  }
}
