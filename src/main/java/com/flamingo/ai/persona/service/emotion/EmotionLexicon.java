package com.flamingo.ai.persona.service.emotion;

import com.flamingo.ai.persona.domain.enums.EmotionalCategory;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Weighted trigger phrases per emotional category, plus negators and intensifiers. */
public final class EmotionLexicon {

  /** A trigger phrase as tokens with its weight. */
  public record Trigger(List<String> tokens, double weight) {

    static Trigger of(String phrase, double weight) {
      return new Trigger(Arrays.asList(phrase.split(" ")), weight);
    }

    public int length() {
      return tokens.size();
    }
  }

  static final Set<String> NEGATORS =
      Set.of(
          "not", "no", "never", "don't", "doesn't", "didn't", "isn't", "wasn't", "aren't",
          "weren't", "won't", "hardly", "without", "nothing", "barely");

  static final Set<String> INTENSIFIERS =
      Set.of(
          "so", "really", "very", "extremely", "totally", "super", "incredibly", "completely",
          "absolutely", "utterly");

  /** Each '?' after the first adds this much to the confused score. */
  static final double EXTRA_QUESTION_MARK_WEIGHT = 0.3;

  /** Each '!' adds this much to the excited score. */
  static final double EXCLAMATION_WEIGHT = 0.1;

  private static final Map<EmotionalCategory, List<Trigger>> TRIGGERS = buildTriggers();

  private EmotionLexicon() {}

  /** Triggers of a category, longest phrases first. */
  public static List<Trigger> triggers(EmotionalCategory category) {
    return TRIGGERS.getOrDefault(category, List.of());
  }

  private static Map<EmotionalCategory, List<Trigger>> buildTriggers() {
    Map<EmotionalCategory, List<Trigger>> map = new EnumMap<>(EmotionalCategory.class);
    map.put(
        EmotionalCategory.FRUSTRATED,
        sorted(
            Trigger.of("frustrated", 1.0),
            Trigger.of("frustrating", 1.0),
            Trigger.of("fed up", 1.0),
            Trigger.of("hate this", 1.0),
            Trigger.of("this is stupid", 1.0),
            Trigger.of("give up", 0.8),
            Trigger.of("annoyed", 0.8),
            Trigger.of("annoying", 0.8),
            Trigger.of("argh", 0.8),
            Trigger.of("stuck", 0.7),
            Trigger.of("doesn't work", 0.7),
            Trigger.of("still wrong", 0.7),
            Trigger.of("so hard", 0.7),
            Trigger.of("ugh", 0.6)));
    map.put(
        EmotionalCategory.OVERWHELMED,
        sorted(
            Trigger.of("overwhelmed", 1.0),
            Trigger.of("overwhelming", 1.0),
            Trigger.of("can't keep up", 1.0),
            Trigger.of("burned out", 0.9),
            Trigger.of("too much", 0.8),
            Trigger.of("swamped", 0.8),
            Trigger.of("drowning", 0.8),
            Trigger.of("stressed", 0.7),
            Trigger.of("too fast", 0.7),
            Trigger.of("too many", 0.6)));
    map.put(
        EmotionalCategory.CONFUSED,
        sorted(
            Trigger.of("confused", 1.0),
            Trigger.of("confusing", 1.0),
            Trigger.of("don't understand", 1.0),
            Trigger.of("don't get it", 1.0),
            Trigger.of("what do you mean", 0.9),
            Trigger.of("makes no sense", 0.8),
            Trigger.of("puzzled", 0.8),
            Trigger.of("unclear", 0.7),
            Trigger.of("explain again", 0.7),
            Trigger.of("lost", 0.6),
            Trigger.of("huh", 0.6)));
    map.put(
        EmotionalCategory.BORED,
        sorted(
            Trigger.of("bored", 1.0),
            Trigger.of("boring", 1.0),
            Trigger.of("not interested", 0.8),
            Trigger.of("tedious", 0.8),
            Trigger.of("yawn", 0.8),
            Trigger.of("whatever", 0.7),
            Trigger.of("meh", 0.7),
            Trigger.of("dull", 0.7)));
    map.put(
        EmotionalCategory.EXCITED,
        sorted(
            Trigger.of("excited", 1.0),
            Trigger.of("love this", 1.0),
            Trigger.of("can't wait", 0.9),
            Trigger.of("awesome", 0.8),
            Trigger.of("amazing", 0.8),
            Trigger.of("fantastic", 0.8),
            Trigger.of("wow", 0.7),
            Trigger.of("cool", 0.5),
            Trigger.of("great", 0.5)));
    map.put(
        EmotionalCategory.ENGAGED,
        sorted(
            Trigger.of("tell me more", 0.9),
            Trigger.of("curious", 0.8),
            Trigger.of("interesting", 0.7),
            Trigger.of("makes sense", 0.7),
            Trigger.of("i see", 0.6),
            Trigger.of("got it", 0.6),
            Trigger.of("let's try", 0.6),
            Trigger.of("what about", 0.5),
            Trigger.of("thank you", 0.5),
            Trigger.of("thanks", 0.5)));
    return map;
  }

  private static List<Trigger> sorted(Trigger... triggers) {
    return Arrays.stream(triggers)
        .sorted(Comparator.comparingInt(Trigger::length).reversed())
        .toList();
  }
}
