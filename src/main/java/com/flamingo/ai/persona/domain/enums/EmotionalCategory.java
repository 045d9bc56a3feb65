package com.flamingo.ai.persona.domain.enums;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Emotional categories the detector can assign to a user message.
 *
 * <p>The priority decides ties between equally scored categories: failure states win over milder
 * positive signals, neutral always loses.
 */
public enum EmotionalCategory {
  NEUTRAL(6),
  FRUSTRATED(0),
  EXCITED(4),
  CONFUSED(2),
  BORED(3),
  ENGAGED(5),
  OVERWHELMED(1);

  private static final List<EmotionalCategory> BY_PRIORITY =
      Arrays.stream(values()).sorted(Comparator.comparingInt(EmotionalCategory::priority)).toList();

  private final int priority;

  EmotionalCategory(int priority) {
    this.priority = priority;
  }

  /** Lower value wins a tie. */
  public int priority() {
    return priority;
  }

  public boolean isNeutral() {
    return this == NEUTRAL;
  }

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** All categories ordered from highest to lowest tie-break priority. */
  public static List<EmotionalCategory> byPriority() {
    return BY_PRIORITY;
  }
}
