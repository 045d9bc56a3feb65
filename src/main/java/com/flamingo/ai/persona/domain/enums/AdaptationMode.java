package com.flamingo.ai.persona.domain.enums;

/** Coarse teaching stance derived from the emotion driving the current adaptation. */
public enum AdaptationMode {
  SUPPORTIVE,
  CHALLENGING,
  BALANCED;

  public static AdaptationMode forEmotion(EmotionalCategory emotion) {
    return switch (emotion) {
      case FRUSTRATED, CONFUSED, OVERWHELMED -> SUPPORTIVE;
      case EXCITED, BORED -> CHALLENGING;
      default -> BALANCED;
    };
  }
}
