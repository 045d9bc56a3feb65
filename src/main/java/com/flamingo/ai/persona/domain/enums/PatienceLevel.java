package com.flamingo.ai.persona.domain.enums;

/** Ordinal patience scale used when authoring a character, mapped onto the numeric dimension. */
public enum PatienceLevel {
  LOW(0.25),
  MODERATE(0.5),
  HIGH(0.75),
  VERY_HIGH(1.0);

  private final double value;

  PatienceLevel(double value) {
    this.value = value;
  }

  public double value() {
    return value;
  }

  /** Closest ordinal level for a numeric patience value. */
  public static PatienceLevel nearest(double patience) {
    PatienceLevel best = LOW;
    for (PatienceLevel level : values()) {
      if (Math.abs(level.value - patience) < Math.abs(best.value - patience)) {
        best = level;
      }
    }
    return best;
  }
}
