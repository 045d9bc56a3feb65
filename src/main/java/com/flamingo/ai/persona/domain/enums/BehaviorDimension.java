package com.flamingo.ai.persona.domain.enums;

/** Named, bounded personality traits that make up a behavior vector. */
public enum BehaviorDimension {
  PATIENCE("patience", 0.0, 1.0),
  FORMALITY("formality", 0.0, 1.0),
  ENTHUSIASM("enthusiasm", 0.0, 1.0),
  HUMOR("humor", 0.0, 1.0),
  EXPERTISE_CONFIDENCE("expertise confidence", 0.0, 1.0),
  VERBOSITY("verbosity", 0.0, 1.0);

  private final String displayName;
  private final double min;
  private final double max;

  BehaviorDimension(String displayName, double min, double max) {
    this.displayName = displayName;
    this.min = min;
    this.max = max;
  }

  public String displayName() {
    return displayName;
  }

  public double min() {
    return min;
  }

  public double max() {
    return max;
  }

  public double clamp(double value) {
    return Math.max(min, Math.min(max, value));
  }

  public boolean contains(double value) {
    return value >= min && value <= max;
  }
}
