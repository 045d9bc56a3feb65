package com.flamingo.ai.persona.domain.model;

import com.flamingo.ai.persona.domain.enums.BehaviorDimension;
import java.util.EnumMap;
import java.util.Map;

/**
 * Fixed-schema vector over every {@link BehaviorDimension}.
 *
 * <p>The same type carries baselines, effective values and deltas. Baseline and effective vectors
 * must lie within each dimension's declared range ({@link #requireWithinBounds()}); deltas may be
 * negative.
 */
public record BehaviorVector(
    double patience,
    double formality,
    double enthusiasm,
    double humor,
    double expertiseConfidence,
    double verbosity) {

  public static final BehaviorVector ZERO = new BehaviorVector(0, 0, 0, 0, 0, 0);

  public BehaviorVector {
    for (double value :
        new double[] {patience, formality, enthusiasm, humor, expertiseConfidence, verbosity}) {
      if (!Double.isFinite(value)) {
        throw new IllegalArgumentException("Behavior values must be finite");
      }
    }
  }

  /** Builds a vector from a sparse map; missing dimensions are zero. */
  public static BehaviorVector of(Map<BehaviorDimension, Double> values) {
    BehaviorVector vector = ZERO;
    for (Map.Entry<BehaviorDimension, Double> entry : values.entrySet()) {
      vector = vector.with(entry.getKey(), entry.getValue());
    }
    return vector;
  }

  public double get(BehaviorDimension dimension) {
    return switch (dimension) {
      case PATIENCE -> patience;
      case FORMALITY -> formality;
      case ENTHUSIASM -> enthusiasm;
      case HUMOR -> humor;
      case EXPERTISE_CONFIDENCE -> expertiseConfidence;
      case VERBOSITY -> verbosity;
    };
  }

  public BehaviorVector with(BehaviorDimension dimension, double value) {
    return switch (dimension) {
      case PATIENCE ->
          new BehaviorVector(value, formality, enthusiasm, humor, expertiseConfidence, verbosity);
      case FORMALITY ->
          new BehaviorVector(patience, value, enthusiasm, humor, expertiseConfidence, verbosity);
      case ENTHUSIASM ->
          new BehaviorVector(patience, formality, value, humor, expertiseConfidence, verbosity);
      case HUMOR ->
          new BehaviorVector(
              patience, formality, enthusiasm, value, expertiseConfidence, verbosity);
      case EXPERTISE_CONFIDENCE ->
          new BehaviorVector(patience, formality, enthusiasm, humor, value, verbosity);
      case VERBOSITY ->
          new BehaviorVector(patience, formality, enthusiasm, humor, expertiseConfidence, value);
    };
  }

  public BehaviorVector plus(BehaviorVector other) {
    return new BehaviorVector(
        patience + other.patience,
        formality + other.formality,
        enthusiasm + other.enthusiasm,
        humor + other.humor,
        expertiseConfidence + other.expertiseConfidence,
        verbosity + other.verbosity);
  }

  public BehaviorVector scale(double factor) {
    return new BehaviorVector(
        patience * factor,
        formality * factor,
        enthusiasm * factor,
        humor * factor,
        expertiseConfidence * factor,
        verbosity * factor);
  }

  /** Clamps every component to its dimension's declared range. */
  public BehaviorVector clamp() {
    BehaviorVector clamped = this;
    for (BehaviorDimension dimension : BehaviorDimension.values()) {
      clamped = clamped.with(dimension, dimension.clamp(get(dimension)));
    }
    return clamped;
  }

  /**
   * Treats this vector as a delta and limits each component so that {@code baseline + delta}
   * stays within the dimension's range.
   */
  public BehaviorVector boundedAround(BehaviorVector baseline) {
    BehaviorVector bounded = this;
    for (BehaviorDimension dimension : BehaviorDimension.values()) {
      double base = baseline.get(dimension);
      double low = dimension.min() - base;
      double high = dimension.max() - base;
      bounded = bounded.with(dimension, Math.max(low, Math.min(high, get(dimension))));
    }
    return bounded;
  }

  /** Largest absolute component. */
  public double magnitude() {
    double max = 0.0;
    for (BehaviorDimension dimension : BehaviorDimension.values()) {
      max = Math.max(max, Math.abs(get(dimension)));
    }
    return max;
  }

  public boolean isWithinBounds() {
    for (BehaviorDimension dimension : BehaviorDimension.values()) {
      if (!dimension.contains(get(dimension))) {
        return false;
      }
    }
    return true;
  }

  public BehaviorVector requireWithinBounds() {
    for (BehaviorDimension dimension : BehaviorDimension.values()) {
      double value = get(dimension);
      if (!dimension.contains(value)) {
        throw new IllegalArgumentException(
            String.format(
                "%s must be within [%.2f, %.2f] but was %.3f",
                dimension.displayName(), dimension.min(), dimension.max(), value));
      }
    }
    return this;
  }

  public Map<BehaviorDimension, Double> asMap() {
    Map<BehaviorDimension, Double> map = new EnumMap<>(BehaviorDimension.class);
    for (BehaviorDimension dimension : BehaviorDimension.values()) {
      map.put(dimension, get(dimension));
    }
    return map;
  }
}
