package com.flamingo.ai.persona.config;

import com.flamingo.ai.persona.domain.enums.BehaviorDimension;
import com.flamingo.ai.persona.domain.enums.EmotionalCategory;
import com.flamingo.ai.persona.domain.enums.MemoryCategory;
import com.flamingo.ai.persona.domain.model.BehaviorVector;
import java.util.EnumMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Tuning knobs for emotion detection, adaptation, memory and context assembly. */
@Configuration
@ConfigurationProperties(prefix = "persona")
@Getter
@Setter
public class PersonaConfig {

  private Emotion emotion = new Emotion();
  private Adaptation adaptation = new Adaptation();
  private Memory memory = new Memory();
  private Context context = new Context();
  private Generation generation = new Generation();

  @Getter
  @Setter
  public static class Emotion {
    /** Minimum aggregate score a category needs to win; below it the message is neutral. */
    private double minScore = 0.6;

    /** Aggregate score that maps to confidence 1.0. */
    private double saturationScore = 1.5;

    /** Number of tokens before a trigger term that are checked for negators. */
    private int negationWindow = 3;

    private double intensifierMultiplier = 1.5;

    /** Recent user messages consulted to reinforce categories already present. */
    private int historyWindow = 3;

    private double historyWeight = 0.3;
  }

  @Getter
  @Setter
  public static class Adaptation {
    /** Multiplier applied to the delta vector on every neutral turn. */
    private double decayFactor = 0.7;

    /** Deltas smaller than this in every dimension snap back to baseline. */
    private double resetEpsilon = 0.005;

    private Map<EmotionalCategory, Map<BehaviorDimension, Double>> deltas = defaultDeltas();

    /** Delta vector for an emotion; zero for neutral or unmapped emotions. */
    public BehaviorVector deltaFor(EmotionalCategory emotion) {
      Map<BehaviorDimension, Double> delta = deltas.get(emotion);
      return delta == null ? BehaviorVector.ZERO : BehaviorVector.of(delta);
    }

    private static Map<EmotionalCategory, Map<BehaviorDimension, Double>> defaultDeltas() {
      Map<EmotionalCategory, Map<BehaviorDimension, Double>> table =
          new EnumMap<>(EmotionalCategory.class);
      table.put(
          EmotionalCategory.FRUSTRATED,
          delta(
              BehaviorDimension.PATIENCE, 0.30,
              BehaviorDimension.FORMALITY, -0.10,
              BehaviorDimension.VERBOSITY, -0.10));
      table.put(
          EmotionalCategory.OVERWHELMED,
          delta(
              BehaviorDimension.PATIENCE, 0.40,
              BehaviorDimension.VERBOSITY, -0.20,
              BehaviorDimension.ENTHUSIASM, -0.10));
      table.put(
          EmotionalCategory.CONFUSED,
          delta(
              BehaviorDimension.PATIENCE, 0.20,
              BehaviorDimension.VERBOSITY, 0.25,
              BehaviorDimension.EXPERTISE_CONFIDENCE, -0.05));
      table.put(
          EmotionalCategory.BORED,
          delta(
              BehaviorDimension.HUMOR, 0.25,
              BehaviorDimension.ENTHUSIASM, 0.20,
              BehaviorDimension.VERBOSITY, -0.10));
      table.put(
          EmotionalCategory.EXCITED,
          delta(
              BehaviorDimension.ENTHUSIASM, 0.20,
              BehaviorDimension.VERBOSITY, 0.15,
              BehaviorDimension.EXPERTISE_CONFIDENCE, 0.05));
      table.put(
          EmotionalCategory.ENGAGED,
          delta(
              BehaviorDimension.ENTHUSIASM, 0.05,
              BehaviorDimension.EXPERTISE_CONFIDENCE, 0.05,
              BehaviorDimension.VERBOSITY, 0.05));
      return table;
    }

    private static Map<BehaviorDimension, Double> delta(
        BehaviorDimension d1,
        double v1,
        BehaviorDimension d2,
        double v2,
        BehaviorDimension d3,
        double v3) {
      Map<BehaviorDimension, Double> delta = new EnumMap<>(BehaviorDimension.class);
      delta.put(d1, v1);
      delta.put(d2, v2);
      delta.put(d3, v3);
      return delta;
    }
  }

  @Getter
  @Setter
  public static class Memory {
    private boolean enabled = true;

    /** Capacity per character/user pair; lowest composite scores are evicted first. */
    private int maxPerPair = 50;

    /** Number of memories placed in the knowledge layer (K). */
    private int contextLimit = 5;

    private Map<MemoryCategory, Double> categoryWeights = defaultCategoryWeights();

    /** Added at full confidence when the memory was recorded under a non-neutral emotion. */
    private double emotionalBoost = 0.15;

    /** Per keyword adjustment for high-value words (up) and hedges (down). */
    private double keywordBoost = 0.05;

    /** Similarity at or above which a new memory is merged into the existing one. */
    private double mergeSimilarity = 0.8;

    /** Similarity at or above which a new memory is down-weighted as a near duplicate. */
    private double noveltySimilarity = 0.5;

    /** Importance bump given to an existing memory that absorbs a duplicate or is promoted. */
    private double promotionStep = 0.1;

    /** Extra importance for a memory of a correction made in the character's reply. */
    private double correctionBoost = 0.3;

    /** Extra importance for a memory of the user showing they understood the reply. */
    private double understandingBoost = 0.3;

    private double recencyHalfLifeHours = 72.0;
    private double importanceWeight = 0.7;
    private double recencyWeight = 0.3;
    private double topicBoost = 0.1;
    private int maxContentLength = 200;

    public double categoryWeight(MemoryCategory category) {
      return categoryWeights.getOrDefault(category, 0.5);
    }

    private static Map<MemoryCategory, Double> defaultCategoryWeights() {
      Map<MemoryCategory, Double> weights = new EnumMap<>(MemoryCategory.class);
      weights.put(MemoryCategory.GOAL, 0.8);
      weights.put(MemoryCategory.PREFERENCE, 0.7);
      weights.put(MemoryCategory.FACT, 0.5);
      weights.put(MemoryCategory.EMOTIONAL_EVENT, 0.4);
      return weights;
    }
  }

  @Getter
  @Setter
  public static class Context {
    /** Maximum number of recent turns in the session layer. */
    private int sessionWindow = 8;

    /** Overall budget for the assembled context, in estimated tokens. */
    private int tokenBudget = 3000;

    /** Session turns are cut to this many characters when rendered. */
    private int turnPreviewChars = 200;
  }

  @Getter
  @Setter
  public static class Generation {
    private double baseTemperature = 0.7;
    private double humorTemperatureBoost = 0.2;
    private double informalityTemperatureBoost = 0.1;
    private int minOutputTokens = 100;
    private int maxOutputTokens = 400;
  }
}
