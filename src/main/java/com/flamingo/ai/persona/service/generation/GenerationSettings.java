package com.flamingo.ai.persona.service.generation;

import com.flamingo.ai.persona.config.PersonaConfig;
import com.flamingo.ai.persona.domain.model.BehaviorVector;

/** Sampling settings derived from the effective behavior of a turn. */
public record GenerationSettings(double temperature, int maxOutputTokens) {

  /**
   * Humor and informality raise the temperature; verbosity scales the output limit between the
   * configured minimum and maximum.
   */
  public static GenerationSettings from(BehaviorVector behavior, PersonaConfig.Generation config) {
    double temperature =
        config.getBaseTemperature()
            + behavior.humor() * config.getHumorTemperatureBoost()
            + (1.0 - behavior.formality()) * config.getInformalityTemperatureBoost();
    int span = config.getMaxOutputTokens() - config.getMinOutputTokens();
    int maxOutputTokens =
        config.getMinOutputTokens() + (int) Math.round(span * behavior.verbosity());
    return new GenerationSettings(Math.min(1.0, temperature), maxOutputTokens);
  }
}
