package com.flamingo.ai.persona.service.adaptation;

import com.flamingo.ai.persona.config.PersonaConfig;
import com.flamingo.ai.persona.domain.entity.AdaptationState;
import com.flamingo.ai.persona.domain.entity.CharacterProfile;
import com.flamingo.ai.persona.domain.enums.AdaptationMode;
import com.flamingo.ai.persona.domain.model.BehaviorVector;
import com.flamingo.ai.persona.domain.model.EmotionalState;
import com.flamingo.ai.persona.domain.model.PairKey;
import com.flamingo.ai.persona.domain.repository.AdaptationStateRepository;
import com.flamingo.ai.persona.service.character.CharacterProfileService;
import com.flamingo.ai.persona.service.lock.PairLockRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/** Adaptation state machine persisted per character/user pair. */
@Service
@RequiredArgsConstructor
@Slf4j
public class BehaviorAdapterImpl implements BehaviorAdapter {

  private final CharacterProfileService characterProfileService;
  private final AdaptationStateRepository adaptationStateRepository;
  private final PairLockRegistry pairLockRegistry;
  private final PersonaConfig personaConfig;
  private final MeterRegistry meterRegistry;

  @Override
  public BehaviorVector adapt(String characterId, String userId, EmotionalState state) {
    CharacterProfile profile = characterProfileService.getProfile(characterId);
    BehaviorVector baseline = profile.baseline().requireWithinBounds();
    PairKey pair = new PairKey(characterId, userId);

    return pairLockRegistry.withLock(
        pair,
        () -> {
          AdaptationState adaptation = load(characterId, userId);
          PersonaConfig.Adaptation settings = personaConfig.getAdaptation();

          if (state.isNeutral()) {
            boolean wasAdapted = adaptation.isAdapted();
            adaptation.decay(settings.getDecayFactor(), settings.getResetEpsilon());
            if (wasAdapted) {
              meterRegistry.counter("adaptation.decayed").increment();
              log.debug(
                  "Decayed adaptation for {} to {} ({} neutral turns)",
                  pair,
                  adaptation.delta(),
                  adaptation.getTurnsSinceEmotion());
            }
          } else {
            adaptation.applyEmotion(state, settings.deltaFor(state.emotion()), baseline);
            meterRegistry
                .counter("adaptation.applied", "emotion", state.emotion().label())
                .increment();
            log.debug(
                "Applied {} adaptation for {}: delta={}",
                state.emotion(),
                pair,
                adaptation.delta());
          }

          try {
            adaptationStateRepository.save(adaptation);
          } catch (DataAccessException e) {
            log.warn("Failed to persist adaptation state for {}: {}", pair, e.getMessage());
            meterRegistry.counter("adaptation.write.errors").increment();
          }
          return adaptation.effective(baseline).requireWithinBounds();
        });
  }

  @Override
  public AdaptationSnapshot currentState(String characterId, String userId) {
    CharacterProfile profile = characterProfileService.getProfile(characterId);
    BehaviorVector baseline = profile.baseline();
    AdaptationState adaptation = load(characterId, userId);
    return new AdaptationSnapshot(
        characterId,
        userId,
        baseline,
        adaptation.delta(),
        adaptation.effective(baseline),
        adaptation.getActiveEmotion(),
        adaptation.getActiveConfidence(),
        adaptation.getTurnsSinceEmotion(),
        adaptation.isTopicNoveltyRequested(),
        AdaptationMode.forEmotion(adaptation.getActiveEmotion()));
  }

  private AdaptationState load(String characterId, String userId) {
    try {
      return adaptationStateRepository
          .findByCharacterIdAndUserId(characterId, userId)
          .orElseGet(() -> AdaptationState.initial(characterId, userId));
    } catch (DataAccessException e) {
      log.warn(
          "Failed to load adaptation state for {}/{}, starting from baseline: {}",
          characterId,
          userId,
          e.getMessage());
      return AdaptationState.initial(characterId, userId);
    }
  }
}
