package com.flamingo.ai.persona.service.context;

import com.flamingo.ai.persona.config.PersonaConfig;
import com.flamingo.ai.persona.domain.entity.CharacterProfile;
import com.flamingo.ai.persona.domain.model.PairKey;
import com.flamingo.ai.persona.service.adaptation.AdaptationSnapshot;
import com.flamingo.ai.persona.service.adaptation.BehaviorAdapter;
import com.flamingo.ai.persona.service.character.CharacterProfileService;
import com.flamingo.ai.persona.service.lock.PairLockRegistry;
import com.flamingo.ai.persona.service.memory.MemoryService;
import com.flamingo.ai.persona.service.session.SessionHistoryService;
import com.flamingo.ai.persona.service.session.SessionTurn;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Default context assembler. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextAssemblerImpl implements ContextAssembler {

  private final CharacterProfileService characterProfileService;
  private final BehaviorAdapter behaviorAdapter;
  private final SessionHistoryService sessionHistoryService;
  private final MemoryService memoryService;
  private final ContextRenderer contextRenderer;
  private final PairLockRegistry pairLockRegistry;
  private final PersonaConfig personaConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "context.build", description = "Time to build a turn context")
  public ContextBundle buildContext(String characterId, String userId, String message) {
    CharacterProfile profile = characterProfileService.getProfile(characterId);
    AdaptationSnapshot adaptation = behaviorAdapter.currentState(characterId, userId);

    SystemLayer system =
        new SystemLayer(
            profile.getId(),
            profile.getName(),
            contextRenderer.renderSystem(profile, adaptation),
            adaptation.effective(),
            adaptation.activeEmotion(),
            adaptation.mode());

    List<SessionTurn> session =
        sessionHistoryService.recentTurns(
            characterId, userId, personaConfig.getContext().getSessionWindow());

    List<KnowledgeItem> knowledge = new ArrayList<>();
    if (personaConfig.getMemory().isEnabled()) {
      memoryService
          .rank(characterId, userId, message, personaConfig.getMemory().getContextLimit())
          .forEach(scored -> knowledge.add(KnowledgeItem.from(scored)));
    }

    ContextBundle bundle = assemble(system, session, knowledge, message);
    if (!bundle.knowledge().isEmpty()) {
      pairLockRegistry.runWithLock(
          new PairKey(characterId, userId),
          () -> memoryService.markAccessed(bundle.knowledgeMemoryIds()));
    }
    return bundle;
  }

  @Override
  public ContextBundle assemble(
      SystemLayer system,
      List<SessionTurn> session,
      List<KnowledgeItem> knowledge,
      String userMessage) {
    PersonaConfig.Context settings = personaConfig.getContext();
    int budget = settings.getTokenBudget();

    List<SessionTurn> keptSession = new ArrayList<>(session);
    int droppedSession = 0;
    while (keptSession.size() > settings.getSessionWindow()) {
      keptSession.remove(0);
      droppedSession++;
    }

    List<KnowledgeItem> keptKnowledge = new ArrayList<>(knowledge);
    keptKnowledge.sort(Comparator.comparingDouble(KnowledgeItem::score).reversed());
    int droppedKnowledge = 0;

    int total = contextRenderer.estimate(system, keptSession, keptKnowledge, userMessage);
    while (total > budget && !keptSession.isEmpty()) {
      keptSession.remove(0);
      droppedSession++;
      total = contextRenderer.estimate(system, keptSession, keptKnowledge, userMessage);
    }
    while (total > budget && !keptKnowledge.isEmpty()) {
      keptKnowledge.remove(keptKnowledge.size() - 1);
      droppedKnowledge++;
      total = contextRenderer.estimate(system, keptSession, keptKnowledge, userMessage);
    }

    if (droppedSession > 0) {
      meterRegistry.counter("context.session.trimmed").increment(droppedSession);
    }
    if (droppedKnowledge > 0) {
      meterRegistry.counter("context.knowledge.trimmed").increment(droppedKnowledge);
    }
    if (total > budget) {
      log.debug(
          "Context for {} still over budget ({} > {}) with only system and user layers",
          system.characterId(),
          total,
          budget);
    }
    log.debug(
        "Assembled context: {} session turns (-{}), {} memories (-{}), ~{} tokens",
        keptSession.size(),
        droppedSession,
        keptKnowledge.size(),
        droppedKnowledge,
        total);

    return new ContextBundle(
        system,
        keptSession,
        keptKnowledge,
        userMessage,
        total,
        budget,
        droppedSession,
        droppedKnowledge);
  }
}
