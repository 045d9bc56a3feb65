package com.flamingo.ai.persona.service.chat;

import com.flamingo.ai.persona.config.PersonaConfig;
import com.flamingo.ai.persona.domain.model.BehaviorVector;
import com.flamingo.ai.persona.domain.model.EmotionalState;
import com.flamingo.ai.persona.domain.model.PairKey;
import com.flamingo.ai.persona.service.adaptation.BehaviorAdapter;
import com.flamingo.ai.persona.service.character.CharacterProfileService;
import com.flamingo.ai.persona.service.context.ContextAssembler;
import com.flamingo.ai.persona.service.context.ContextBundle;
import com.flamingo.ai.persona.service.emotion.EmotionDetector;
import com.flamingo.ai.persona.service.generation.GenerationService;
import com.flamingo.ai.persona.service.lock.PairLockRegistry;
import com.flamingo.ai.persona.service.memory.MemoryService;
import com.flamingo.ai.persona.service.session.SessionHistoryService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/** Turn orchestration under the per-pair lock. */
@Service
@Slf4j
public class PersonaChatServiceImpl implements PersonaChatService {

  private final CharacterProfileService characterProfileService;
  private final EmotionDetector emotionDetector;
  private final BehaviorAdapter behaviorAdapter;
  private final ContextAssembler contextAssembler;
  private final GenerationService generationService;
  private final SessionHistoryService sessionHistoryService;
  private final MemoryService memoryService;
  private final PairLockRegistry pairLockRegistry;
  private final PersonaConfig personaConfig;
  private final MeterRegistry meterRegistry;
  private final Executor turnExecutor;

  public PersonaChatServiceImpl(
      CharacterProfileService characterProfileService,
      EmotionDetector emotionDetector,
      BehaviorAdapter behaviorAdapter,
      ContextAssembler contextAssembler,
      GenerationService generationService,
      SessionHistoryService sessionHistoryService,
      MemoryService memoryService,
      PairLockRegistry pairLockRegistry,
      PersonaConfig personaConfig,
      MeterRegistry meterRegistry,
      @Qualifier("turnExecutor") Executor turnExecutor) {
    this.characterProfileService = characterProfileService;
    this.emotionDetector = emotionDetector;
    this.behaviorAdapter = behaviorAdapter;
    this.contextAssembler = contextAssembler;
    this.generationService = generationService;
    this.sessionHistoryService = sessionHistoryService;
    this.memoryService = memoryService;
    this.pairLockRegistry = pairLockRegistry;
    this.personaConfig = personaConfig;
    this.meterRegistry = meterRegistry;
    this.turnExecutor = turnExecutor;
  }

  @Override
  @Timed(value = "chat.turn", description = "Time to complete a conversational turn")
  public ChatReply chat(String characterId, String userId, String message) {
    return runTurn(new PairKey(characterId, userId), message, () -> false);
  }

  @Override
  public CompletableFuture<ChatReply> chatAsync(
      String characterId, String userId, String message) {
    CompletableFuture<ChatReply> future = new CompletableFuture<>();
    PairKey pair = new PairKey(characterId, userId);
    turnExecutor.execute(
        () -> {
          try {
            future.complete(runTurn(pair, message, future::isCancelled));
          } catch (RuntimeException e) {
            future.completeExceptionally(e);
          }
        });
    return future;
  }

  ChatReply runTurn(PairKey pair, String message, BooleanSupplier cancelled) {
    String characterId = pair.characterId();
    String userId = pair.userId();
    characterProfileService.getProfile(characterId);

    return pairLockRegistry.withLock(
        pair,
        () -> {
          List<String> history =
              sessionHistoryService.recentUserMessages(
                  characterId, userId, personaConfig.getEmotion().getHistoryWindow());
          EmotionalState state = emotionDetector.detect(message, history);
          meterRegistry
              .counter("emotion.detected", "emotion", state.emotion().label())
              .increment();

          // Committed even if the turn is cancelled later.
          BehaviorVector effective = behaviorAdapter.adapt(characterId, userId, state);

          if (cancelled.getAsBoolean()) {
            throw cancelledTurn(pair);
          }
          ContextBundle bundle = contextAssembler.buildContext(characterId, userId, message);
          String reply = generationService.generate(bundle);

          if (cancelled.getAsBoolean()) {
            throw cancelledTurn(pair);
          }

          try {
            sessionHistoryService.recordExchange(
                characterId, userId, message, state.emotion(), reply);
          } catch (DataAccessException e) {
            log.warn("Failed to record exchange for {}: {}", pair, e.getMessage());
            meterRegistry.counter("session.history.errors").increment();
          }
          memoryService.extractAndRecordAsync(characterId, userId, message, reply, state);

          meterRegistry.counter("chat.turns.completed").increment();
          log.info(
              "Completed turn for {}: emotion={} ({}), {} memories, ~{} tokens",
              pair,
              state.emotion().label(),
              String.format("%.2f", state.confidence()),
              bundle.knowledge().size(),
              bundle.estimatedTokens());

          return new ChatReply(
              characterId,
              userId,
              reply,
              state,
              effective,
              bundle.system().mode(),
              bundle.knowledge().size(),
              bundle.session().size(),
              bundle.estimatedTokens());
        });
  }

  private CancellationException cancelledTurn(PairKey pair) {
    meterRegistry.counter("chat.turns.cancelled").increment();
    log.info("Turn for {} cancelled, skipping history and memory writes", pair);
    return new CancellationException("Turn cancelled for " + pair);
  }
}
