package com.flamingo.ai.persona.service.chat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.persona.config.PersonaConfig;
import com.flamingo.ai.persona.domain.entity.CharacterProfile;
import com.flamingo.ai.persona.domain.enums.AdaptationMode;
import com.flamingo.ai.persona.domain.enums.EmotionalCategory;
import com.flamingo.ai.persona.domain.model.BehaviorVector;
import com.flamingo.ai.persona.domain.model.EmotionalState;
import com.flamingo.ai.persona.domain.model.PairKey;
import com.flamingo.ai.persona.exception.CharacterNotFoundException;
import com.flamingo.ai.persona.exception.GenerationException;
import com.flamingo.ai.persona.service.adaptation.BehaviorAdapter;
import com.flamingo.ai.persona.service.character.CharacterProfileService;
import com.flamingo.ai.persona.service.context.ContextAssembler;
import com.flamingo.ai.persona.service.context.ContextBundle;
import com.flamingo.ai.persona.service.context.SystemLayer;
import com.flamingo.ai.persona.service.emotion.EmotionDetector;
import com.flamingo.ai.persona.service.generation.GenerationService;
import com.flamingo.ai.persona.service.lock.PairLockRegistry;
import com.flamingo.ai.persona.service.memory.MemoryService;
import com.flamingo.ai.persona.service.session.SessionHistoryService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class PersonaChatServiceImplTest {

  private static final String CHARACTER_ID = "anna";
  private static final String USER_ID = "user-1";
  private static final String MESSAGE = "I'm so frustrated with this!";
  private static final String REPLY = "Let's slow down and take it step by step.";
  private static final EmotionalState FRUSTRATED =
      EmotionalState.of(EmotionalCategory.FRUSTRATED, 1.0);
  private static final BehaviorVector EFFECTIVE =
      new BehaviorVector(1.0, 0.6, 0.8, 0.3, 0.9, 0.65);

  @Mock private CharacterProfileService characterProfileService;
  @Mock private EmotionDetector emotionDetector;
  @Mock private BehaviorAdapter behaviorAdapter;
  @Mock private ContextAssembler contextAssembler;
  @Mock private GenerationService generationService;
  @Mock private SessionHistoryService sessionHistoryService;
  @Mock private MemoryService memoryService;

  private SimpleMeterRegistry meterRegistry;
  private PersonaChatServiceImpl chatService;
  private ContextBundle bundle;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    chatService =
        new PersonaChatServiceImpl(
            characterProfileService,
            emotionDetector,
            behaviorAdapter,
            contextAssembler,
            generationService,
            sessionHistoryService,
            memoryService,
            new PairLockRegistry(),
            new PersonaConfig(),
            meterRegistry,
            Runnable::run);

    bundle =
        new ContextBundle(
            new SystemLayer(
                CHARACTER_ID,
                "Anna",
                "You are Anna.",
                EFFECTIVE,
                EmotionalCategory.FRUSTRATED,
                AdaptationMode.SUPPORTIVE),
            List.of(),
            List.of(),
            MESSAGE,
            120,
            3000,
            0,
            0);

    when(characterProfileService.getProfile(CHARACTER_ID))
        .thenReturn(CharacterProfile.builder().id(CHARACTER_ID).name("Anna").build());
    when(sessionHistoryService.recentUserMessages(eq(CHARACTER_ID), eq(USER_ID), anyInt()))
        .thenReturn(List.of("this verb table again"));
    when(emotionDetector.detect(eq(MESSAGE), anyList())).thenReturn(FRUSTRATED);
    when(behaviorAdapter.adapt(CHARACTER_ID, USER_ID, FRUSTRATED)).thenReturn(EFFECTIVE);
    when(contextAssembler.buildContext(CHARACTER_ID, USER_ID, MESSAGE)).thenReturn(bundle);
    when(generationService.generate(bundle)).thenReturn(REPLY);
    when(memoryService.extractAndRecordAsync(
            anyString(), anyString(), anyString(), anyString(), any()))
        .thenReturn(CompletableFuture.completedFuture(null));
  }

  @Nested
  @DisplayName("chat")
  class Chat {

    @Test
    @DisplayName("should detect, adapt, build context, generate, then remember, in order")
    void shouldRunTurnInOrder() {
      ChatReply reply = chatService.chat(CHARACTER_ID, USER_ID, MESSAGE);

      InOrder order =
          inOrder(
              emotionDetector,
              behaviorAdapter,
              contextAssembler,
              generationService,
              sessionHistoryService,
              memoryService);
      order.verify(emotionDetector).detect(MESSAGE, List.of("this verb table again"));
      order.verify(behaviorAdapter).adapt(CHARACTER_ID, USER_ID, FRUSTRATED);
      order.verify(contextAssembler).buildContext(CHARACTER_ID, USER_ID, MESSAGE);
      order.verify(generationService).generate(bundle);
      order
          .verify(sessionHistoryService)
          .recordExchange(
              CHARACTER_ID,
              USER_ID,
              MESSAGE,
              EmotionalCategory.FRUSTRATED,
              REPLY);
      order
          .verify(memoryService)
          .extractAndRecordAsync(CHARACTER_ID, USER_ID, MESSAGE, REPLY, FRUSTRATED);

      assertThat(reply.reply()).isEqualTo(REPLY);
      assertThat(reply.emotion()).isEqualTo(FRUSTRATED);
      assertThat(reply.effectiveBehavior()).isEqualTo(EFFECTIVE);
      assertThat(reply.mode()).isEqualTo(AdaptationMode.SUPPORTIVE);
      assertThat(reply.estimatedTokens()).isEqualTo(120);
      assertThat(meterRegistry.counter("emotion.detected", "emotion", "frustrated").count())
          .isEqualTo(1.0);
      assertThat(meterRegistry.counter("chat.turns.completed").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should hand the generated reply to memory extraction")
    void shouldFeedReplyIntoMemory() {
      String correction = "Actually, the partitive is used after numbers.";
      when(generationService.generate(bundle)).thenReturn(correction);

      chatService.chat(CHARACTER_ID, USER_ID, MESSAGE);

      verify(memoryService)
          .extractAndRecordAsync(CHARACTER_ID, USER_ID, MESSAGE, correction, FRUSTRATED);
    }

    @Test
    @DisplayName("an unknown character should fail before any detection")
    void unknownCharacterShouldFail() {
      when(characterProfileService.getProfile("ghost"))
          .thenThrow(new CharacterNotFoundException("ghost"));

      assertThatThrownBy(() -> chatService.chat("ghost", USER_ID, MESSAGE))
          .isInstanceOf(CharacterNotFoundException.class);
      verify(emotionDetector, never()).detect(anyString(), anyList());
    }

    @Test
    @DisplayName("a generation failure should keep the adaptation but write nothing else")
    void generationFailureShouldSkipWrites() {
      when(generationService.generate(bundle))
          .thenThrow(new GenerationException("Generation failed", true));

      assertThatThrownBy(() -> chatService.chat(CHARACTER_ID, USER_ID, MESSAGE))
          .isInstanceOf(GenerationException.class);
      verify(behaviorAdapter).adapt(CHARACTER_ID, USER_ID, FRUSTRATED);
      verify(sessionHistoryService, never())
          .recordExchange(anyString(), anyString(), anyString(), any(), anyString());
      verify(memoryService, never())
          .extractAndRecordAsync(anyString(), anyString(), anyString(), anyString(), any());
    }

    @Test
    @DisplayName("a history write failure should not fail the turn")
    void historyFailureShouldNotFailTurn() {
      doThrow(new DataAccessResourceFailureException("locked"))
          .when(sessionHistoryService)
          .recordExchange(anyString(), anyString(), anyString(), any(), anyString());

      ChatReply reply = chatService.chat(CHARACTER_ID, USER_ID, MESSAGE);

      assertThat(reply.reply()).isNotBlank();
      verify(memoryService)
          .extractAndRecordAsync(CHARACTER_ID, USER_ID, MESSAGE, REPLY, FRUSTRATED);
      assertThat(meterRegistry.counter("session.history.errors").count()).isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("cancellation")
  class Cancellation {

    @Test
    @DisplayName("cancelling during generation should keep the adaptation but skip later writes")
    void cancelDuringGenerationShouldSkipWrites() {
      AtomicInteger checks = new AtomicInteger();

      assertThatThrownBy(
              () ->
                  chatService.runTurn(
                      new PairKey(CHARACTER_ID, USER_ID),
                      MESSAGE,
                      () -> checks.incrementAndGet() > 1))
          .isInstanceOf(CancellationException.class);

      verify(behaviorAdapter).adapt(CHARACTER_ID, USER_ID, FRUSTRATED);
      verify(generationService).generate(bundle);
      verify(sessionHistoryService, never())
          .recordExchange(anyString(), anyString(), anyString(), any(), anyString());
      verify(memoryService, never())
          .extractAndRecordAsync(anyString(), anyString(), anyString(), anyString(), any());
      assertThat(meterRegistry.counter("chat.turns.cancelled").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("cancelling before generation should not call the model")
    void cancelBeforeGenerationShouldSkipModel() {
      assertThatThrownBy(
              () -> chatService.runTurn(new PairKey(CHARACTER_ID, USER_ID), MESSAGE, () -> true))
          .isInstanceOf(CancellationException.class);

      verify(behaviorAdapter).adapt(CHARACTER_ID, USER_ID, FRUSTRATED);
      verify(contextAssembler, never()).buildContext(anyString(), anyString(), anyString());
      verify(generationService, never()).generate(any());
    }
  }

  @Nested
  @DisplayName("chatAsync")
  class ChatAsync {

    @Test
    @DisplayName("should complete the future with the reply")
    void shouldCompleteWithReply() {
      CompletableFuture<ChatReply> future = chatService.chatAsync(CHARACTER_ID, USER_ID, MESSAGE);

      assertThat(future).isCompleted();
      assertThat(future.join().reply()).isEqualTo(REPLY);
    }

    @Test
    @DisplayName("should complete exceptionally when the turn fails")
    void shouldCompleteExceptionally() {
      when(generationService.generate(bundle))
          .thenThrow(new GenerationException("Generation failed", false));

      CompletableFuture<ChatReply> future = chatService.chatAsync(CHARACTER_ID, USER_ID, MESSAGE);

      assertThat(future).isCompletedExceptionally();
      verify(sessionHistoryService, never())
          .recordExchange(anyString(), anyString(), anyString(), any(), anyString());
    }
  }
}
