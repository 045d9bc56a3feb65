package com.flamingo.ai.persona.service.generation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.flamingo.ai.persona.config.PersonaConfig;
import com.flamingo.ai.persona.domain.enums.AdaptationMode;
import com.flamingo.ai.persona.domain.enums.EmotionalCategory;
import com.flamingo.ai.persona.domain.enums.MemoryCategory;
import com.flamingo.ai.persona.domain.enums.TurnRole;
import com.flamingo.ai.persona.domain.model.BehaviorVector;
import com.flamingo.ai.persona.exception.GenerationException;
import com.flamingo.ai.persona.service.context.ContextBundle;
import com.flamingo.ai.persona.service.context.ContextRenderer;
import com.flamingo.ai.persona.service.context.KnowledgeItem;
import com.flamingo.ai.persona.service.context.SystemLayer;
import com.flamingo.ai.persona.service.session.SessionTurn;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class LlmGenerationServiceTest {

  @Mock private ChatModel chatModel;

  private PersonaConfig personaConfig;
  private SimpleMeterRegistry meterRegistry;
  private LlmGenerationService generationService;

  @BeforeEach
  void setUp() {
    personaConfig = new PersonaConfig();
    meterRegistry = new SimpleMeterRegistry();
    generationService =
        new LlmGenerationService(
            chatModel, new ContextRenderer(personaConfig), personaConfig, meterRegistry);
  }

  private ContextBundle bundle(BehaviorVector behavior) {
    SystemLayer system =
        new SystemLayer(
            "mase",
            "Mäse",
            "You are Mäse.",
            behavior,
            EmotionalCategory.NEUTRAL,
            AdaptationMode.BALANCED);
    List<SessionTurn> session =
        List.of(
            new SessionTurn(TurnRole.USER, "moi", LocalDateTime.of(2026, 3, 1, 9, 0)),
            new SessionTurn(TurnRole.ASSISTANT, "moi moi!", LocalDateTime.of(2026, 3, 1, 9, 1)));
    return new ContextBundle(
        system, session, List.of(), "What should I learn next?", 50, 3000, 0, 0);
  }

  private static ChatResponse reply(String text) {
    return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
  }

  @Nested
  @DisplayName("request building")
  class RequestBuilding {

    @Test
    @DisplayName("should derive sampling settings from the effective behavior")
    void shouldDeriveSettings() {
      BehaviorVector behavior = new BehaviorVector(0.5, 0.2, 0.6, 0.7, 0.7, 0.25);

      ChatRequest request = generationService.buildRequest(bundle(behavior));

      assertThat(request.parameters().temperature())
          .isCloseTo(0.7 + 0.7 * 0.2 + 0.8 * 0.1, within(1e-9));
      assertThat(request.parameters().maxOutputTokens()).isEqualTo(175);
    }

    @Test
    @DisplayName("should cap the temperature at one")
    void shouldCapTemperature() {
      personaConfig.getGeneration().setBaseTemperature(0.9);
      GenerationSettings settings =
          GenerationSettings.from(
              new BehaviorVector(0.5, 0.0, 0.5, 1.0, 0.5, 1.0), personaConfig.getGeneration());

      assertThat(settings.temperature()).isEqualTo(1.0);
      assertThat(settings.maxOutputTokens()).isEqualTo(400);
    }

    @Test
    @DisplayName("should send persona, history and the user message in order")
    void shouldOrderMessages() {
      ChatRequest request =
          generationService.buildRequest(bundle(new BehaviorVector(0.5, 0.5, 0.5, 0.5, 0.5, 0.5)));

      assertThat(request.messages()).hasSize(4);
      assertThat(request.messages().get(0)).isInstanceOf(SystemMessage.class);
      assertThat(request.messages().get(1)).isEqualTo(UserMessage.from("moi"));
      assertThat(request.messages().get(2)).isEqualTo(AiMessage.from("moi moi!"));
      assertThat(request.messages().get(3))
          .isEqualTo(UserMessage.from("What should I learn next?"));
    }

    @Test
    @DisplayName("should send history before remembered knowledge")
    void shouldSendSessionBeforeKnowledge() {
      ContextBundle base = bundle(new BehaviorVector(0.5, 0.5, 0.5, 0.5, 0.5, 0.5));
      KnowledgeItem goal =
          new KnowledgeItem(UUID.randomUUID(), MemoryCategory.GOAL, "wants to pass YKI", 0.9);
      ContextBundle bundle =
          new ContextBundle(
              base.system(), base.session(), List.of(goal), base.userMessage(), 60, 3000, 0, 0);

      List<ChatMessage> messages = generationService.buildRequest(bundle).messages();

      assertThat(messages).hasSize(5);
      assertThat(messages.get(0)).isInstanceOf(SystemMessage.class);
      assertThat(messages.get(1)).isEqualTo(UserMessage.from("moi"));
      assertThat(messages.get(2)).isEqualTo(AiMessage.from("moi moi!"));
      assertThat(messages.get(3)).isInstanceOf(SystemMessage.class);
      assertThat(((SystemMessage) messages.get(3)).text())
          .startsWith("WHAT YOU REMEMBER ABOUT THE USER:")
          .contains("- [goal] wants to pass YKI");
      assertThat(messages.get(4)).isEqualTo(UserMessage.from("What should I learn next?"));
    }

    @Test
    @DisplayName("the same bundle should build the same request")
    void shouldBeRepeatable() {
      ContextBundle bundle = bundle(new BehaviorVector(0.5, 0.5, 0.5, 0.5, 0.5, 0.5));

      ChatRequest first = generationService.buildRequest(bundle);
      ChatRequest second = generationService.buildRequest(bundle);

      assertThat(second.messages()).isEqualTo(first.messages());
      assertThat(second.parameters().temperature()).isEqualTo(first.parameters().temperature());
      assertThat(second.parameters().maxOutputTokens())
          .isEqualTo(first.parameters().maxOutputTokens());
    }
  }

  @Nested
  @DisplayName("generate")
  class Generate {

    @Test
    @DisplayName("should return the trimmed reply text")
    void shouldReturnReply() {
      when(chatModel.chat(any(ChatRequest.class))).thenReturn(reply("  Hei! Let's practise.  "));

      String text = generationService.generate(bundle(BehaviorVector.ZERO));

      assertThat(text).isEqualTo("Hei! Let's practise.");
    }

    @Test
    @DisplayName("should map a transient model error to a retryable failure")
    void shouldMapTransientError() {
      when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RetriableException("429"));

      assertThatThrownBy(() -> generationService.generate(bundle(BehaviorVector.ZERO)))
          .isInstanceOfSatisfying(
              GenerationException.class, e -> assertThat(e.isRetryable()).isTrue());
      assertThat(meterRegistry.counter("generation.errors", "type", "transient").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should map a rejected request to a permanent failure")
    void shouldMapPermanentError() {
      when(chatModel.chat(any(ChatRequest.class))).thenThrow(new NonRetriableException("401"));

      assertThatThrownBy(() -> generationService.generate(bundle(BehaviorVector.ZERO)))
          .isInstanceOfSatisfying(
              GenerationException.class, e -> assertThat(e.isRetryable()).isFalse());
      assertThat(meterRegistry.counter("generation.errors", "type", "permanent").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should treat an unknown runtime error as transient")
    void shouldTreatUnknownAsTransient() {
      when(chatModel.chat(any(ChatRequest.class))).thenThrow(new IllegalStateException("socket"));

      assertThatThrownBy(() -> generationService.generate(bundle(BehaviorVector.ZERO)))
          .isInstanceOfSatisfying(
              GenerationException.class, e -> assertThat(e.isRetryable()).isTrue());
    }

    @Test
    @DisplayName("should reject an empty reply as permanent")
    void shouldRejectEmptyReply() {
      when(chatModel.chat(any(ChatRequest.class))).thenReturn(reply("   "));

      assertThatThrownBy(() -> generationService.generate(bundle(BehaviorVector.ZERO)))
          .isInstanceOfSatisfying(
              GenerationException.class, e -> assertThat(e.isRetryable()).isFalse());
    }
  }
}
