package com.flamingo.ai.persona.service.generation;

import com.flamingo.ai.persona.config.PersonaConfig;
import com.flamingo.ai.persona.exception.GenerationException;
import com.flamingo.ai.persona.service.context.ContextBundle;
import com.flamingo.ai.persona.service.context.ContextRenderer;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Generation through the LangChain4j chat model, guarded by a circuit breaker. No retries. */
@Service
@RequiredArgsConstructor
@Slf4j
public class LlmGenerationService implements GenerationService {

  private final ChatModel chatModel;
  private final ContextRenderer contextRenderer;
  private final PersonaConfig personaConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "generation.call", description = "Time to generate a character reply")
  @CircuitBreaker(name = "generation", fallbackMethod = "generateFallback")
  public String generate(ContextBundle bundle) {
    ChatRequest request = buildRequest(bundle);
    ChatResponse response;
    try {
      response = chatModel.chat(request);
    } catch (RetriableException e) {
      throw failure("Generation failed with a transient error", e, true);
    } catch (NonRetriableException e) {
      throw failure("Generation was rejected by the model", e, false);
    } catch (RuntimeException e) {
      throw failure("Generation failed unexpectedly", e, true);
    }

    String text =
        response == null || response.aiMessage() == null ? null : response.aiMessage().text();
    if (text == null || text.isBlank()) {
      throw failure("Model returned an empty reply", null, false);
    }
    return text.trim();
  }

  /** Same input, same request: the basis for safe caller retries. */
  ChatRequest buildRequest(ContextBundle bundle) {
    GenerationSettings settings =
        GenerationSettings.from(bundle.system().effectiveBehavior(), personaConfig.getGeneration());
    log.debug(
        "Generating for {} with temperature {} and max {} tokens",
        bundle.system().characterId(),
        settings.temperature(),
        settings.maxOutputTokens());
    return ChatRequest.builder()
        .messages(contextRenderer.toMessages(bundle))
        .parameters(
            ChatRequestParameters.builder()
                .temperature(settings.temperature())
                .maxOutputTokens(settings.maxOutputTokens())
                .build())
        .build();
  }

  @SuppressWarnings("unused")
  private String generateFallback(ContextBundle bundle, Throwable t) {
    if (t instanceof GenerationException generationException) {
      throw generationException;
    }
    if (t instanceof CallNotPermittedException) {
      log.warn("Generation circuit is open, rejecting call for {}", bundle.system().characterId());
      meterRegistry.counter("generation.errors", "type", "circuit_open").increment();
      throw new GenerationException("Generation circuit breaker is open", t, true);
    }
    throw failure("Generation failed unexpectedly", t, true);
  }

  private GenerationException failure(String message, Throwable cause, boolean retryable) {
    log.error("{} (retryable={}): {}", message, retryable, cause != null ? cause.getMessage() : "");
    meterRegistry
        .counter("generation.errors", "type", retryable ? "transient" : "permanent")
        .increment();
    return new GenerationException(message, cause, retryable);
  }
}
