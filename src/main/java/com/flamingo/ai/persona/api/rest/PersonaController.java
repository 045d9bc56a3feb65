package com.flamingo.ai.persona.api.rest;

import com.flamingo.ai.persona.api.dto.request.AdaptRequest;
import com.flamingo.ai.persona.api.dto.request.ChatRequest;
import com.flamingo.ai.persona.api.dto.response.BehaviorResponse;
import com.flamingo.ai.persona.api.dto.response.ChatResponse;
import com.flamingo.ai.persona.api.dto.response.ChatTurnResponse;
import com.flamingo.ai.persona.api.dto.response.ContextResponse;
import com.flamingo.ai.persona.domain.model.EmotionalState;
import com.flamingo.ai.persona.service.adaptation.BehaviorAdapter;
import com.flamingo.ai.persona.service.character.CharacterProfileService;
import com.flamingo.ai.persona.service.chat.ChatReply;
import com.flamingo.ai.persona.service.chat.PersonaChatService;
import com.flamingo.ai.persona.service.context.ContextAssembler;
import com.flamingo.ai.persona.service.context.ContextBundle;
import com.flamingo.ai.persona.service.context.ContextRenderer;
import com.flamingo.ai.persona.service.session.SessionHistoryService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for one character talking to one user. */
@RestController
@RequestMapping("/api/characters/{characterId}/users/{userId}")
@RequiredArgsConstructor
@Slf4j
public class PersonaController {

  private final BehaviorAdapter behaviorAdapter;
  private final ContextAssembler contextAssembler;
  private final ContextRenderer contextRenderer;
  private final PersonaChatService personaChatService;
  private final SessionHistoryService sessionHistoryService;
  private final CharacterProfileService characterProfileService;

  /**
   * Applies an emotion to the pair and returns the resulting adaptation.
   *
   * @return the pair's adaptation after this update
   */
  @PostMapping("/adapt")
  public ResponseEntity<BehaviorResponse> adapt(
      @PathVariable String characterId,
      @PathVariable String userId,
      @Valid @RequestBody AdaptRequest request) {
    double confidence = request.getConfidence() != null ? request.getConfidence() : 1.0;
    behaviorAdapter.adapt(
        characterId, userId, EmotionalState.of(request.getEmotion(), confidence));
    return ResponseEntity.ok(
        BehaviorResponse.from(behaviorAdapter.currentState(characterId, userId)));
  }

  @GetMapping("/behavior")
  public ResponseEntity<BehaviorResponse> getBehavior(
      @PathVariable String characterId, @PathVariable String userId) {
    return ResponseEntity.ok(
        BehaviorResponse.from(behaviorAdapter.currentState(characterId, userId)));
  }

  /** Builds the context the character would see for a message, without generating. */
  @PostMapping("/context")
  public ResponseEntity<ContextResponse> buildContext(
      @PathVariable String characterId,
      @PathVariable String userId,
      @Valid @RequestBody ChatRequest request) {
    ContextBundle bundle = contextAssembler.buildContext(characterId, userId, request.getMessage());
    return ResponseEntity.ok(ContextResponse.from(bundle, contextRenderer.render(bundle)));
  }

  @PostMapping("/chat")
  public ResponseEntity<ChatResponse> chat(
      @PathVariable String characterId,
      @PathVariable String userId,
      @Valid @RequestBody ChatRequest request) {
    log.debug("Chat turn for {}/{}", characterId, userId);
    ChatReply reply = personaChatService.chat(characterId, userId, request.getMessage());
    return ResponseEntity.ok(ChatResponse.from(reply));
  }

  @GetMapping("/history")
  public ResponseEntity<List<ChatTurnResponse>> getHistory(
      @PathVariable String characterId,
      @PathVariable String userId,
      @RequestParam(defaultValue = "50") int limit) {
    characterProfileService.getProfile(characterId);
    List<ChatTurnResponse> response =
        sessionHistoryService.history(characterId, userId, Math.max(1, limit)).stream()
            .map(ChatTurnResponse::fromEntity)
            .toList();
    return ResponseEntity.ok(response);
  }
}
