package com.flamingo.ai.persona.api.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.persona.api.dto.request.ChatRequest;
import com.flamingo.ai.persona.api.dto.request.CreateMemoryRequest;
import com.flamingo.ai.persona.api.dto.request.DetectEmotionRequest;
import com.flamingo.ai.persona.domain.entity.CharacterProfile;
import com.flamingo.ai.persona.domain.enums.AdaptationMode;
import com.flamingo.ai.persona.domain.enums.EmotionalCategory;
import com.flamingo.ai.persona.domain.enums.MemoryCategory;
import com.flamingo.ai.persona.domain.model.BehaviorVector;
import com.flamingo.ai.persona.domain.model.EmotionalState;
import com.flamingo.ai.persona.domain.model.PairKey;
import com.flamingo.ai.persona.exception.CharacterNotFoundException;
import com.flamingo.ai.persona.exception.GenerationException;
import com.flamingo.ai.persona.exception.GlobalExceptionHandler;
import com.flamingo.ai.persona.exception.MemoryAccessDeniedException;
import com.flamingo.ai.persona.service.adaptation.BehaviorAdapter;
import com.flamingo.ai.persona.service.character.CharacterProfileService;
import com.flamingo.ai.persona.service.chat.ChatReply;
import com.flamingo.ai.persona.service.chat.PersonaChatService;
import com.flamingo.ai.persona.service.context.ContextAssembler;
import com.flamingo.ai.persona.service.context.ContextRenderer;
import com.flamingo.ai.persona.service.emotion.EmotionDetector;
import com.flamingo.ai.persona.service.memory.ConversationInsights;
import com.flamingo.ai.persona.service.memory.MemoryService;
import com.flamingo.ai.persona.service.session.SessionHistoryService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("Persona API Integration Tests")
class PersonaApiIntegrationTest {

  private static final String PAIR_PATH = "/api/characters/{characterId}/users/{userId}";

  private MockMvc mockMvc;
  private ObjectMapper objectMapper;

  @Mock private BehaviorAdapter behaviorAdapter;
  @Mock private ContextAssembler contextAssembler;
  @Mock private ContextRenderer contextRenderer;
  @Mock private PersonaChatService personaChatService;
  @Mock private SessionHistoryService sessionHistoryService;
  @Mock private CharacterProfileService characterProfileService;
  @Mock private MemoryService memoryService;
  @Mock private EmotionDetector emotionDetector;

  @BeforeEach
  void setUp() {
    PersonaController personaController =
        new PersonaController(
            behaviorAdapter,
            contextAssembler,
            contextRenderer,
            personaChatService,
            sessionHistoryService,
            characterProfileService);
    MemoryController memoryController =
        new MemoryController(memoryService, characterProfileService);
    EmotionController emotionController = new EmotionController(emotionDetector);
    mockMvc =
        MockMvcBuilders.standaloneSetup(personaController, memoryController, emotionController)
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
    objectMapper = new ObjectMapper();

    when(characterProfileService.getProfile("anna"))
        .thenReturn(CharacterProfile.builder().id("anna").name("Anna").build());
  }

  private String json(Object body) throws Exception {
    return objectMapper.writeValueAsString(body);
  }

  @Test
  @DisplayName("Should return the reply with emotion and mode")
  void shouldReturnChatReply() throws Exception {
    ChatReply reply =
        new ChatReply(
            "anna",
            "u1",
            "Breathe. One verb at a time.",
            EmotionalState.of(EmotionalCategory.FRUSTRATED, 1.0),
            new BehaviorVector(1.0, 0.6, 0.8, 0.3, 0.9, 0.65),
            AdaptationMode.SUPPORTIVE,
            2,
            4,
            640);
    when(personaChatService.chat("anna", "u1", "I'm so frustrated with this!")).thenReturn(reply);

    mockMvc
        .perform(
            post(PAIR_PATH + "/chat", "anna", "u1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(new ChatRequest("I'm so frustrated with this!"))))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.reply").value("Breathe. One verb at a time."))
        .andExpect(jsonPath("$.emotion").value("FRUSTRATED"))
        .andExpect(jsonPath("$.mode").value("SUPPORTIVE"))
        .andExpect(jsonPath("$.memoriesUsed").value(2));
  }

  @Test
  @DisplayName("Should reject a blank message")
  void shouldRejectBlankMessage() throws Exception {
    mockMvc
        .perform(
            post(PAIR_PATH + "/chat", "anna", "u1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(new ChatRequest("  "))))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));
    verify(personaChatService, never()).chat(anyString(), anyString(), anyString());
  }

  @Test
  @DisplayName("Should map a transient generation failure to 503")
  void shouldMapTransientGenerationFailure() throws Exception {
    when(personaChatService.chat(anyString(), anyString(), anyString()))
        .thenThrow(new GenerationException("rate limited", true));

    mockMvc
        .perform(
            post(PAIR_PATH + "/chat", "anna", "u1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(new ChatRequest("hello"))))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("GENERATION_001"))
        .andExpect(jsonPath("$.retryable").value(true));
  }

  @Test
  @DisplayName("Should map a permanent generation failure to 502")
  void shouldMapPermanentGenerationFailure() throws Exception {
    when(personaChatService.chat(anyString(), anyString(), anyString()))
        .thenThrow(new GenerationException("bad key", false));

    mockMvc
        .perform(
            post(PAIR_PATH + "/chat", "anna", "u1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(new ChatRequest("hello"))))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.retryable").value(false));
  }

  @Test
  @DisplayName("Should return 404 for an unknown character")
  void shouldReturnNotFoundForUnknownCharacter() throws Exception {
    when(personaChatService.chat(eq("ghost"), anyString(), anyString()))
        .thenThrow(new CharacterNotFoundException("ghost"));

    mockMvc
        .perform(
            post(PAIR_PATH + "/chat", "ghost", "u1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(new ChatRequest("hello"))))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("CHARACTER_001"));
  }

  @Test
  @DisplayName("Should classify a message without storing anything")
  void shouldDetectEmotion() throws Exception {
    when(emotionDetector.detect(eq("this is boring"), anyList()))
        .thenReturn(EmotionalState.of(EmotionalCategory.BORED, 0.67));

    mockMvc
        .perform(
            post("/api/emotion/detect")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    json(DetectEmotionRequest.builder().text("this is boring").build())))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.emotion").value("BORED"))
        .andExpect(jsonPath("$.confidence").value(0.67));
  }

  @Test
  @DisplayName("Should accept a memory that could not be persisted")
  void shouldAcceptUnpersistedMemory() throws Exception {
    when(memoryService.recordMemory(
            eq("anna"), eq("u1"), anyString(), eq(MemoryCategory.GOAL), any()))
        .thenReturn(Optional.empty());

    mockMvc
        .perform(
            post(PAIR_PATH + "/memories", "anna", "u1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    json(
                        CreateMemoryRequest.builder()
                            .content("Wants to pass the YKI exam")
                            .category(MemoryCategory.GOAL)
                            .build())))
        .andExpect(status().isAccepted());
  }

  @Test
  @DisplayName("Should forbid deleting another pair's memory")
  void shouldForbidCrossPairDelete() throws Exception {
    UUID memoryId = UUID.randomUUID();
    doThrow(new MemoryAccessDeniedException(memoryId, new PairKey("anna", "u2")))
        .when(memoryService)
        .validateMemoryOwnership(memoryId, "anna", "u2");

    mockMvc
        .perform(delete(PAIR_PATH + "/memories/{memoryId}", "anna", "u2", memoryId))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.code").value("MEMORY_002"));
    verify(memoryService, never()).deleteMemory(anyString(), anyString(), any(UUID.class));
  }

  @Test
  @DisplayName("Should delete an owned memory")
  void shouldDeleteOwnedMemory() throws Exception {
    UUID memoryId = UUID.randomUUID();

    mockMvc
        .perform(delete(PAIR_PATH + "/memories/{memoryId}", "anna", "u1", memoryId))
        .andExpect(status().isNoContent());
    verify(memoryService).deleteMemory("anna", "u1", memoryId);
  }

  @Test
  @DisplayName("Should list history only for a known character")
  void shouldRejectHistoryForUnknownCharacter() throws Exception {
    when(characterProfileService.getProfile("ghost"))
        .thenThrow(new CharacterNotFoundException("ghost"));

    mockMvc
        .perform(get(PAIR_PATH + "/history", "ghost", "u1"))
        .andExpect(status().isNotFound());
    verify(sessionHistoryService, never()).history(anyString(), anyString(), anyInt());
  }

  @Test
  @DisplayName("Should return an empty list for a pair with no memories")
  void shouldListNoMemories() throws Exception {
    when(memoryService.getAllMemories("anna", "u1")).thenReturn(List.of());

    mockMvc
        .perform(get(PAIR_PATH + "/memories", "anna", "u1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$").isEmpty());
  }

  @Test
  @DisplayName("Should serve conversation insights for the pair")
  void shouldReturnInsights() throws Exception {
    when(memoryService.insights("anna", "u1"))
        .thenReturn(
            new ConversationInsights(
                "anna",
                "u1",
                List.of("More about language learning"),
                List.of(),
                "Getting started",
                List.of("Set specific learning goals")));

    mockMvc
        .perform(get(PAIR_PATH + "/memories/insights", "anna", "u1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.engagementLevel").value("Getting started"))
        .andExpect(jsonPath("$.suggestedTopics[0]").value("More about language learning"));
  }
}
