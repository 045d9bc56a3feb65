package com.flamingo.ai.persona.service.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.persona.domain.entity.ChatTurn;
import com.flamingo.ai.persona.domain.enums.EmotionalCategory;
import com.flamingo.ai.persona.domain.enums.TurnRole;
import com.flamingo.ai.persona.domain.repository.ChatTurnRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SessionHistoryServiceTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
  private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);

  @Mock private ChatTurnRepository chatTurnRepository;
  @Captor private ArgumentCaptor<List<ChatTurn>> turnsCaptor;

  private SimpleMeterRegistry meterRegistry;
  private SessionHistoryService sessionHistoryService;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    sessionHistoryService = new SessionHistoryService(chatTurnRepository, meterRegistry, CLOCK);
  }

  private ChatTurn turn(TurnRole role, String content, int minute) {
    return ChatTurn.builder()
        .characterId("bee")
        .userId("u1")
        .role(role)
        .content(content)
        .createdAt(NOW.minusMinutes(60 - minute))
        .build();
  }

  @Test
  @DisplayName("recent turns should come back oldest first")
  void recentTurnsShouldBeOldestFirst() {
    when(chatTurnRepository.findLatest("bee", "u1", 3))
        .thenReturn(
            List.of(
                turn(TurnRole.USER, "third", 3),
                turn(TurnRole.ASSISTANT, "second", 2),
                turn(TurnRole.USER, "first", 1)));

    List<SessionTurn> turns = sessionHistoryService.recentTurns("bee", "u1", 3);

    assertThat(turns).extracting(SessionTurn::content).containsExactly("first", "second", "third");
  }

  @Test
  @DisplayName("recent user messages should skip replies and keep the latest ones")
  void recentUserMessagesShouldFilter() {
    when(chatTurnRepository.findLatest("bee", "u1", 4))
        .thenReturn(
            List.of(
                turn(TurnRole.ASSISTANT, "reply two", 4),
                turn(TurnRole.USER, "question two", 3),
                turn(TurnRole.ASSISTANT, "reply one", 2),
                turn(TurnRole.USER, "question one", 1)));

    assertThat(sessionHistoryService.recentUserMessages("bee", "u1", 2))
        .containsExactly("question one", "question two");
  }

  @Test
  @DisplayName("an unavailable store should yield an empty history")
  void failureShouldYieldEmptyHistory() {
    when(chatTurnRepository.findLatest("bee", "u1", 8))
        .thenThrow(new DataAccessResourceFailureException("locked"));

    assertThat(sessionHistoryService.recentTurns("bee", "u1", 8)).isEmpty();
    assertThat(meterRegistry.counter("session.history.errors").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("an exchange should store the reply just after the user message")
  void recordExchangeShouldOrderTurns() {
    sessionHistoryService.recordExchange(
        "bee", "u1", "Mitä kuuluu?", EmotionalCategory.ENGAGED, "Hyvää, kiitos!");

    verify(chatTurnRepository).saveAll(turnsCaptor.capture());
    List<ChatTurn> saved = turnsCaptor.getValue();
    assertThat(saved)
        .extracting(ChatTurn::getRole)
        .containsExactly(TurnRole.USER, TurnRole.ASSISTANT);
    assertThat(saved.get(0).getEmotion()).isEqualTo(EmotionalCategory.ENGAGED);
    assertThat(saved.get(0).getCreatedAt()).isEqualTo(NOW);
    assertThat(saved.get(1).getCreatedAt()).isAfter(saved.get(0).getCreatedAt());
  }
}
