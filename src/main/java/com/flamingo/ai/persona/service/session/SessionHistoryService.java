package com.flamingo.ai.persona.service.session;

import com.flamingo.ai.persona.domain.entity.ChatTurn;
import com.flamingo.ai.persona.domain.enums.EmotionalCategory;
import com.flamingo.ai.persona.domain.enums.TurnRole;
import com.flamingo.ai.persona.domain.repository.ChatTurnRepository;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Conversation history of a character/user pair. */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionHistoryService {

  private final ChatTurnRepository chatTurnRepository;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  /**
   * Latest turns of the pair, oldest first. An unavailable store yields an empty history.
   *
   * @param limit maximum number of turns
   */
  public List<SessionTurn> recentTurns(String characterId, String userId, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    try {
      List<ChatTurn> newestFirst = chatTurnRepository.findLatest(characterId, userId, limit);
      List<SessionTurn> turns = new ArrayList<>(newestFirst.size());
      for (ChatTurn turn : newestFirst) {
        turns.add(SessionTurn.from(turn));
      }
      Collections.reverse(turns);
      return turns;
    } catch (DataAccessException e) {
      log.warn(
          "Failed to load history for {}/{}, continuing without it: {}",
          characterId,
          userId,
          e.getMessage());
      meterRegistry.counter("session.history.errors").increment();
      return List.of();
    }
  }

  /** Content of the latest user messages, oldest first. */
  public List<String> recentUserMessages(String characterId, String userId, int limit) {
    List<String> messages = new ArrayList<>();
    for (SessionTurn turn : recentTurns(characterId, userId, limit * 2)) {
      if (turn.role() == TurnRole.USER) {
        messages.add(turn.content());
      }
    }
    int from = Math.max(0, messages.size() - limit);
    return messages.subList(from, messages.size());
  }

  /** Stores a completed exchange. The reply is timestamped just after the user message. */
  @Transactional
  public void recordExchange(
      String characterId,
      String userId,
      String userMessage,
      EmotionalCategory emotion,
      String reply) {
    LocalDateTime now = LocalDateTime.now(clock);
    ChatTurn userTurn =
        ChatTurn.builder()
            .characterId(characterId)
            .userId(userId)
            .role(TurnRole.USER)
            .content(userMessage)
            .emotion(emotion)
            .createdAt(now)
            .build();
    ChatTurn assistantTurn =
        ChatTurn.builder()
            .characterId(characterId)
            .userId(userId)
            .role(TurnRole.ASSISTANT)
            .content(reply)
            .createdAt(now.plusNanos(1_000_000))
            .build();
    chatTurnRepository.saveAll(List.of(userTurn, assistantTurn));
    log.debug("Recorded exchange for {}/{}", characterId, userId);
  }

  /** Full history of the pair up to {@code limit} turns, oldest first. */
  @Transactional(readOnly = true)
  public List<ChatTurn> history(String characterId, String userId, int limit) {
    List<ChatTurn> turns =
        new ArrayList<>(chatTurnRepository.findLatest(characterId, userId, limit));
    Collections.reverse(turns);
    return turns;
  }
}
