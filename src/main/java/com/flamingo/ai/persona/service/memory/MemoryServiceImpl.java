package com.flamingo.ai.persona.service.memory;

import com.flamingo.ai.persona.config.PersonaConfig;
import com.flamingo.ai.persona.domain.entity.Memory;
import com.flamingo.ai.persona.domain.enums.MemoryCategory;
import com.flamingo.ai.persona.domain.model.EmotionalState;
import com.flamingo.ai.persona.domain.model.PairKey;
import com.flamingo.ai.persona.domain.repository.MemoryRepository;
import com.flamingo.ai.persona.exception.MemoryAccessDeniedException;
import com.flamingo.ai.persona.exception.MemoryNotFoundException;
import com.flamingo.ai.persona.service.lock.PairLockRegistry;
import com.flamingo.ai.persona.service.text.TextTokens;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of MemoryService over the JPA memory repository. */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryServiceImpl implements MemoryService {

  private final MemoryRepository memoryRepository;
  private final MemoryScorer memoryScorer;
  private final MemoryExtractor memoryExtractor;
  private final TopicTagger topicTagger;
  private final MemoryAnalyzer memoryAnalyzer;
  private final MemoryWriteQueue memoryWriteQueue;
  private final PairLockRegistry pairLockRegistry;
  private final PersonaConfig personaConfig;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  @Override
  public Optional<Memory> recordMemory(
      String characterId,
      String userId,
      String content,
      MemoryCategory category,
      EmotionalState state) {
    Set<UUID> written = new HashSet<>();
    return pairLockRegistry.withLock(
        new PairKey(characterId, userId),
        () -> write(characterId, userId, content, category, 0.0, state, written));
  }

  @Override
  public List<Memory> extractAndRecord(
      String characterId, String userId, String userMessage, String reply, EmotionalState state) {
    if (!personaConfig.getMemory().isEnabled()) {
      return List.of();
    }
    List<ExtractedMemory> candidates = memoryExtractor.extract(userMessage, reply, state);
    if (candidates.isEmpty()) {
      log.debug("No memories extracted for {}/{}", characterId, userId);
      return List.of();
    }

    Set<UUID> written = new HashSet<>();
    List<Memory> stored = new ArrayList<>();
    pairLockRegistry.runWithLock(
        new PairKey(characterId, userId),
        () -> {
          for (ExtractedMemory candidate : candidates) {
            write(
                    characterId,
                    userId,
                    candidate.content(),
                    candidate.category(),
                    candidate.importanceBoost(),
                    state,
                    written)
                .ifPresent(stored::add);
          }
        });
    return stored;
  }

  @Override
  public CompletableFuture<Void> extractAndRecordAsync(
      String characterId, String userId, String userMessage, String reply, EmotionalState state) {
    return memoryWriteQueue.submit(
        new PairKey(characterId, userId),
        () -> extractAndRecord(characterId, userId, userMessage, reply, state));
  }

  /** Writes one memory; caller holds the pair lock. Ids in {@code written} are never evicted. */
  private Optional<Memory> write(
      String characterId,
      String userId,
      String rawContent,
      MemoryCategory category,
      double importanceBoost,
      EmotionalState state,
      Set<UUID> written) {
    PersonaConfig.Memory settings = personaConfig.getMemory();
    String content = TextTokens.truncate(rawContent, settings.getMaxContentLength());
    if (content.isEmpty()) {
      return Optional.empty();
    }
    EmotionalState emotion = state != null ? state : EmotionalState.neutral();
    LocalDateTime now = LocalDateTime.now(clock);

    try {
      List<Memory> existing =
          memoryRepository.findByCharacterIdAndUserIdOrderByImportanceDesc(characterId, userId);

      Memory closest = null;
      double closestSimilarity = 0.0;
      for (Memory memory : existing) {
        double similarity = memoryScorer.similarity(content, memory.getContent());
        if (similarity > closestSimilarity) {
          closestSimilarity = similarity;
          closest = memory;
        }
      }

      if (closest != null && closestSimilarity >= settings.getMergeSimilarity()) {
        closest.promote(settings.getPromotionStep());
        Memory merged = memoryRepository.save(closest);
        written.add(merged.getId());
        meterRegistry.counter("memory.merged.count").increment();
        log.info(
            "Merged memory into {} for {}/{} (similarity {})",
            merged.getId(),
            characterId,
            userId,
            String.format("%.2f", closestSimilarity));
        return Optional.of(merged);
      }

      double importance =
          Math.min(1.0, memoryScorer.importance(category, content, emotion) + importanceBoost);
      if (closestSimilarity >= settings.getNoveltySimilarity()) {
        importance *= 1.0 - 0.5 * closestSimilarity;
      }

      Memory memory =
          Memory.builder()
              .characterId(characterId)
              .userId(userId)
              .content(content)
              .category(category)
              .importance(importance)
              .emotion(emotion.emotion())
              .emotionConfidence(emotion.confidence())
              .topics(topicTagger.tag(content))
              .createdAt(now)
              .lastAccessedAt(now)
              .build();

      Memory saved = memoryRepository.save(memory);
      written.add(saved.getId());
      meterRegistry.counter("memory.saved.count").increment();
      log.info(
          "Saved {} memory {} for {}/{} (importance {})",
          category.label(),
          saved.getId(),
          characterId,
          userId,
          String.format("%.2f", importance));

      try {
        enforceCapacity(characterId, userId, written, now);
      } catch (DataAccessException | TransactionException e) {
        log.warn(
            "Memory eviction failed for {}/{}, memory {} kept: {}",
            characterId,
            userId,
            saved.getId(),
            e.getMessage());
        meterRegistry.counter("memory.eviction.errors").increment();
      }
      return Optional.of(saved);

    } catch (DataAccessException | TransactionException e) {
      log.warn(
          "Memory write failed for {}/{}, discarding candidate: {}",
          characterId,
          userId,
          e.getMessage());
      meterRegistry.counter("memory.write.errors").increment();
      return Optional.empty();
    }
  }

  private void enforceCapacity(
      String characterId, String userId, Set<UUID> protectedIds, LocalDateTime now) {
    int capacity = personaConfig.getMemory().getMaxPerPair();
    List<Memory> all =
        memoryRepository.findByCharacterIdAndUserIdOrderByImportanceDesc(characterId, userId);
    int excess = all.size() - capacity;
    if (excess <= 0) {
      return;
    }

    List<Memory> candidates = new ArrayList<>();
    for (Memory memory : all) {
      if (!protectedIds.contains(memory.getId())) {
        candidates.add(memory);
      }
    }
    candidates.sort(
        Comparator.comparingDouble((Memory m) -> memoryScorer.composite(m, now, Set.of()))
            .thenComparing(Memory::getCreatedAt)
            .thenComparing(m -> m.getId().toString()));

    List<Memory> evicted = candidates.subList(0, Math.min(excess, candidates.size()));
    memoryRepository.deleteAll(evicted);
    meterRegistry.counter("memory.evicted.count").increment(evicted.size());
    log.info("Evicted {} memories for {}/{}", evicted.size(), characterId, userId);
  }

  @Override
  @Timed(value = "memory.rank", description = "Time to rank memories for a message")
  public List<ScoredMemory> rank(String characterId, String userId, String message, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    List<Memory> all;
    try {
      all = memoryRepository.findByCharacterIdAndUserIdOrderByImportanceDesc(characterId, userId);
    } catch (DataAccessException e) {
      log.warn(
          "Memory retrieval failed for {}/{}, continuing without memories: {}",
          characterId,
          userId,
          e.getMessage());
      meterRegistry.counter("memory.retrieval.errors").increment();
      return List.of();
    }

    LocalDateTime now = LocalDateTime.now(clock);
    Set<String> queryTopics = topicTagger.tag(message);
    return all.stream()
        .map(memory -> new ScoredMemory(memory, memoryScorer.composite(memory, now, queryTopics)))
        .sorted(
            Comparator.comparingDouble(ScoredMemory::score)
                .reversed()
                .thenComparing(
                    (ScoredMemory s) -> s.memory().getCreatedAt(), Comparator.reverseOrder())
                .thenComparing(s -> s.memory().getId().toString()))
        .limit(limit)
        .toList();
  }

  @Override
  public List<ScoredMemory> retrieve(
      String characterId, String userId, String message, int limit) {
    return pairLockRegistry.withLock(
        new PairKey(characterId, userId),
        () -> {
          List<ScoredMemory> ranked = rank(characterId, userId, message, limit);
          markAccessed(ranked.stream().map(s -> s.memory().getId()).toList());
          return ranked;
        });
  }

  @Override
  public void markAccessed(Collection<UUID> memoryIds) {
    if (memoryIds.isEmpty()) {
      return;
    }
    LocalDateTime now = LocalDateTime.now(clock);
    try {
      List<Memory> memories = memoryRepository.findAllById(memoryIds);
      for (Memory memory : memories) {
        memory.touch(now);
      }
      memoryRepository.saveAll(memories);
      meterRegistry.counter("memory.retrieved.count").increment(memories.size());
    } catch (DataAccessException e) {
      log.warn(
          "Failed to refresh access time of {} memories: {}", memoryIds.size(), e.getMessage());
    }
  }

  @Override
  @Transactional(readOnly = true)
  public List<Memory> getAllMemories(String characterId, String userId) {
    return memoryRepository.findByCharacterIdAndUserIdOrderByImportanceDesc(characterId, userId);
  }

  @Override
  @Transactional(readOnly = true)
  public Memory getMemory(String characterId, String userId, UUID memoryId) {
    Memory memory =
        memoryRepository
            .findById(memoryId)
            .orElseThrow(() -> new MemoryNotFoundException(memoryId));
    if (!memory.belongsTo(characterId, userId)) {
      throw new MemoryAccessDeniedException(memoryId, new PairKey(characterId, userId));
    }
    return memory;
  }

  @Override
  @Transactional
  public void deleteMemory(String characterId, String userId, UUID memoryId) {
    Memory memory = getMemory(characterId, userId, memoryId);
    memoryRepository.delete(memory);
    meterRegistry.counter("memory.deleted.count").increment();
    log.info("Deleted memory {} for {}/{}", memoryId, characterId, userId);
  }

  @Override
  public Memory promoteMemory(String characterId, String userId, UUID memoryId) {
    return pairLockRegistry.withLock(
        new PairKey(characterId, userId),
        () -> {
          Memory memory = getMemory(characterId, userId, memoryId);
          memory.promote(personaConfig.getMemory().getPromotionStep());
          Memory saved = memoryRepository.save(memory);
          meterRegistry.counter("memory.promoted.count").increment();
          log.info("Promoted memory {} to importance {}", memoryId, saved.getImportance());
          return saved;
        });
  }

  @Override
  @Transactional(readOnly = true)
  public MemorySummary summarize(String characterId, String userId) {
    return memoryAnalyzer.summarize(characterId, userId, getAllMemories(characterId, userId));
  }

  @Override
  @Transactional(readOnly = true)
  public ConversationInsights insights(String characterId, String userId) {
    return memoryAnalyzer.insights(characterId, userId, getAllMemories(characterId, userId));
  }

  @Override
  @Transactional(readOnly = true)
  public void validateMemoryOwnership(UUID memoryId, String characterId, String userId) {
    getMemory(characterId, userId, memoryId);
  }
}
