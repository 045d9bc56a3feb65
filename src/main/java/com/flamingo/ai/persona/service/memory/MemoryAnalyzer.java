package com.flamingo.ai.persona.service.memory;

import com.flamingo.ai.persona.domain.entity.Memory;
import com.flamingo.ai.persona.domain.enums.EmotionalCategory;
import com.flamingo.ai.persona.domain.enums.MemoryCategory;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Derives the memory summary and conversation insights of a pair from its memories.
 *
 * <p>Topics come from the tags stored with each memory; memories stored without tags are tagged
 * from their content.
 */
@Component
@RequiredArgsConstructor
public class MemoryAnalyzer {

  /** Most recent memories considered for insights. */
  static final int INSIGHT_WINDOW = 20;

  /** Most recent memories considered for next steps. */
  static final int RECENT_WINDOW = 5;

  private static final int MAX_ITEMS = 3;
  private static final int MAX_SCALE = 10;
  private static final double HIGH_IMPORTANCE = 0.8;
  private static final double FOCUS_SHARE = 0.4;
  private static final int STRUGGLE_THRESHOLD = 2;
  private static final String LANGUAGE_TOPIC = "language_learning";
  private static final String CORRECTION_PREFIX = "corrected user about:";

  private final TopicTagger topicTagger;

  public MemorySummary summarize(String characterId, String userId, List<Memory> memories) {
    Map<MemoryCategory, Long> byCategory = new EnumMap<>(MemoryCategory.class);
    Map<EmotionalCategory, Long> byEmotion = new EnumMap<>(EmotionalCategory.class);
    double importanceSum = 0.0;
    int highImportance = 0;
    for (Memory memory : memories) {
      byCategory.merge(memory.getCategory(), 1L, Long::sum);
      byEmotion.merge(memory.getEmotion(), 1L, Long::sum);
      importanceSum += memory.getImportance();
      if (memory.getImportance() >= HIGH_IMPORTANCE) {
        highImportance++;
      }
    }
    int total = memories.size();
    double average = total == 0 ? 0.0 : importanceSum / total;
    Map<String, Long> topics = topicCounts(memories);

    return new MemorySummary(
        characterId,
        userId,
        total,
        byCategory,
        byEmotion,
        average,
        topics,
        Math.min(total / 5, MAX_SCALE),
        Math.min(byCategory.size() * 2 + highImportance, MAX_SCALE),
        learningFocus(topics, total));
  }

  public ConversationInsights insights(String characterId, String userId, List<Memory> memories) {
    List<Memory> recent =
        memories.stream()
            .sorted(Comparator.comparing(Memory::getCreatedAt).reversed())
            .limit(INSIGHT_WINDOW)
            .toList();
    return new ConversationInsights(
        characterId,
        userId,
        suggestTopics(recent),
        learningGaps(recent),
        engagementLevel(recent.size()),
        nextSteps(recent.subList(0, Math.min(RECENT_WINDOW, recent.size()))));
  }

  private Map<String, Long> topicCounts(List<Memory> memories) {
    Map<String, Long> counts = new TreeMap<>();
    for (Memory memory : memories) {
      for (String topic : topicsOf(memory)) {
        counts.merge(topic, 1L, Long::sum);
      }
    }
    Map<String, Long> ordered = new LinkedHashMap<>();
    counts.entrySet().stream()
        .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
        .forEach(entry -> ordered.put(entry.getKey(), entry.getValue()));
    return ordered;
  }

  private String learningFocus(Map<String, Long> topics, int total) {
    if (topics.isEmpty()) {
      return "General learning";
    }
    Map.Entry<String, Long> top = topics.entrySet().iterator().next();
    String label = topicLabel(top.getKey());
    if (top.getValue() > total * FOCUS_SHARE) {
      return Character.toUpperCase(label.charAt(0)) + label.substring(1) + " focus";
    }
    return "Mixed learning with " + label;
  }

  private List<String> suggestTopics(List<Memory> recent) {
    List<String> suggestions = new ArrayList<>();
    for (String topic : topicCounts(recent).keySet()) {
      if (suggestions.size() == 2) {
        break;
      }
      suggestions.add("More about " + topicLabel(topic));
    }
    if (recent.stream().anyMatch(m -> m.getCategory() == MemoryCategory.GOAL)) {
      suggestions.add("Progress toward your learning goals");
    }
    if (suggestions.isEmpty()) {
      return List.of("Getting to know each other", "Learning preferences", "Personal goals");
    }
    return suggestions.subList(0, Math.min(MAX_ITEMS, suggestions.size()));
  }

  private List<String> learningGaps(List<Memory> recent) {
    List<String> gaps = new ArrayList<>();
    long struggles =
        recent.stream()
            .map(m -> m.getContent().toLowerCase(Locale.ROOT))
            .filter(c -> c.contains("confused") || c.startsWith(CORRECTION_PREFIX))
            .count();
    if (struggles > STRUGGLE_THRESHOLD) {
      gaps.add("Review fundamental concepts");
    }

    List<String> languageContent =
        recent.stream()
            .filter(m -> topicsOf(m).contains(LANGUAGE_TOPIC))
            .map(m -> m.getContent().toLowerCase(Locale.ROOT))
            .toList();
    if (!languageContent.isEmpty()) {
      if (languageContent.stream().noneMatch(c -> c.contains("pronunciation"))) {
        gaps.add("Pronunciation practice needed");
      }
      if (languageContent.stream().noneMatch(c -> c.contains("vocabulary"))) {
        gaps.add("Vocabulary building opportunities");
      }
    }
    return gaps.subList(0, Math.min(MAX_ITEMS, gaps.size()));
  }

  private static String engagementLevel(int count) {
    if (count < 3) {
      return "Getting started";
    } else if (count < 10) {
      return "Building engagement";
    } else if (count < 20) {
      return "Actively engaged";
    }
    return "Highly engaged learner";
  }

  private List<String> nextSteps(List<Memory> latest) {
    List<String> steps = new ArrayList<>();
    if (latest.stream().anyMatch(m -> m.getCategory() == MemoryCategory.GOAL)) {
      steps.add("Continue working toward your stated goals");
    }
    if (latest.stream().anyMatch(m -> topicsOf(m).contains(LANGUAGE_TOPIC))) {
      steps.add("Practice conversation with everyday scenarios");
    }
    if (steps.isEmpty()) {
      return List.of(
          "Set specific learning goals",
          "Practice with real-world examples",
          "Build on your interests");
    }
    return steps;
  }

  private Set<String> topicsOf(Memory memory) {
    Set<String> stored = memory.getTopics();
    return stored == null || stored.isEmpty() ? topicTagger.tag(memory.getContent()) : stored;
  }

  private static String topicLabel(String topic) {
    return topic.replace('_', ' ');
  }
}
