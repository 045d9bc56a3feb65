package com.flamingo.ai.persona.service.memory;

import com.flamingo.ai.persona.service.text.TextTokens;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/** Tags text with coarse topics from a fixed keyword table. */
@Component
public class TopicTagger {

  private static final Map<String, Set<String>> TOPIC_KEYWORDS = buildTable();

  /** Topics whose keywords appear as whole tokens in the text, sorted by name. */
  public Set<String> tag(String text) {
    Set<String> tokens = TextTokens.tokenSet(text);
    Set<String> topics = new TreeSet<>();
    if (tokens.isEmpty()) {
      return topics;
    }
    for (Map.Entry<String, Set<String>> entry : TOPIC_KEYWORDS.entrySet()) {
      for (String keyword : entry.getValue()) {
        if (tokens.contains(keyword)) {
          topics.add(entry.getKey());
          break;
        }
      }
    }
    return topics;
  }

  private static Map<String, Set<String>> buildTable() {
    Map<String, Set<String>> table = new LinkedHashMap<>();
    table.put(
        "language_learning",
        Set.copyOf(
            List.of(
                "finnish", "suomi", "pronunciation", "grammar", "vocabulary", "tervetuloa",
                "kiitos", "hei", "moi", "sisu", "sauna", "language", "languages", "words")));
    table.put(
        "learning_methods",
        Set.of(
            "study", "practice", "learn", "learning", "understand", "remember", "flashcards",
            "exercises", "homework", "repeat"));
    table.put(
        "technology",
        Set.of(
            "computer", "programming", "data", "python", "java", "code", "software", "app",
            "website", "ai", "algorithm"));
    table.put(
        "health_fitness",
        Set.of(
            "exercise", "running", "gym", "nutrition", "diet", "training", "workout", "health",
            "fitness", "marathon"));
    table.put(
        "family_personal",
        Set.of(
            "family", "mother", "father", "child", "kids", "home", "personal", "private",
            "relationship", "friend", "brother", "sister"));
    table.put(
        "school_work",
        Set.of(
            "school", "work", "job", "teacher", "class", "meeting", "project", "assignment",
            "exam"));
    return table;
  }
}
