package com.flamingo.ai.persona.service.memory;

import com.flamingo.ai.persona.config.PersonaConfig;
import com.flamingo.ai.persona.domain.enums.MemoryCategory;
import com.flamingo.ai.persona.domain.model.EmotionalState;
import com.flamingo.ai.persona.service.text.TextTokens;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Pulls candidate memories out of a turn with phrase patterns.
 *
 * <p>Categories are tried in order goal, preference, fact, emotional event; a span of text already
 * claimed by an earlier match is not reused. A message with a clear emotion but no other candidate
 * becomes an emotional event. The character's reply adds two more: a correction it made becomes a
 * fact about what the user got wrong, and a user message showing understanding becomes an
 * emotional event quoting what was understood.
 */
@Component
@RequiredArgsConstructor
public class MemoryExtractor {

  private static final String CLAUSE = "[^.!?;\\n]+";

  /** Characters of the message or reply quoted in a reply-derived memory. */
  static final int EXCERPT_CHARS = 50;

  private static final Set<String> CORRECTION_WORDS =
      Set.of("actually", "correct", "incorrect", "correction");

  private static final List<String> UNDERSTANDING_PHRASES =
      List.of("i understand", "makes sense", "i see", "thank you", "thanks");

  private static final Map<MemoryCategory, List<Pattern>> PATTERNS = buildPatterns();

  private final PersonaConfig personaConfig;

  public List<ExtractedMemory> extract(String userMessage, EmotionalState state) {
    return extract(userMessage, null, state);
  }

  /**
   * Candidates from the user message, followed by the ones the character's reply gives rise to.
   *
   * @param reply the generated reply of the same turn, may be null
   */
  public List<ExtractedMemory> extract(String userMessage, String reply, EmotionalState state) {
    List<ExtractedMemory> candidates = new ArrayList<>();
    if (userMessage == null || userMessage.isBlank()) {
      return candidates;
    }
    int maxLength = personaConfig.getMemory().getMaxContentLength();
    boolean[] claimed = new boolean[userMessage.length()];
    Set<String> seen = new HashSet<>();

    for (Map.Entry<MemoryCategory, List<Pattern>> entry : PATTERNS.entrySet()) {
      for (Pattern pattern : entry.getValue()) {
        Matcher matcher = pattern.matcher(userMessage);
        while (matcher.find()) {
          if (isClaimed(claimed, matcher.start(), matcher.end())) {
            continue;
          }
          String content = TextTokens.truncate(matcher.group(), maxLength);
          if (seen.add(content.toLowerCase(Locale.ROOT))) {
            candidates.add(new ExtractedMemory(content, entry.getKey()));
          }
          for (int i = matcher.start(); i < matcher.end(); i++) {
            claimed[i] = true;
          }
        }
      }
    }

    if (candidates.isEmpty() && state != null && !state.isNeutral()) {
      String content =
          TextTokens.truncate(
              "User felt " + state.emotion().label() + " about: " + userMessage, maxLength);
      candidates.add(new ExtractedMemory(content, MemoryCategory.EMOTIONAL_EVENT));
    }

    if (reply != null && !reply.isBlank()) {
      addReplyCandidates(candidates, userMessage, reply);
    }
    return candidates;
  }

  private void addReplyCandidates(
      List<ExtractedMemory> candidates, String userMessage, String reply) {
    PersonaConfig.Memory settings = personaConfig.getMemory();
    if (!Collections.disjoint(TextTokens.tokenSet(reply), CORRECTION_WORDS)) {
      candidates.add(
          new ExtractedMemory(
              "Corrected user about: " + TextTokens.truncate(userMessage, EXCERPT_CHARS),
              MemoryCategory.FACT,
              settings.getCorrectionBoost()));
    }

    String padded = " " + String.join(" ", TextTokens.tokenize(userMessage)) + " ";
    for (String phrase : UNDERSTANDING_PHRASES) {
      if (padded.contains(" " + phrase + " ")) {
        candidates.add(
            new ExtractedMemory(
                "User understood: " + TextTokens.truncate(reply, EXCERPT_CHARS),
                MemoryCategory.EMOTIONAL_EVENT,
                settings.getUnderstandingBoost()));
        return;
      }
    }
  }

  private static boolean isClaimed(boolean[] claimed, int start, int end) {
    for (int i = start; i < end; i++) {
      if (claimed[i]) {
        return true;
      }
    }
    return false;
  }

  private static Map<MemoryCategory, List<Pattern>> buildPatterns() {
    Map<MemoryCategory, List<Pattern>> patterns = new EnumMap<>(MemoryCategory.class);
    patterns.put(
        MemoryCategory.GOAL,
        compile(
            "\\bI want to " + CLAUSE,
            "\\bI(?:'m| am) trying to " + CLAUSE,
            "\\bMy goal is " + CLAUSE,
            "\\bI hope to " + CLAUSE,
            "\\bI need to " + CLAUSE));
    patterns.put(
        MemoryCategory.PREFERENCE,
        compile(
            "\\bI (?:don't like|do not like|hate|dislike) " + CLAUSE,
            "\\bI (?:like|love|enjoy|prefer) " + CLAUSE,
            "\\bMy favou?rite " + CLAUSE + " is " + CLAUSE,
            "\\bI learn best when " + CLAUSE,
            "\\bI usually " + CLAUSE,
            "\\bI always " + CLAUSE));
    patterns.put(
        MemoryCategory.FACT,
        compile(
            "\\bI work as " + CLAUSE,
            "\\bI live in " + CLAUSE,
            "\\bI study " + CLAUSE,
            "\\bI(?:'m| am) learning " + CLAUSE,
            "\\bI have " + CLAUSE,
            "\\bI am (?!so\\b|very\\b|really\\b)" + CLAUSE));
    patterns.put(
        MemoryCategory.EMOTIONAL_EVENT,
        compile(
            "\\bI feel " + CLAUSE + " about " + CLAUSE,
            "\\bI(?:'m| am) (?:so |really |very )?(?:worried|sad|happy|nervous) about " + CLAUSE));
    return patterns;
  }

  private static List<Pattern> compile(String... regexes) {
    List<Pattern> compiled = new ArrayList<>();
    for (String regex : regexes) {
      compiled.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
    }
    return compiled;
  }
}
