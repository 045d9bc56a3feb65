package com.flamingo.ai.persona.service.text;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/** Lower-cased word tokens shared by emotion detection, topic tagging and memory scoring. */
public final class TextTokens {

  private static final Pattern SEPARATORS = Pattern.compile("[^a-z0-9']+");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private TextTokens() {}

  /** Splits text into lower-case tokens, keeping apostrophes so contractions stay whole. */
  public static List<String> tokenize(String text) {
    List<String> tokens = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return tokens;
    }
    String normalized = text.toLowerCase(Locale.ROOT).replace('’', '\'');
    for (String token : SEPARATORS.split(normalized)) {
      String trimmed = stripQuotes(token);
      if (!trimmed.isEmpty()) {
        tokens.add(trimmed);
      }
    }
    return tokens;
  }

  public static Set<String> tokenSet(String text) {
    return new LinkedHashSet<>(tokenize(text));
  }

  /** Collapses runs of whitespace and trims. */
  public static String normalizeWhitespace(String text) {
    return text == null ? "" : WHITESPACE.matcher(text).replaceAll(" ").trim();
  }

  /** Normalized text cut to {@code maxLength} characters, with an ellipsis when cut. */
  public static String truncate(String text, int maxLength) {
    String normalized = normalizeWhitespace(text);
    if (normalized.length() <= maxLength) {
      return normalized;
    }
    return normalized.substring(0, maxLength) + "...";
  }

  /** Rough token estimate: ~4 characters per token for English. */
  public static int estimateTokens(String text) {
    if (text == null || text.isEmpty()) {
      return 0;
    }
    return (text.length() + 3) / 4;
  }

  private static String stripQuotes(String token) {
    int start = 0;
    int end = token.length();
    while (start < end && token.charAt(start) == '\'') {
      start++;
    }
    while (end > start && token.charAt(end - 1) == '\'') {
      end--;
    }
    return token.substring(start, end);
  }
}
