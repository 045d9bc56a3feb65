package com.flamingo.ai.persona.service.memory;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TopicTaggerTest {

  private final TopicTagger tagger = new TopicTagger();

  @Test
  @DisplayName("should tag whole-word keywords sorted by topic name")
  void shouldTagSorted() {
    assertThat(tagger.tag("I practice Finnish grammar after the gym"))
        .containsExactly("health_fitness", "language_learning", "learning_methods");
  }

  @Test
  @DisplayName("should not match keywords inside other words")
  void shouldNotMatchSubstrings() {
    assertThat(tagger.tag("the homeless javascript fan")).isEmpty();
    assertThat(tagger.tag(null)).isEmpty();
  }
}
