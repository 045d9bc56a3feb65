package com.flamingo.ai.persona.service.memory;

import com.flamingo.ai.persona.domain.enums.MemoryCategory;

/**
 * Candidate memory pulled from a turn, before scoring.
 *
 * @param importanceBoost added to the scored importance; non-zero for memories drawn from the
 *     character's reply
 */
public record ExtractedMemory(String content, MemoryCategory category, double importanceBoost) {

  public ExtractedMemory(String content, MemoryCategory category) {
    this(content, category, 0.0);
  }
}
