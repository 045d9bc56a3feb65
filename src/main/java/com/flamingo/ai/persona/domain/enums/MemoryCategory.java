package com.flamingo.ai.persona.domain.enums;

import java.util.Locale;

/** Kind of durable observation a memory represents. */
public enum MemoryCategory {
  PREFERENCE,
  FACT,
  GOAL,
  EMOTIONAL_EVENT;

  public String label() {
    return name().toLowerCase(Locale.ROOT).replace('_', '-');
  }
}
