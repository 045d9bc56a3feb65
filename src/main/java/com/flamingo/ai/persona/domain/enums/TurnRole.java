package com.flamingo.ai.persona.domain.enums;

/** Author of a conversation turn. */
public enum TurnRole {
  USER,
  ASSISTANT
}
