package com.flamingo.ai.persona.domain.model;

import java.util.Objects;

/** Identifies the conversation between one character and one user. */
public record PairKey(String characterId, String userId) {

  public PairKey {
    Objects.requireNonNull(characterId, "characterId");
    Objects.requireNonNull(userId, "userId");
  }

  @Override
  public String toString() {
    return characterId + "/" + userId;
  }
}
