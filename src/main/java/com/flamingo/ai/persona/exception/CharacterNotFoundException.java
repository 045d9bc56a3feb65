package com.flamingo.ai.persona.exception;

/** Exception thrown when a character profile does not exist. */
public class CharacterNotFoundException extends RuntimeException {

  private final String characterId;

  public CharacterNotFoundException(String characterId) {
    super("Character not found with ID: " + characterId);
    this.characterId = characterId;
  }

  public String getCharacterId() {
    return characterId;
  }
}
