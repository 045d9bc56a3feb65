package com.flamingo.ai.persona.service.chat;

import java.util.concurrent.CompletableFuture;

/** Runs a full conversational turn: detect, adapt, build context, generate, remember. */
public interface PersonaChatService {

  /**
   * Runs one turn synchronously. Turns of the same character/user pair are serialized.
   *
   * @throws com.flamingo.ai.persona.exception.CharacterNotFoundException if the character is
   *     unknown
   * @throws com.flamingo.ai.persona.exception.GenerationException if the reply cannot be generated
   */
  ChatReply chat(String characterId, String userId, String message);

  /**
   * Runs one turn on the turn executor. Cancelling the returned future before generation
   * finishes keeps the adaptation of that turn but drops its history and memory writes.
   */
  CompletableFuture<ChatReply> chatAsync(String characterId, String userId, String message);
}
