package com.flamingo.ai.persona.service.context;

import com.flamingo.ai.persona.service.session.SessionTurn;
import java.util.List;

/** Builds the bounded, layered context handed to the generation model. */
public interface ContextAssembler {

  /**
   * Builds the context for a message from the pair's current adaptation, recent history and top
   * memories. Memories that make it into the bundle get their last-access refreshed; nothing else
   * changes.
   *
   * @throws com.flamingo.ai.persona.exception.CharacterNotFoundException if the character is
   *     unknown
   */
  ContextBundle buildContext(String characterId, String userId, String message);

  /**
   * Fits the layers into the configured budget. The session is cut to the configured window
   * (oldest dropped first); then, while over budget, the oldest session turns go first and the
   * lowest scored knowledge items second. System and user layers are never cut.
   *
   * @param session recent turns, oldest first
   * @param knowledge retrieved memories, highest score first
   */
  ContextBundle assemble(
      SystemLayer system,
      List<SessionTurn> session,
      List<KnowledgeItem> knowledge,
      String userMessage);
}
