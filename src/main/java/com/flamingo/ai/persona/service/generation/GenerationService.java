package com.flamingo.ai.persona.service.generation;

import com.flamingo.ai.persona.service.context.ContextBundle;

/** Produces the character's reply for an assembled context. */
public interface GenerationService {

  /**
   * Generates a reply. The same bundle always produces the same request, so a failed call can be
   * retried by the caller.
   *
   * @throws com.flamingo.ai.persona.exception.GenerationException if the model call fails
   */
  String generate(ContextBundle bundle);
}
