package com.flamingo.ai.persona.service.memory;

import com.flamingo.ai.persona.domain.entity.Memory;

/** A memory with the composite score it was ranked by. */
public record ScoredMemory(Memory memory, double score) {}
