package com.flamingo.ai.persona.domain.repository;

import com.flamingo.ai.persona.domain.entity.Memory;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Memory entities. */
@Repository
public interface MemoryRepository extends JpaRepository<Memory, UUID> {

  /** All memories of a pair ordered by importance (highest first). */
  List<Memory> findByCharacterIdAndUserIdOrderByImportanceDesc(String characterId, String userId);

  long countByCharacterIdAndUserId(String characterId, String userId);
}
