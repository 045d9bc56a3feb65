package com.flamingo.ai.persona.domain.repository;

import com.flamingo.ai.persona.domain.entity.AdaptationState;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for AdaptationState entities, one row per character/user pair. */
@Repository
public interface AdaptationStateRepository extends JpaRepository<AdaptationState, UUID> {

  Optional<AdaptationState> findByCharacterIdAndUserId(String characterId, String userId);
}
