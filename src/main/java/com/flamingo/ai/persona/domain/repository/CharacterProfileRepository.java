package com.flamingo.ai.persona.domain.repository;

import com.flamingo.ai.persona.domain.entity.CharacterProfile;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for CharacterProfile entities. */
@Repository
public interface CharacterProfileRepository extends JpaRepository<CharacterProfile, String> {

  List<CharacterProfile> findAllByOrderByNameAsc();
}
