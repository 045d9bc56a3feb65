package com.flamingo.ai.persona.domain.repository;

import com.flamingo.ai.persona.domain.entity.ChatTurn;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for ChatTurn entities. */
@Repository
public interface ChatTurnRepository extends JpaRepository<ChatTurn, UUID> {

  /** Latest turns of a pair, newest first. */
  @Query(
      "SELECT t FROM ChatTurn t WHERE t.characterId = :characterId AND t.userId = :userId "
          + "ORDER BY t.createdAt DESC")
  List<ChatTurn> findLatest(
      @Param("characterId") String characterId,
      @Param("userId") String userId,
      Pageable pageable);

  /** Latest {@code limit} turns of a pair, newest first. */
  default List<ChatTurn> findLatest(String characterId, String userId, int limit) {
    return findLatest(characterId, userId, Pageable.ofSize(limit));
  }
}
