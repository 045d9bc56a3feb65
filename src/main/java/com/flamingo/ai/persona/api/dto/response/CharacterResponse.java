package com.flamingo.ai.persona.api.dto.response;

import com.flamingo.ai.persona.domain.entity.CharacterProfile;
import com.flamingo.ai.persona.domain.enums.EmotionalCategory;
import com.flamingo.ai.persona.domain.enums.PatienceLevel;
import com.flamingo.ai.persona.domain.model.BehaviorVector;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for character profile data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CharacterResponse {

  private String id;
  private String name;
  private String archetype;
  private String culturalBackground;
  private Integer age;
  private String occupation;
  private PatienceLevel patienceLevel;
  private BehaviorVector baseline;
  private String explanationStyle;
  private Set<String> knowledgeDomains;
  private Set<String> teachingSpecialties;
  private List<String> conversationStarters;
  private Map<EmotionalCategory, String> adaptationNotes;
  private LocalDateTime createdAt;
  private LocalDateTime updatedAt;

  /** Creates a CharacterResponse from a CharacterProfile entity. */
  public static CharacterResponse fromEntity(CharacterProfile profile) {
    Map<EmotionalCategory, String> notes = new EnumMap<>(EmotionalCategory.class);
    notes.putAll(profile.getAdaptationNotes());
    return CharacterResponse.builder()
        .id(profile.getId())
        .name(profile.getName())
        .archetype(profile.getArchetype())
        .culturalBackground(profile.getCulturalBackground())
        .age(profile.getAge())
        .occupation(profile.getOccupation())
        .patienceLevel(profile.getPatienceLevel())
        .baseline(profile.baseline())
        .explanationStyle(profile.getExplanationStyle())
        .knowledgeDomains(new TreeSet<>(profile.getKnowledgeDomains()))
        .teachingSpecialties(new TreeSet<>(profile.getTeachingSpecialties()))
        .conversationStarters(new ArrayList<>(profile.getConversationStarters()))
        .adaptationNotes(notes)
        .createdAt(profile.getCreatedAt())
        .updatedAt(profile.getUpdatedAt())
        .build();
  }
}
