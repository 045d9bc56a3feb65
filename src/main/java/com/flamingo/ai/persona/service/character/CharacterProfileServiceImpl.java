package com.flamingo.ai.persona.service.character;

import com.flamingo.ai.persona.api.dto.request.CreateCharacterRequest;
import com.flamingo.ai.persona.api.dto.request.UpdateCharacterRequest;
import com.flamingo.ai.persona.domain.entity.CharacterProfile;
import com.flamingo.ai.persona.domain.enums.EmotionalCategory;
import com.flamingo.ai.persona.domain.repository.CharacterProfileRepository;
import com.flamingo.ai.persona.exception.CharacterNotFoundException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** JPA-backed character profile store. */
@Service
@RequiredArgsConstructor
@Slf4j
public class CharacterProfileServiceImpl implements CharacterProfileService {

  private final CharacterProfileRepository characterProfileRepository;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional(readOnly = true)
  public CharacterProfile getProfile(String characterId) {
    return characterProfileRepository
        .findById(characterId)
        .orElseThrow(() -> new CharacterNotFoundException(characterId));
  }

  @Override
  @Transactional(readOnly = true)
  public List<CharacterProfile> listProfiles() {
    return characterProfileRepository.findAllByOrderByNameAsc();
  }

  @Override
  @Transactional
  @Timed(value = "character.create", description = "Time to create a character profile")
  public CharacterProfile createProfile(CreateCharacterRequest request) {
    String id = request.getId() != null ? request.getId() : slugOf(request.getName());
    if (id.isEmpty()) {
      throw new IllegalArgumentException("Cannot derive an id from name: " + request.getName());
    }
    if (characterProfileRepository.existsById(id)) {
      throw new IllegalArgumentException("Character already exists: " + id);
    }

    CharacterProfile profile =
        CharacterProfile.builder()
            .id(id)
            .name(request.getName())
            .archetype(request.getArchetype())
            .culturalBackground(request.getCulturalBackground())
            .age(request.getAge())
            .occupation(request.getOccupation())
            .build();
    if (request.getPatienceLevel() != null) {
      profile.setPatienceLevel(request.getPatienceLevel());
    }
    if (request.getFormality() != null) {
      profile.setFormality(request.getFormality());
    }
    if (request.getEnthusiasm() != null) {
      profile.setEnthusiasm(request.getEnthusiasm());
    }
    if (request.getHumor() != null) {
      profile.setHumor(request.getHumor());
    }
    if (request.getExpertiseConfidence() != null) {
      profile.setExpertiseConfidence(request.getExpertiseConfidence());
    }
    if (request.getVerbosity() != null) {
      profile.setVerbosity(request.getVerbosity());
    }
    if (request.getExplanationStyle() != null) {
      profile.setExplanationStyle(request.getExplanationStyle());
    }
    if (request.getKnowledgeDomains() != null) {
      profile.setKnowledgeDomains(new TreeSet<>(request.getKnowledgeDomains()));
    }
    if (request.getTeachingSpecialties() != null) {
      profile.setTeachingSpecialties(new TreeSet<>(request.getTeachingSpecialties()));
    }
    if (request.getConversationStarters() != null) {
      profile.setConversationStarters(new ArrayList<>(request.getConversationStarters()));
    }
    if (request.getAdaptationNotes() != null && !request.getAdaptationNotes().isEmpty()) {
      profile.setAdaptationNotes(new EnumMap<>(request.getAdaptationNotes()));
    }
    profile.validate();

    CharacterProfile saved = characterProfileRepository.save(profile);
    meterRegistry.counter("character.created").increment();
    log.info("Created character profile: {} ({})", saved.getName(), saved.getId());
    return saved;
  }

  @Override
  @Transactional
  @Timed(value = "character.update", description = "Time to update a character profile")
  public CharacterProfile updateProfile(String characterId, UpdateCharacterRequest request) {
    CharacterProfile profile = getProfile(characterId);

    if (request.getName() != null) {
      profile.setName(request.getName());
    }
    if (request.getArchetype() != null) {
      profile.setArchetype(request.getArchetype());
    }
    if (request.getCulturalBackground() != null) {
      profile.setCulturalBackground(request.getCulturalBackground());
    }
    if (request.getAge() != null) {
      profile.setAge(request.getAge());
    }
    if (request.getOccupation() != null) {
      profile.setOccupation(request.getOccupation());
    }
    if (request.getPatienceLevel() != null) {
      profile.setPatienceLevel(request.getPatienceLevel());
    }
    if (request.getFormality() != null) {
      profile.setFormality(request.getFormality());
    }
    if (request.getEnthusiasm() != null) {
      profile.setEnthusiasm(request.getEnthusiasm());
    }
    if (request.getHumor() != null) {
      profile.setHumor(request.getHumor());
    }
    if (request.getExpertiseConfidence() != null) {
      profile.setExpertiseConfidence(request.getExpertiseConfidence());
    }
    if (request.getVerbosity() != null) {
      profile.setVerbosity(request.getVerbosity());
    }
    if (request.getExplanationStyle() != null) {
      profile.setExplanationStyle(request.getExplanationStyle());
    }
    if (request.getKnowledgeDomains() != null) {
      profile.setKnowledgeDomains(new TreeSet<>(request.getKnowledgeDomains()));
    }
    if (request.getTeachingSpecialties() != null) {
      profile.setTeachingSpecialties(new TreeSet<>(request.getTeachingSpecialties()));
    }
    if (request.getConversationStarters() != null) {
      profile.setConversationStarters(new ArrayList<>(request.getConversationStarters()));
    }
    if (request.getAdaptationNotes() != null) {
      EnumMap<EmotionalCategory, String> notes = new EnumMap<>(EmotionalCategory.class);
      notes.putAll(request.getAdaptationNotes());
      profile.setAdaptationNotes(notes);
    }
    profile.validate();

    CharacterProfile saved = characterProfileRepository.save(profile);
    meterRegistry.counter("character.updated").increment();
    log.info("Updated character profile {}", characterId);
    return saved;
  }

  static String slugOf(String name) {
    String ascii = Normalizer.normalize(name, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
    return ascii
        .toLowerCase(Locale.ROOT)
        .replaceAll("[^a-z0-9]+", "-")
        .replaceAll("(^-+)|(-+$)", "");
  }
}
