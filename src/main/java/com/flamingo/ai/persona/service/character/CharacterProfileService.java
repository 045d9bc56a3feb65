package com.flamingo.ai.persona.service.character;

import com.flamingo.ai.persona.api.dto.request.CreateCharacterRequest;
import com.flamingo.ai.persona.api.dto.request.UpdateCharacterRequest;
import com.flamingo.ai.persona.domain.entity.CharacterProfile;
import java.util.List;

/** Store of character baselines. Profiles change only through {@link #updateProfile}. */
public interface CharacterProfileService {

  /**
   * Gets a profile by id.
   *
   * @param characterId the character slug
   * @return the profile
   * @throws com.flamingo.ai.persona.exception.CharacterNotFoundException if not found
   */
  CharacterProfile getProfile(String characterId);

  /** All profiles ordered by name. */
  List<CharacterProfile> listProfiles();

  /**
   * Creates a profile.
   *
   * @param request the create request
   * @return the saved profile
   * @throws IllegalArgumentException if the id is taken or a trait is out of range
   */
  CharacterProfile createProfile(CreateCharacterRequest request);

  /**
   * Administrative edit of a profile's baseline and persona data.
   *
   * @param characterId the character slug
   * @param request the fields to change
   * @return the updated profile
   */
  CharacterProfile updateProfile(String characterId, UpdateCharacterRequest request);
}
