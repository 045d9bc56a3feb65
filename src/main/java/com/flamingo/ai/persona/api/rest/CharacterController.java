package com.flamingo.ai.persona.api.rest;

import com.flamingo.ai.persona.api.dto.request.CreateCharacterRequest;
import com.flamingo.ai.persona.api.dto.request.UpdateCharacterRequest;
import com.flamingo.ai.persona.api.dto.response.CharacterResponse;
import com.flamingo.ai.persona.domain.entity.CharacterProfile;
import com.flamingo.ai.persona.service.character.CharacterProfileService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for character profiles. */
@RestController
@RequestMapping("/api/characters")
@RequiredArgsConstructor
@Slf4j
public class CharacterController {

  private final CharacterProfileService characterProfileService;

  @GetMapping
  public ResponseEntity<List<CharacterResponse>> listCharacters() {
    List<CharacterResponse> response =
        characterProfileService.listProfiles().stream().map(CharacterResponse::fromEntity).toList();
    return ResponseEntity.ok(response);
  }

  @GetMapping("/{characterId}")
  public ResponseEntity<CharacterResponse> getCharacter(@PathVariable String characterId) {
    return ResponseEntity.ok(
        CharacterResponse.fromEntity(characterProfileService.getProfile(characterId)));
  }

  @PostMapping
  public ResponseEntity<CharacterResponse> createCharacter(
      @Valid @RequestBody CreateCharacterRequest request) {
    log.info("Creating character: {}", request.getName());
    CharacterProfile profile = characterProfileService.createProfile(request);
    return ResponseEntity.status(HttpStatus.CREATED).body(CharacterResponse.fromEntity(profile));
  }

  /**
   * Administrative edit. The only way a character's baseline changes.
   *
   * @param characterId the character slug
   * @param request fields to change
   * @return the updated profile
   */
  @PutMapping("/{characterId}")
  public ResponseEntity<CharacterResponse> updateCharacter(
      @PathVariable String characterId, @Valid @RequestBody UpdateCharacterRequest request) {
    CharacterProfile profile = characterProfileService.updateProfile(characterId, request);
    return ResponseEntity.ok(CharacterResponse.fromEntity(profile));
  }
}
