package com.flamingo.ai.persona.api.rest;

import com.flamingo.ai.persona.api.dto.request.DetectEmotionRequest;
import com.flamingo.ai.persona.api.dto.response.EmotionResponse;
import com.flamingo.ai.persona.domain.model.EmotionalState;
import com.flamingo.ai.persona.service.emotion.EmotionDetector;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller exposing emotion detection. */
@RestController
@RequestMapping("/api/emotion")
@RequiredArgsConstructor
public class EmotionController {

  private final EmotionDetector emotionDetector;

  /**
   * Classifies a message. Pure: nothing is stored.
   *
   * @param request the text and optional recent history
   * @return the detected emotion and confidence
   */
  @PostMapping("/detect")
  public ResponseEntity<EmotionResponse> detect(@Valid @RequestBody DetectEmotionRequest request) {
    EmotionalState state = emotionDetector.detect(request.getText(), request.getRecentHistory());
    return ResponseEntity.ok(EmotionResponse.from(state));
  }
}
