package com.flamingo.ai.persona.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for classifying a message. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectEmotionRequest {

  @NotNull(message = "Text is required")
  @Size(max = 4000, message = "Text must not exceed 4000 characters")
  private String text;

  /** Earlier user messages, oldest first. */
  @Builder.Default private List<String> recentHistory = new ArrayList<>();
}
