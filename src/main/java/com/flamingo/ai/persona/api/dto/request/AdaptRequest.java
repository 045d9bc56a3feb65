package com.flamingo.ai.persona.api.dto.request;

import com.flamingo.ai.persona.domain.enums.EmotionalCategory;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for applying a detected emotion to a character/user pair. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdaptRequest {

  @NotNull(message = "Emotion is required")
  private EmotionalCategory emotion;

  @DecimalMin(value = "0.0", message = "Confidence must be at least 0.0")
  @DecimalMax(value = "1.0", message = "Confidence must be at most 1.0")
  @Builder.Default
  private Double confidence = 1.0;
}
