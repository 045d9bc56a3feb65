package com.flamingo.ai.persona.api.dto.request;

import com.flamingo.ai.persona.domain.enums.EmotionalCategory;
import com.flamingo.ai.persona.domain.enums.MemoryCategory;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for recording a memory directly. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateMemoryRequest {

  @NotBlank(message = "Content is required")
  @Size(max = 1000, message = "Content must not exceed 1000 characters")
  private String content;

  @NotNull(message = "Category is required")
  private MemoryCategory category;

  @Builder.Default private EmotionalCategory emotion = EmotionalCategory.NEUTRAL;

  @DecimalMin(value = "0.0", message = "Confidence must be at least 0.0")
  @DecimalMax(value = "1.0", message = "Confidence must be at most 1.0")
  @Builder.Default
  private Double confidence = 0.0;
}
