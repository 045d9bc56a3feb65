package com.flamingo.ai.persona.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a chat message, also used to preview the context of a message. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {

  @NotBlank(message = "Message is required")
  @Size(max = 4000, message = "Message must not exceed 4000 characters")
  private String message;
}
