package com.flamingo.ai.persona.api.dto.request;

import com.flamingo.ai.persona.domain.enums.EmotionalCategory;
import com.flamingo.ai.persona.domain.enums.PatienceLevel;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for creating a character profile. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateCharacterRequest {

  /** Optional slug; derived from the name when absent. */
  @Pattern(regexp = "[a-z0-9][a-z0-9-]{0,63}", message = "Id must be a lower-case slug")
  private String id;

  @NotBlank(message = "Name is required")
  @Size(max = 100, message = "Name must be at most 100 characters")
  private String name;

  private String archetype;
  private String culturalBackground;
  private Integer age;
  private String occupation;
  private PatienceLevel patienceLevel;

  @DecimalMin("0.0")
  @DecimalMax("1.0")
  private Double formality;

  @DecimalMin("0.0")
  @DecimalMax("1.0")
  private Double enthusiasm;

  @DecimalMin("0.0")
  @DecimalMax("1.0")
  private Double humor;

  @DecimalMin("0.0")
  @DecimalMax("1.0")
  private Double expertiseConfidence;

  @DecimalMin("0.0")
  @DecimalMax("1.0")
  private Double verbosity;

  private String explanationStyle;
  private Set<String> knowledgeDomains;
  private Set<String> teachingSpecialties;
  private List<String> conversationStarters;
  private Map<EmotionalCategory, String> adaptationNotes;
}
