package com.flamingo.ai.persona.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;

/**
 * JPA converter for persisting a set of tags as a sorted JSON array in a TEXT column. Sorting keeps
 * the stored value stable for equal sets.
 */
@Converter
@Slf4j
public class TagSetConverter implements AttributeConverter<Set<String>, String> {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<List<String>> LIST_TYPE = new TypeReference<>() {};

  @Override
  public String convertToDatabaseColumn(Set<String> tags) {
    if (tags == null || tags.isEmpty()) {
      return null;
    }
    try {
      return MAPPER.writeValueAsString(new TreeSet<>(tags));
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize tag set: {}", e.getMessage());
      return null;
    }
  }

  @Override
  public Set<String> convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return new TreeSet<>();
    }
    try {
      return new TreeSet<>(MAPPER.readValue(dbData, LIST_TYPE));
    } catch (JsonProcessingException e) {
      log.error("Failed to deserialize tag set: {}", e.getMessage());
      return new TreeSet<>(Collections.emptySet());
    }
  }
}
