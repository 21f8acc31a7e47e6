package com.codeheadsystems.tenantguard.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads and writes the JSON array form in which token scopes are stored.
 */
public final class TokenScopes {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<List<String>> SCOPE_LIST = new TypeReference<>() {
  };

  private TokenScopes() {
  }

  /**
   * Parses a stored scope value.
   *
   * @param json a JSON array of scope names
   * @return an unmodifiable, insertion-ordered set
   * @throws IllegalArgumentException if the value is missing, not an array, or holds a blank entry
   */
  public static Set<String> parse(String json) {
    if (json == null || json.isBlank()) {
      throw new IllegalArgumentException("Missing scopes");
    }
    List<String> values;
    try {
      values = MAPPER.readValue(json, SCOPE_LIST);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid scopes JSON", e);
    }
    if (values == null) {
      throw new IllegalArgumentException("Invalid scopes JSON: null");
    }
    Set<String> scopes = new LinkedHashSet<>();
    for (String value : values) {
      if (value == null || value.isBlank()) {
        throw new IllegalArgumentException("Blank scope entry");
      }
      scopes.add(value);
    }
    return Collections.unmodifiableSet(scopes);
  }

  /**
   * Serializes scope names into the stored form.
   *
   * @param scopes scope names
   * @return a JSON array
   */
  public static String serialize(Collection<String> scopes) {
    try {
      return MAPPER.writeValueAsString(List.copyOf(scopes));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Unable to serialize scopes", e);
    }
  }
}
