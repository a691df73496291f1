package com.gentoro.claimgraph.utility;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.gentoro.claimgraph.exception.SerializationException;

public class JacksonUtility {
  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper()
          // payloads from search APIs carry many fields we do not model
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
          .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
          .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
          .setSerializationInclusion(JsonInclude.Include.NON_NULL);

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  public static String toJson(Object object) {
    try {
      return JSON_MAPPER.writeValueAsString(object);
    } catch (Exception e) {
      throw new SerializationException("Failed to serialize object to JSON", e);
    }
  }

  /** Snapshot of an object as a detached JSON tree. */
  public static JsonNode toTree(Object object) {
    try {
      return JSON_MAPPER.valueToTree(object);
    } catch (IllegalArgumentException e) {
      throw new SerializationException("Failed to convert object to JSON tree", e);
    }
  }

  public static JsonNode readTree(String json) {
    try {
      return JSON_MAPPER.readTree(json);
    } catch (Exception e) {
      throw new SerializationException("Failed to parse JSON content", e);
    }
  }
}
