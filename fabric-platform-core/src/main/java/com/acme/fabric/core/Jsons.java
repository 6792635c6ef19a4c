package com.acme.fabric.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared JSON mapper for envelopes and payloads. Timestamps are written as ISO-8601 strings and
 * unknown properties are ignored so external producers can add fields freely.
 */
public final class Jsons {
  private static final ObjectMapper M =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  private Jsons() {}

  public static String toJson(Object o) {
    try {
      return M.writeValueAsString(o);
    } catch (JsonProcessingException e) {
      throw new PermanentException("Failed to serialize " + o.getClass().getSimpleName(), e);
    }
  }

  /**
   * Parses JSON into the given type.
   *
   * @throws MalformedJsonException if the text is not valid JSON or does not fit the type
   */
  public static <T> T fromJson(String json, Class<T> clazz) {
    try {
      return M.readValue(json, clazz);
    } catch (JsonProcessingException e) {
      throw new MalformedJsonException(clazz.getSimpleName(), e);
    }
  }

  public static <T> T fromJson(String json, TypeReference<T> type) {
    try {
      return M.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw new MalformedJsonException(type.getType().getTypeName(), e);
    }
  }

  /** Thrown when inbound text cannot be decoded. Never worth retrying. */
  public static class MalformedJsonException extends PermanentException {
    public MalformedJsonException(String target, Throwable cause) {
      super("Cannot decode JSON as " + target + ": " + cause.getMessage(), cause);
    }
  }
}
