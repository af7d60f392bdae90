package com.codeheadsystems.aegis.common;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Factory for the {@link ObjectMapper} used when no framework-provided mapper is available.
 */
public class ObjectMappers {

  private ObjectMappers() {
  }

  /**
   * A mapper that writes {@code java.time} values as ISO-8601 strings and ignores unknown
   * properties on read.
   */
  public static ObjectMapper standard() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }
}
