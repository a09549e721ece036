package com.github.spud.worksession.infrastructure.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.springframework.boot.json.JsonParseException;

/**
 * Jackson helpers for the jsonb columns written through native queries
 */
public final class JsonUtils {

  private static final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

  private JsonUtils() {
  }

  public static String toJson(Object obj) {
    try {
      return objectMapper.writeValueAsString(obj);
    } catch (JsonProcessingException e) {
      throw new JsonParseException(e);
    }
  }

  /**
   * Serialize a metadata patch; null becomes an empty object so it can be merged with {@code ||}
   */
  public static String toJsonObject(Map<String, Object> map) {
    return map == null || map.isEmpty() ? "{}" : toJson(map);
  }
}
