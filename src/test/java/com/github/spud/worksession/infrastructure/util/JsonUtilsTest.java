package com.github.spud.worksession.infrastructure.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonUtilsTest {

  @Test
  void emptyPatchIsEmptyObject() {
    assertThat(JsonUtils.toJsonObject(null)).isEqualTo("{}");
    assertThat(JsonUtils.toJsonObject(Map.of())).isEqualTo("{}");
  }

  @Test
  void patchKeepsKeyOrder() {
    Map<String, Object> patch = new LinkedHashMap<>();
    patch.put("ended_reason", "timeout");
    patch.put("duration_ms", 1500L);

    assertThat(JsonUtils.toJsonObject(patch))
      .isEqualTo("{\"ended_reason\":\"timeout\",\"duration_ms\":1500}");
  }
}
