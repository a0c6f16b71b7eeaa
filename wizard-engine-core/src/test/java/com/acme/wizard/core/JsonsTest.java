package com.acme.wizard.core;

import static org.assertj.core.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JsonsTest {

  @Test
  @DisplayName("should parse blank input as an empty map")
  void testBlankToMap() {
    assertThat(Jsons.toMap("")).isEmpty();
    assertThat(Jsons.toMap((String) null)).isEmpty();
  }

  @Test
  @DisplayName("should keep insertion order when parsing objects")
  void testOrder() {
    Map<String, Object> map = Jsons.toMap("{\"b\":1,\"a\":2}");

    assertThat(map.keySet()).containsExactly("b", "a");
  }

  @Test
  @DisplayName("should wrap parse failures in PermanentException")
  void testInvalidJson() {
    assertThatThrownBy(() -> Jsons.toMap("{not json"))
        .isInstanceOf(PermanentException.class)
        .hasMessageContaining("Failed to parse JSON");
  }

  @Test
  @DisplayName("should deep copy nested structures")
  @SuppressWarnings("unchecked")
  void testDeepCopy() {
    Map<String, Object> source = Jsons.toMap("{\"unit\":{\"id\":\"U1\"},\"tags\":[\"x\"]}");

    Map<String, Object> copy = Jsons.deepCopy(source);
    ((Map<String, Object>) copy.get("unit")).put("id", "U2");

    assertThat(copy).isNotSameAs(source);
    assertThat(((Map<String, Object>) source.get("unit")).get("id")).isEqualTo("U1");
    assertThat(copy.get("tags")).isEqualTo(List.of("x"));
  }

  @Test
  @DisplayName("should leave scalars untouched when normalizing")
  void testNormalizeScalars() {
    assertThat(Jsons.normalize("E1")).isEqualTo("E1");
    assertThat(Jsons.normalize(42)).isEqualTo(42);
    assertThat(Jsons.normalize(null)).isNull();
  }

  @Test
  @DisplayName("should give numbers the type they have after a JSON round-trip")
  void testNormalizeNumbers() {
    // Given
    Object bigLong = Long.MAX_VALUE;

    // When / Then
    assertThat(Jsons.normalize(5L)).isInstanceOf(Integer.class).isEqualTo(5);
    assertThat(Jsons.normalize(1.5f)).isInstanceOf(Double.class).isEqualTo(1.5d);
    assertThat(Jsons.normalize(bigLong)).isEqualTo(Long.MAX_VALUE);
    assertThat(Jsons.normalize(Map.of("count", 7L))).isEqualTo(Map.of("count", 7));
  }
}
