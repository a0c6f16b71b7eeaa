package com.acme.wizard.guard;

import static org.assertj.core.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class IdempotencyGuardTest {

  private final IdempotencyGuard guard = new IdempotencyGuard();

  @Test
  @DisplayName("should report nothing committed for a fresh guard")
  void testFresh() {
    assertThat(guard.hasCommitted("createSurvey")).isFalse();
    assertThat(guard.anyCommitted()).isFalse();
    assertThat(guard.flags()).isEmpty();
  }

  @Test
  @DisplayName("should keep a flag set when marked twice")
  void testMarkIsMonotonic() {
    guard.markCommitted("createSurvey");
    guard.markCommitted("createSurvey");

    assertThat(guard.hasCommitted("createSurvey")).isTrue();
    assertThat(guard.flags()).containsExactly(Map.entry("createSurvey", true));
  }

  @Test
  @DisplayName("should clear a single flag on reset")
  void testReset() {
    guard.markCommitted("createSurvey");
    guard.markCommitted("createUnit");

    guard.reset("createSurvey");

    assertThat(guard.hasCommitted("createSurvey")).isFalse();
    assertThat(guard.hasCommitted("createUnit")).isTrue();
  }

  @Test
  @DisplayName("should restore only flags that are true")
  void testRestore() {
    Map<String, Boolean> saved = new LinkedHashMap<>();
    saved.put("createSurvey", true);
    saved.put("createUnit", false);

    guard.restore(saved);

    assertThat(guard.flags()).containsOnlyKeys("createSurvey");
  }

  @Test
  @DisplayName("should return a copy of the flags that does not track later changes")
  void testFlagsCopy() {
    Map<String, Boolean> flags = guard.flags();
    guard.markCommitted("createSurvey");

    assertThat(flags).isEmpty();
    assertThatThrownBy(() -> guard.flags().put("x", true))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  @DisplayName("should reject a blank step id")
  void testBlankId() {
    assertThatThrownBy(() -> guard.markCommitted("")).isInstanceOf(IllegalArgumentException.class);
  }
}
