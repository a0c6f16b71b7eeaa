package com.acme.wizard.persistence.jdbc;

import static org.assertj.core.api.Assertions.*;

import com.acme.wizard.draft.DraftRecord;
import java.sql.Connection;
import java.sql.Statement;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Integration tests for H2DraftStore against the migrated wizard_draft table.
 */
class H2DraftStoreTest extends H2DraftStoreTestBase {

  private H2DraftStore store;

  @BeforeEach
  void setUp() throws Exception {
    store = new H2DraftStore(dataSource);

    try (Connection conn = dataSource.getConnection();
        Statement statement = conn.createStatement()) {
      statement.execute("DELETE FROM wizard_draft");
    }
  }

  private static DraftRecord draft(String wizardType, int stepIndex) {
    Map<String, Object> snapshot = new LinkedHashMap<>();
    snapshot.put("wizardId", "w-1");
    snapshot.put("referenceNumber", "WIZ-20240601093000-AB12");
    snapshot.put("values", Map.of("entityId", "E1", "floors", 3));
    snapshot.put("finalized", List.of("entityId"));

    Map<String, Map<String, Object>> stepData = new LinkedHashMap<>();
    stepData.put("entity", Map.of("entityName", "Harbour View"));
    stepData.put("unit", Map.of());

    return DraftRecord.create(
        wizardType,
        "surveyor-7",
        "WIZ-20240601093000-AB12",
        snapshot,
        stepIndex,
        Map.of("entity", true, "unit", false),
        stepData);
  }

  @Nested
  @DisplayName("Save and Load")
  class SaveAndLoadTests {

    @Test
    @DisplayName("should assign an id and read back every field")
    void testInsertAndLoad() {
      // Given
      DraftRecord record = draft("property-survey", 1);

      // When
      String id = store.save(record);
      Optional<DraftRecord> loaded = store.load(id);

      // Then
      assertThat(id).isNotBlank();
      assertThat(loaded).isPresent();
      DraftRecord found = loaded.get();
      assertThat(found.id()).isEqualTo(id);
      assertThat(found.wizardType()).isEqualTo("property-survey");
      assertThat(found.ownerId()).isEqualTo("surveyor-7");
      assertThat(found.referenceNumber()).isEqualTo("WIZ-20240601093000-AB12");
      assertThat(found.currentStepIndex()).isEqualTo(1);
      assertThat(found.contextSnapshot()).isEqualTo(record.contextSnapshot());
      assertThat(found.guardFlags()).containsEntry("entity", true).containsEntry("unit", false);
      assertThat(found.stepData()).isEqualTo(record.stepData());
      assertThat(found.completed()).isFalse();
      assertThat(found.createdAt())
          .isCloseTo(record.createdAt(), within(1, ChronoUnit.SECONDS));
    }

    @Test
    @DisplayName("should overwrite an existing draft and keep its id")
    void testUpdate() {
      // Given
      String id = store.save(draft("property-survey", 0));
      DraftRecord saved = store.load(id).orElseThrow();

      // When
      DraftRecord changed =
          saved.withState(
              Map.of("wizardId", "w-1", "values", Map.of("unitId", "U1")),
              2,
              Map.of("entity", true, "unit", true),
              Map.of("unit", Map.of("unitName", "A-12")));
      String secondId = store.save(changed);

      // Then
      assertThat(secondId).isEqualTo(id);
      DraftRecord found = store.load(id).orElseThrow();
      assertThat(found.currentStepIndex()).isEqualTo(2);
      assertThat(found.guardFlags()).containsEntry("unit", true);
      assertThat(found.stepData().get("unit")).containsEntry("unitName", "A-12");
      assertThat(found.updatedAt()).isAfterOrEqualTo(found.createdAt());
    }

    @Test
    @DisplayName("should insert a record whose id is not in the table yet")
    void testSaveWithUnknownId() {
      String id = store.save(draft("property-survey", 0).withId("imported-draft"));

      assertThat(id).isEqualTo("imported-draft");
      assertThat(store.load("imported-draft")).isPresent();
    }

    @Test
    @DisplayName("should return empty for an unknown id")
    void testLoadUnknown() {
      assertThat(store.load("missing")).isEmpty();
    }

    @Test
    @DisplayName("should persist the completed flag")
    void testCompleted() {
      String id = store.save(draft("property-survey", 2));
      store.save(store.load(id).orElseThrow().asCompleted());

      assertThat(store.load(id).orElseThrow().completed()).isTrue();
    }
  }

  @Nested
  @DisplayName("Delete")
  class DeleteTests {

    @Test
    @DisplayName("should remove the draft")
    void testDelete() {
      String id = store.save(draft("property-survey", 0));

      store.delete(id);

      assertThat(store.load(id)).isEmpty();
    }

    @Test
    @DisplayName("should ignore an unknown id")
    void testDeleteUnknown() {
      assertThatCode(() -> store.delete("missing")).doesNotThrowAnyException();
    }
  }

  @Nested
  @DisplayName("Find Incomplete")
  class FindIncompleteTests {

    @Test
    @DisplayName("should list open drafts of one type, most recently updated first")
    void testOrdering() {
      // Given
      Instant base = Instant.parse("2024-06-01T09:00:00Z");
      String older = store.save(withUpdatedAt(draft("property-survey", 0), base));
      String newer = store.save(withUpdatedAt(draft("property-survey", 1), base.plusSeconds(60)));
      String done =
          store.save(withUpdatedAt(draft("property-survey", 2), base.plusSeconds(120)).asCompleted());
      store.save(withUpdatedAt(draft("building-audit", 0), base.plusSeconds(180)));

      // When
      List<DraftRecord> found = store.findIncomplete("property-survey", 10);

      // Then
      assertThat(found).extracting(DraftRecord::id).containsExactly(newer, older);
      assertThat(found).extracting(DraftRecord::id).doesNotContain(done);
    }

    @Test
    @DisplayName("should honour the limit")
    void testLimit() {
      Instant base = Instant.parse("2024-06-01T09:00:00Z");
      for (int i = 0; i < 5; i++) {
        store.save(withUpdatedAt(draft("property-survey", 0), base.plusSeconds(i)));
      }

      assertThat(store.findIncomplete("property-survey", 3)).hasSize(3);
    }

    @Test
    @DisplayName("should return an empty list for an unknown type")
    void testUnknownType() {
      store.save(draft("property-survey", 0));

      assertThat(store.findIncomplete("unknown", 10)).isEmpty();
    }
  }

  private static DraftRecord withUpdatedAt(DraftRecord record, Instant updatedAt) {
    return new DraftRecord(
        record.id(),
        record.wizardType(),
        record.ownerId(),
        record.referenceNumber(),
        record.contextSnapshot(),
        record.currentStepIndex(),
        record.guardFlags(),
        record.stepData(),
        updatedAt,
        updatedAt,
        record.completed());
  }
}
