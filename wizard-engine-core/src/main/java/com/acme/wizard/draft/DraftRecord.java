package com.acme.wizard.draft;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable persisted state of an unfinished (or finished) wizard. Each modification returns a
 * new instance (copy-on-write). {@code id} is null until the record was first saved.
 */
public record DraftRecord(
    String id,
    String wizardType,
    String ownerId,
    String referenceNumber,
    Map<String, Object> contextSnapshot,
    int currentStepIndex,
    Map<String, Boolean> guardFlags,
    Map<String, Map<String, Object>> stepData,
    Instant createdAt,
    Instant updatedAt,
    boolean completed) {

  public DraftRecord {
    if (wizardType == null || wizardType.isBlank()) {
      throw new IllegalArgumentException("wizardType must not be blank");
    }
    if (currentStepIndex < 0) {
      throw new IllegalArgumentException("currentStepIndex must not be negative");
    }
    contextSnapshot = contextSnapshot == null ? Map.of() : contextSnapshot;
    guardFlags = guardFlags == null ? Map.of() : Map.copyOf(guardFlags);
    stepData = stepData == null ? Map.of() : stepData;
  }

  /** Create a new, not yet saved draft */
  public static DraftRecord create(
      String wizardType,
      String ownerId,
      String referenceNumber,
      Map<String, Object> contextSnapshot,
      int currentStepIndex,
      Map<String, Boolean> guardFlags,
      Map<String, Map<String, Object>> stepData) {
    Instant now = Instant.now();
    return new DraftRecord(
        null,
        wizardType,
        ownerId,
        referenceNumber,
        contextSnapshot,
        currentStepIndex,
        guardFlags,
        stepData,
        now,
        now,
        false);
  }

  /** Assign the store-generated id */
  public DraftRecord withId(String newId) {
    return new DraftRecord(
        newId,
        wizardType,
        ownerId,
        referenceNumber,
        contextSnapshot,
        currentStepIndex,
        guardFlags,
        stepData,
        createdAt,
        updatedAt,
        completed);
  }

  /** Replace the captured state, keeping identity and creation time */
  public DraftRecord withState(
      Map<String, Object> newSnapshot,
      int newStepIndex,
      Map<String, Boolean> newGuardFlags,
      Map<String, Map<String, Object>> newStepData) {
    return new DraftRecord(
        id,
        wizardType,
        ownerId,
        referenceNumber,
        newSnapshot,
        newStepIndex,
        newGuardFlags,
        newStepData,
        createdAt,
        Instant.now(),
        completed);
  }

  /** Flag the draft as belonging to a finished wizard */
  public DraftRecord asCompleted() {
    return new DraftRecord(
        id,
        wizardType,
        ownerId,
        referenceNumber,
        contextSnapshot,
        currentStepIndex,
        guardFlags,
        stepData,
        createdAt,
        Instant.now(),
        true);
  }
}
