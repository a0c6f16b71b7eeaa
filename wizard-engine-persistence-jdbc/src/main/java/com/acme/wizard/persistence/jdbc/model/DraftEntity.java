package com.acme.wizard.persistence.jdbc.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Persistence model for the wizard_draft table. JSON columns are kept as strings. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class DraftEntity {

  private String id;

  private String wizardType;

  private String ownerId;

  private String referenceNumber;

  private String contextSnapshot;

  private int currentStepIndex;

  private String guardFlags;

  private String stepData;

  private Instant createdAt;

  private Instant updatedAt;

  private boolean completed;
}
