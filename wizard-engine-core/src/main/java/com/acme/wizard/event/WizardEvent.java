package com.acme.wizard.event;

import com.acme.wizard.remote.CallToAction;
import com.acme.wizard.remote.ErrorKind;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.Map;

/**
 * Lifecycle notifications of a wizard instance. All events are immutable and serializable for
 * audit logging.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "@type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = WizardEvent.WizardStarted.class, name = "WizardStarted"),
  @JsonSubTypes.Type(value = WizardEvent.StepAdvanced.class, name = "StepAdvanced"),
  @JsonSubTypes.Type(value = WizardEvent.StepReturned.class, name = "StepReturned"),
  @JsonSubTypes.Type(value = WizardEvent.StepRetryRequired.class, name = "StepRetryRequired"),
  @JsonSubTypes.Type(value = WizardEvent.WizardHalted.class, name = "WizardHalted"),
  @JsonSubTypes.Type(
      value = WizardEvent.AuthenticationRequired.class,
      name = "AuthenticationRequired"),
  @JsonSubTypes.Type(value = WizardEvent.Reauthenticated.class, name = "Reauthenticated"),
  @JsonSubTypes.Type(value = WizardEvent.StepReset.class, name = "StepReset"),
  @JsonSubTypes.Type(value = WizardEvent.WizardFinished.class, name = "WizardFinished"),
  @JsonSubTypes.Type(value = WizardEvent.WizardCancelled.class, name = "WizardCancelled"),
  @JsonSubTypes.Type(value = WizardEvent.DraftSaved.class, name = "DraftSaved"),
  @JsonSubTypes.Type(value = WizardEvent.DraftLoaded.class, name = "DraftLoaded")
})
public sealed interface WizardEvent {

  String wizardId();

  /** Wizard instance created and its first step shown */
  record WizardStarted(String wizardId, String wizardType, String referenceNumber)
      implements WizardEvent {}

  /** Forward transition; {@code skipped} when the step had already been committed */
  record StepAdvanced(String wizardId, String fromStep, String toStep, boolean skipped)
      implements WizardEvent {}

  /** Backward transition */
  record StepReturned(String wizardId, String fromStep, String toStep) implements WizardEvent {}

  /** Step stays active after a correctable or transient failure */
  record StepRetryRequired(
      String wizardId, String step, ErrorKind kind, String message, CallToAction callToAction)
      implements WizardEvent {}

  /** Unrecoverable failure; only saveDraft and cancel remain available */
  record WizardHalted(String wizardId, String step, ErrorKind kind, String message)
      implements WizardEvent {}

  /** Navigation blocked until the user signs in again */
  record AuthenticationRequired(String wizardId, String step, String message)
      implements WizardEvent {}

  /** Navigation unblocked */
  record Reauthenticated(String wizardId) implements WizardEvent {}

  /** A committed step was explicitly reset for re-editing */
  record StepReset(String wizardId, String step) implements WizardEvent {}

  /** Final operation committed */
  record WizardFinished(String wizardId, String referenceNumber, Map<String, Object> result)
      implements WizardEvent {}

  /** Wizard discarded; {@code hadCommittedSteps} when remote records may already exist */
  record WizardCancelled(String wizardId, boolean hadCommittedSteps) implements WizardEvent {}

  record DraftSaved(String wizardId, String draftId, int stepIndex) implements WizardEvent {}

  record DraftLoaded(String wizardId, String draftId, int stepIndex) implements WizardEvent {}
}
