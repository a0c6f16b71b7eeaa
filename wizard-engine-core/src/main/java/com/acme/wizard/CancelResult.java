package com.acme.wizard;

/** Outcome of {@link WizardController#cancel(boolean)} */
public enum CancelResult {
  /** Context, guard and draft were discarded */
  CANCELLED,

  /** Remote records already exist; nothing was discarded, ask the user and call cancel(true) */
  CONFIRMATION_REQUIRED,

  /** The wizard had already finished or been cancelled */
  ALREADY_CLOSED
}
