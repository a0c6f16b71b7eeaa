package com.acme.wizard;

/** Lifecycle status of a wizard controller */
public enum WizardStatus {
  /** Controller created, no step shown yet */
  NEW,

  /** A step is shown and navigation is possible */
  ACTIVE,

  /** A remote call was rejected as unauthenticated; navigation waits for re-authentication */
  AUTH_REQUIRED,

  /** An unrecoverable failure occurred; only saveDraft and cancel remain */
  HALTED,

  /** Final operation committed */
  COMPLETED,

  /** Wizard discarded */
  CANCELLED
}
