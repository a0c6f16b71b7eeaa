package com.acme.wizard.remote;

/** Engine-level classification of a step failure. */
public enum ErrorKind {
  /** Raised by a step's own validate(); never persisted, never reaches a remote service */
  LOCAL_VALIDATION(false),

  /** Server-side field errors, re-surfaced in the ValidationResult shape */
  REMOTE_VALIDATION(false),

  /** Target resource changed or already exists; the user decides what to do */
  CONFLICT(false),

  /** Session is no longer authenticated; navigation halts until re-authentication */
  AUTH(true),

  /** Network, timeout or server-side failure; safe to retry on user request */
  TRANSIENT(false),

  /** Forbidden or missing resource; reported with a retry affordance */
  REJECTED(false),

  /** Unclassifiable failure; halts the wizard */
  UNEXPECTED(true),

  /** Response arrived after the wizard was cancelled or reset and was dropped */
  CANCELLED(true);

  private final boolean fatal;

  ErrorKind(boolean fatal) {
    this.fatal = fatal;
  }

  public boolean isFatal() {
    return fatal;
  }
}
