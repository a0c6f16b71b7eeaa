package com.acme.wizard.step;

import com.acme.wizard.remote.StepFailure;
import java.util.Objects;

/**
 * Result of a step's forward-transition attempt. Remote failures are carried as values, never
 * thrown past the step.
 */
public sealed interface StepOutcome {

  /** The step's work is committed (or had already been committed) */
  record Advance(boolean skipped) implements StepOutcome {}

  /** User-correctable or transient failure; stay on the step */
  record RetryWithErrors(StepFailure failure) implements StepOutcome {
    public RetryWithErrors {
      Objects.requireNonNull(failure, "failure");
    }
  }

  /** Unrecoverable for the current session; the wizard halts */
  record Fatal(StepFailure failure) implements StepOutcome {
    public Fatal {
      Objects.requireNonNull(failure, "failure");
    }
  }

  static StepOutcome advance() {
    return new Advance(false);
  }

  static StepOutcome alreadyCommitted() {
    return new Advance(true);
  }

  /** Retry or fatal, depending on the failure's kind. */
  static StepOutcome fromFailure(StepFailure failure) {
    return failure.isFatal() ? new Fatal(failure) : new RetryWithErrors(failure);
  }
}
