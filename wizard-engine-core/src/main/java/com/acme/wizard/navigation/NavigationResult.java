package com.acme.wizard.navigation;

import com.acme.wizard.remote.StepFailure;
import com.acme.wizard.step.ValidationResult;

/**
 * What happened on a navigation command. {@code index} is always the position after the command.
 */
public record NavigationResult(
    Kind kind, int index, String stepId, ValidationResult validation, StepFailure failure) {

  public enum Kind {
    /** Index changed (or a draft was resumed at {@code index}) */
    MOVED,
    /** Nothing to do, e.g. going back from the first step */
    NO_OP,
    /** Local validation failed; errors are in {@code validation} */
    INVALID,
    /** Remote failure the user can act on; see {@code failure} */
    RETRY,
    /** Unrecoverable failure; the controller halts or blocks the wizard */
    FATAL,
    /** Navigation is blocked until re-authentication or the wizard is halted */
    BLOCKED,
    /** The wizard finished */
    FINISHED,
    /** The wizard was cancelled while the command ran */
    CANCELLED
  }

  public static NavigationResult moved(int index, String stepId) {
    return new NavigationResult(Kind.MOVED, index, stepId, ValidationResult.ok(), null);
  }

  public static NavigationResult noOp(int index, String stepId) {
    return new NavigationResult(Kind.NO_OP, index, stepId, ValidationResult.ok(), null);
  }

  public static NavigationResult invalid(int index, String stepId, ValidationResult validation) {
    return new NavigationResult(Kind.INVALID, index, stepId, validation, null);
  }

  public static NavigationResult retry(int index, String stepId, StepFailure failure) {
    return new NavigationResult(
        Kind.RETRY, index, stepId, failure.toValidationResult(), failure);
  }

  public static NavigationResult fatal(int index, String stepId, StepFailure failure) {
    return new NavigationResult(Kind.FATAL, index, stepId, ValidationResult.ok(), failure);
  }

  public static NavigationResult blocked(int index, String stepId, StepFailure failure) {
    return new NavigationResult(Kind.BLOCKED, index, stepId, ValidationResult.ok(), failure);
  }

  public static NavigationResult finished(int index, String stepId) {
    return new NavigationResult(Kind.FINISHED, index, stepId, ValidationResult.ok(), null);
  }

  public static NavigationResult cancelled(int index, String stepId) {
    return new NavigationResult(Kind.CANCELLED, index, stepId, ValidationResult.ok(), null);
  }

  public boolean moved() {
    return kind == Kind.MOVED;
  }

  /** Message to surface to the user, if any. */
  public String message() {
    if (failure != null) {
      return failure.message();
    }
    return validation.valid() ? null : validation.summary();
  }
}
