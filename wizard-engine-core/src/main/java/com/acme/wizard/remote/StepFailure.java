package com.acme.wizard.remote;

import com.acme.wizard.step.FieldError;
import com.acme.wizard.step.ValidationResult;
import java.util.List;
import java.util.Objects;

/**
 * A normalized failure of a step's forward transition. Carries everything the presentation
 * boundary needs: the message to show, field errors for inline display and the call to action.
 */
public record StepFailure(
    String stepId,
    ErrorKind kind,
    FailureCategory category,
    String message,
    List<FieldError> fieldErrors,
    CallToAction callToAction,
    boolean retryable) {

  public StepFailure {
    Objects.requireNonNull(kind, "kind");
    fieldErrors = fieldErrors == null ? List.of() : List.copyOf(fieldErrors);
    callToAction = callToAction == null ? CallToAction.NONE : callToAction;
  }

  public static StepFailure localValidation(String stepId, ValidationResult result) {
    return new StepFailure(
        stepId,
        ErrorKind.LOCAL_VALIDATION,
        null,
        result.summary(),
        result.errors(),
        CallToAction.CORRECT_FIELDS,
        true);
  }

  public static StepFailure cancelled(String stepId) {
    return new StepFailure(
        stepId,
        ErrorKind.CANCELLED,
        null,
        "Wizard was cancelled while the request was in flight",
        List.of(),
        CallToAction.NONE,
        false);
  }

  public boolean isFatal() {
    return kind.isFatal();
  }

  /** Field errors in the same shape local validation produces, for inline display. */
  public ValidationResult toValidationResult() {
    return ValidationResult.of(fieldErrors);
  }
}
