package com.acme.wizard.remote;

import com.acme.wizard.step.FieldError;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Result of a single remote step call. */
public sealed interface RemoteResult {

  boolean isSuccess();

  /** Remote mutation committed; identifiers are written into the wizard context */
  record Success(Map<String, Object> identifiers) implements RemoteResult {
    public Success {
      identifiers = identifiers == null ? Map.of() : Map.copyOf(identifiers);
    }

    @Override
    public boolean isSuccess() {
      return true;
    }
  }

  /** Remote mutation did not commit */
  record Failure(FailureCategory category, String message, List<FieldError> fieldErrors)
      implements RemoteResult {
    public Failure {
      Objects.requireNonNull(category, "category");
      fieldErrors = fieldErrors == null ? List.of() : List.copyOf(fieldErrors);
    }

    @Override
    public boolean isSuccess() {
      return false;
    }
  }

  static RemoteResult success(Map<String, Object> identifiers) {
    return new Success(identifiers);
  }

  static RemoteResult failure(FailureCategory category, String message) {
    return new Failure(category, message, List.of());
  }

  static RemoteResult validationFailure(String message, List<FieldError> fieldErrors) {
    return new Failure(FailureCategory.VALIDATION, message, fieldErrors);
  }
}
