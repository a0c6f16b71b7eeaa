package com.acme.wizard.step;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of a step's validation. Errors block navigation, warnings are informational only.
 */
public record ValidationResult(boolean valid, List<FieldError> errors, List<String> warnings) {

  private static final ValidationResult OK = new ValidationResult(true, List.of(), List.of());

  public ValidationResult {
    errors = List.copyOf(errors);
    warnings = List.copyOf(warnings);
    if (valid && !errors.isEmpty()) {
      throw new IllegalArgumentException("A valid result cannot carry errors");
    }
  }

  public static ValidationResult ok() {
    return OK;
  }

  public static ValidationResult of(List<FieldError> errors) {
    return new ValidationResult(errors.isEmpty(), errors, List.of());
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean hasWarnings() {
    return !warnings.isEmpty();
  }

  /** Errors joined one per line, for banner-style display and logs. */
  public String summary() {
    return errors.stream().map(FieldError::toString).collect(Collectors.joining("\n"));
  }

  public static final class Builder {
    private final List<FieldError> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    private Builder() {
    }

    public Builder error(String field, String message) {
      errors.add(new FieldError(field, message));
      return this;
    }

    public Builder error(String message) {
      return error(null, message);
    }

    public Builder warning(String message) {
      warnings.add(message);
      return this;
    }

    public boolean hasErrors() {
      return !errors.isEmpty();
    }

    public ValidationResult build() {
      return new ValidationResult(errors.isEmpty(), errors, warnings);
    }
  }
}
