package com.acme.wizard.step;

/** One field-level error. {@code field} may be null for errors that apply to the whole step. */
public record FieldError(String field, String message) {

  public static FieldError of(String field, String message) {
    return new FieldError(field, message);
  }

  @Override
  public String toString() {
    return field == null ? message : field + ": " + message;
  }
}
