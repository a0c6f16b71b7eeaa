package com.acme.wizard.context;

import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of a {@link WizardContext}. Handed to step callbacks that must not mutate
 * shared state (onShow, validate, onHide) and to remote services building request payloads.
 */
public interface ContextView {

  String wizardId();

  String referenceNumber();

  Object get(String key);

  boolean contains(String key);

  boolean isFinalized(String key);

  Set<String> keys();

  /** String form of a slot, or null when the slot is absent or holds null. */
  default String getString(String key) {
    Object value = get(key);
    return value == null ? null : String.valueOf(value);
  }

  default Optional<Object> find(String key) {
    return Optional.ofNullable(get(key));
  }
}
