package com.acme.wizard.step;

import java.util.LinkedHashSet;
import java.util.Set;

/** Identity and data dependencies of a step. */
public record StepDescriptor(
    String id, String title, String description, Set<String> requiredKeys, Set<String> producedKeys) {

  public StepDescriptor {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Step id must not be blank");
    }
    title = title == null ? id : title;
    description = description == null ? "" : description;
    requiredKeys = Set.copyOf(requiredKeys);
    producedKeys = Set.copyOf(producedKeys);
  }

  public static StepDescriptor of(String id) {
    return new StepDescriptor(id, id, "", Set.of(), Set.of());
  }

  public StepDescriptor titled(String newTitle, String newDescription) {
    return new StepDescriptor(id, newTitle, newDescription, requiredKeys, producedKeys);
  }

  public StepDescriptor requires(String... keys) {
    Set<String> merged = new LinkedHashSet<>(requiredKeys);
    merged.addAll(Set.of(keys));
    return new StepDescriptor(id, title, description, merged, producedKeys);
  }

  public StepDescriptor produces(String... keys) {
    Set<String> merged = new LinkedHashSet<>(producedKeys);
    merged.addAll(Set.of(keys));
    return new StepDescriptor(id, title, description, requiredKeys, merged);
  }
}
