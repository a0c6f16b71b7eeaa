package com.acme.wizard;

import com.acme.wizard.remote.RemoteStepService;
import com.acme.wizard.step.WizardStep;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/** Fluent builder for {@link WizardDefinition}. */
public class WizardDefinitionBuilder {
  private final String type;
  private final List<Supplier<? extends WizardStep>> steps = new ArrayList<>();
  private RemoteStepService finishService;
  private Map<String, String> finishIdentifierKeys = Map.of();

  private WizardDefinitionBuilder(String type) {
    if (type == null || type.isBlank()) {
      throw new IllegalArgumentException("Wizard type must not be blank");
    }
    this.type = type;
  }

  public static WizardDefinitionBuilder wizard(String type) {
    return new WizardDefinitionBuilder(type);
  }

  /** Append a step; the supplier is called once per controller */
  public WizardDefinitionBuilder step(Supplier<? extends WizardStep> step) {
    steps.add(step);
    return this;
  }

  /** Remote operation run by finish(), its identifiers copied into the context as-is */
  public WizardDefinitionBuilder finishWith(RemoteStepService service) {
    return finishWith(service, Map.of());
  }

  /** Remote operation run by finish(), mapping response identifiers to context keys */
  public WizardDefinitionBuilder finishWith(
      RemoteStepService service, Map<String, String> identifierKeys) {
    this.finishService = service;
    this.finishIdentifierKeys = identifierKeys;
    return this;
  }

  public WizardDefinition build() {
    if (steps.isEmpty()) {
      throw new IllegalStateException("Wizard " + type + " needs at least one step");
    }
    return new WizardDefinition(type, steps, finishService, finishIdentifierKeys);
  }
}
