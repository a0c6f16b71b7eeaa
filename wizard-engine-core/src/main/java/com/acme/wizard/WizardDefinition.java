package com.acme.wizard;

import com.acme.wizard.remote.RemoteStepService;
import com.acme.wizard.step.WizardStep;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Immutable description of a wizard type: the ordered steps and the final operation. Steps are
 * held as suppliers so every controller gets its own step instances.
 */
public final class WizardDefinition {

  /** Guard key under which the final operation is recorded */
  public static final String FINISH_GUARD_KEY = "__finish__";

  private final String type;
  private final List<Supplier<? extends WizardStep>> steps;
  private final RemoteStepService finishService;
  private final Map<String, String> finishIdentifierKeys;

  WizardDefinition(
      String type,
      List<Supplier<? extends WizardStep>> steps,
      RemoteStepService finishService,
      Map<String, String> finishIdentifierKeys) {
    this.type = type;
    this.steps = List.copyOf(steps);
    this.finishService = finishService;
    this.finishIdentifierKeys = Map.copyOf(finishIdentifierKeys);
  }

  public String getType() {
    return type;
  }

  public int getStepCount() {
    return steps.size();
  }

  /** Final operation, or null when finishing is purely local. */
  public RemoteStepService getFinishService() {
    return finishService;
  }

  public Map<String, String> getFinishIdentifierKeys() {
    return finishIdentifierKeys;
  }

  /**
   * Fresh step instances in wizard order.
   *
   * @throws IllegalStateException if step ids are blank, duplicated or clash with the finish key
   */
  public List<WizardStep> newSteps() {
    List<WizardStep> created = new ArrayList<>(steps.size());
    Set<String> ids = new HashSet<>();
    for (Supplier<? extends WizardStep> supplier : steps) {
      WizardStep step = supplier.get();
      if (step == null || step.id() == null || step.id().isBlank()) {
        throw new IllegalStateException("Wizard " + type + " has a step without an id");
      }
      if (FINISH_GUARD_KEY.equals(step.id()) || !ids.add(step.id())) {
        throw new IllegalStateException(
            "Wizard " + type + " has a duplicate or reserved step id: " + step.id());
      }
      created.add(step);
    }
    return created;
  }
}
