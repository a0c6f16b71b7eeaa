package com.acme.wizard.step;

import com.acme.wizard.context.WizardContext;
import com.acme.wizard.guard.IdempotencyGuard;
import com.acme.wizard.remote.DefaultErrorClassifier;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Step without remote work. Its commit writes the local values of its produced keys (or all local
 * data when it declares none) into the context and finalizes them.
 */
public class LocalStep extends AbstractWizardStep {

  private final StepCommitter committer;

  public LocalStep(StepDescriptor descriptor, StepValidator... validators) {
    this(descriptor, new StepCommitter(new DefaultErrorClassifier()), List.of(validators));
  }

  public LocalStep(
      StepDescriptor descriptor, StepCommitter committer, List<StepValidator> validators) {
    super(descriptor, validators);
    this.committer = committer;
  }

  /** Without declared produced keys a commit writes all local data, so a reset clears it all. */
  @Override
  public Set<String> committedKeys() {
    return producedKeys().isEmpty() ? collectData().keySet() : producedKeys();
  }

  @Override
  protected StepOutcome commit(WizardContext context, IdempotencyGuard guard) {
    Map<String, Object> values =
        producedKeys().isEmpty() ? collectData() : stagedValues(producedKeys());
    return committer.commit(id(), null, context, guard, values, Map.of());
  }
}
