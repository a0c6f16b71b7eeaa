package com.acme.wizard.step;

import com.acme.wizard.context.WizardContext;
import com.acme.wizard.guard.IdempotencyGuard;
import com.acme.wizard.remote.DefaultErrorClassifier;
import com.acme.wizard.remote.RemoteStepService;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Step whose commit performs a side-effecting remote call, e.g. creating a survey or a property
 * unit on the server. Local values for the declared {@code localKeys} are staged into the context
 * for the service to read; identifiers returned by the service are renamed through {@code
 * identifierKeys} (at least one) and written next to them; identifiers without a mapping are
 * not stored. Everything is finalized together with the guard flag.
 */
public class RemoteStep extends AbstractWizardStep {

  private final RemoteStepService service;
  private final StepCommitter committer;
  private final Set<String> localKeys;
  private final Map<String, String> identifierKeys;

  public RemoteStep(
      StepDescriptor descriptor,
      RemoteStepService service,
      Set<String> localKeys,
      Map<String, String> identifierKeys,
      StepValidator... validators) {
    this(
        descriptor,
        service,
        new StepCommitter(new DefaultErrorClassifier()),
        localKeys,
        identifierKeys,
        List.of(validators));
  }

  public RemoteStep(
      StepDescriptor descriptor,
      RemoteStepService service,
      StepCommitter committer,
      Set<String> localKeys,
      Map<String, String> identifierKeys,
      List<StepValidator> validators) {
    super(withProducedKeys(descriptor, localKeys, identifierKeys), validators);
    if (identifierKeys.isEmpty()) {
      throw new IllegalArgumentException(
          "Remote step " + descriptor.id() + " needs at least one identifier mapping");
    }
    this.service = Objects.requireNonNull(service, "service");
    this.committer = committer;
    this.localKeys = Set.copyOf(localKeys);
    this.identifierKeys = new LinkedHashMap<>(identifierKeys);
  }

  private static StepDescriptor withProducedKeys(
      StepDescriptor descriptor, Set<String> localKeys, Map<String, String> identifierKeys) {
    Set<String> produced = new LinkedHashSet<>(localKeys);
    produced.addAll(identifierKeys.values());
    return descriptor.produces(produced.toArray(String[]::new));
  }

  @Override
  protected Set<String> localKeys() {
    return localKeys;
  }

  @Override
  protected StepOutcome commit(WizardContext context, IdempotencyGuard guard) {
    return committer.commit(
        id(), service, context, guard, stagedValues(localKeys), identifierKeys);
  }
}
