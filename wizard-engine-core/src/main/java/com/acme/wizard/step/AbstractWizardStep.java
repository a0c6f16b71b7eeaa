package com.acme.wizard.step;

import com.acme.wizard.context.ContextView;
import com.acme.wizard.context.WizardContext;
import com.acme.wizard.guard.IdempotencyGuard;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for steps. Holds the step's local editable data and implements the two templates
 * every step shares:
 *
 * <ul>
 *   <li>validate(): required context keys must be present and finalized and every local key
 *       must have a value, then the step's own rules run
 *   <li>onNext(): when the guard already records a commit for this step, nothing runs and the
 *       outcome is {@link StepOutcome.Advance} with {@code skipped = true}; otherwise {@link
 *       #commit} does the work
 * </ul>
 */
public abstract class AbstractWizardStep implements WizardStep {

  private static final Logger LOG = LoggerFactory.getLogger(AbstractWizardStep.class);

  private final StepDescriptor descriptor;
  private final List<StepValidator> validators;
  private final Map<String, Object> data = new LinkedHashMap<>();
  private final Map<String, Object> inputs = new LinkedHashMap<>();
  private boolean setUp;

  protected AbstractWizardStep(StepDescriptor descriptor, List<StepValidator> validators) {
    this.descriptor = descriptor;
    this.validators = List.copyOf(validators);
  }

  @Override
  public String id() {
    return descriptor.id();
  }

  @Override
  public String title() {
    return descriptor.title();
  }

  @Override
  public String description() {
    return descriptor.description();
  }

  @Override
  public Set<String> requiredKeys() {
    return descriptor.requiredKeys();
  }

  @Override
  public Set<String> producedKeys() {
    return descriptor.producedKeys();
  }

  @Override
  public final void setup() {
    if (setUp) {
      return;
    }
    onSetup();
    setUp = true;
  }

  /** One-time initialisation hook. No side effects. */
  protected void onSetup() {
  }

  /**
   * Copies required values into the read-only inputs, and produced values into local data unless
   * the user already edited them.
   */
  @Override
  public void onShow(ContextView context) {
    inputs.clear();
    for (String key : requiredKeys()) {
      if (context.contains(key)) {
        inputs.put(key, context.get(key));
      }
    }
    for (String key : producedKeys()) {
      if (context.contains(key) && !data.containsKey(key)) {
        data.put(key, context.get(key));
      }
    }
  }

  @Override
  public final ValidationResult validate(ContextView context) {
    ValidationResult.Builder result = ValidationResult.builder();
    for (String key : requiredKeys()) {
      if (!context.contains(key)) {
        result.error(key, "Required value '" + key + "' has not been provided by a previous step");
      } else if (!context.isFinalized(key)) {
        result.error(key, "Required value '" + key + "' has not been confirmed by a previous step");
      }
    }
    for (String key : localKeys()) {
      if (data.get(key) == null) {
        result.error(key, "A value for '" + key + "' is required");
      }
    }
    Map<String, Object> snapshot = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    for (StepValidator validator : validators) {
      validator.validate(context, snapshot, result);
    }
    validateFields(context, snapshot, result);
    return result.build();
  }

  /**
   * Keys whose value the user enters on this step and the commit writes into the context. Each
   * must have a local value before the step may commit.
   */
  protected Set<String> localKeys() {
    return producedKeys();
  }

  /** Step-specific rules in addition to the configured validators. */
  protected void validateFields(
      ContextView context, Map<String, Object> data, ValidationResult.Builder result) {
  }

  @Override
  public final StepOutcome onNext(WizardContext context, IdempotencyGuard guard) {
    if (guard.hasCommitted(id())) {
      LOG.debug("Step {} already committed, skipping its work", id());
      return StepOutcome.alreadyCommitted();
    }
    return commit(context, guard);
  }

  /**
   * Perform the step's work and, on success, mark the guard. Failures are returned as outcomes.
   */
  protected abstract StepOutcome commit(WizardContext context, IdempotencyGuard guard);

  @Override
  public void onHide(ContextView context) {
  }

  @Override
  public Map<String, Object> collectData() {
    return new LinkedHashMap<>(data);
  }

  @Override
  public void restoreData(Map<String, Object> saved) {
    data.clear();
    if (saved != null) {
      data.putAll(saved);
    }
  }

  /** Record a user edit. Called by the presentation layer. */
  public void edit(String field, Object value) {
    data.put(field, value);
  }

  public Object value(String field) {
    return data.get(field);
  }

  /** Value of a required key as read during the last activation. */
  public Object input(String key) {
    return inputs.get(key);
  }

  /** Local values for this step's produced keys that the user actually filled in. */
  protected Map<String, Object> stagedValues(Set<String> keys) {
    Map<String, Object> staged = new LinkedHashMap<>();
    List<String> missing = new ArrayList<>();
    for (String key : keys) {
      if (data.containsKey(key)) {
        staged.put(key, data.get(key));
      } else {
        missing.add(key);
      }
    }
    if (!missing.isEmpty()) {
      LOG.debug("Step {} has no local value for {}", id(), missing);
    }
    return staged;
  }
}
