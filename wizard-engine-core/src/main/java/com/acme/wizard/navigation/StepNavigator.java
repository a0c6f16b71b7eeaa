package com.acme.wizard.navigation;

import com.acme.wizard.context.WizardContext;
import com.acme.wizard.guard.IdempotencyGuard;
import com.acme.wizard.remote.ErrorClassifier;
import com.acme.wizard.step.StepOutcome;
import com.acme.wizard.step.StepState;
import com.acme.wizard.step.StepStatus;
import com.acme.wizard.step.ValidationResult;
import com.acme.wizard.step.WizardStep;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves through a fixed, ordered list of steps and gates forward transitions.
 *
 * <p>Forward: validate, then onNext; only an {@link StepOutcome.Advance} moves the index.
 * Backward, one step or a jump to any earlier step: onHide and onShow only, never validate or
 * onNext. The index always stays within
 * {@code [0, N-1]}; advancing from the last step hands over to the {@link FinishHandler}.
 */
public class StepNavigator {

  private static final Logger LOG = LoggerFactory.getLogger(StepNavigator.class);

  private final List<WizardStep> steps;
  private final WizardContext context;
  private final IdempotencyGuard guard;
  private final ErrorClassifier classifier;
  private final FinishHandler finishHandler;
  private final StepStatus[] statuses;
  private final boolean[] setUp;

  private int index;
  private boolean started;

  public StepNavigator(
      List<WizardStep> steps,
      WizardContext context,
      IdempotencyGuard guard,
      ErrorClassifier classifier,
      FinishHandler finishHandler) {
    if (steps.isEmpty()) {
      throw new IllegalArgumentException("A wizard needs at least one step");
    }
    this.steps = List.copyOf(steps);
    this.context = context;
    this.guard = guard;
    this.classifier = classifier;
    this.finishHandler = finishHandler;
    this.statuses = new StepStatus[steps.size()];
    this.setUp = new boolean[steps.size()];
    Arrays.fill(statuses, StepStatus.NOT_STARTED);
  }

  /** Show the first step. */
  public void start() {
    if (started) {
      throw new IllegalStateException("Navigator already started");
    }
    started = true;
    index = 0;
    activate(0);
  }

  /**
   * Jump straight to {@code target} when resuming a draft. Steps before the target count as
   * completed, later steps as completed only if their guard flag is set. No step other than the
   * target runs any callback.
   */
  public void resumeAt(int target) {
    checkIndex(target);
    for (int i = 0; i < steps.size(); i++) {
      if (i < target) {
        statuses[i] = StepStatus.COMPLETED;
      } else if (i > target) {
        statuses[i] =
            guard.hasCommitted(steps.get(i).id()) ? StepStatus.COMPLETED : StepStatus.NOT_STARTED;
      }
    }
    started = true;
    index = target;
    activate(target);
    LOG.info("Resumed wizard {} at step {} ({})", context.wizardId(), target, steps.get(target).id());
  }

  public int current() {
    return index;
  }

  public WizardStep currentStep() {
    return steps.get(index);
  }

  public boolean canGoBack() {
    return index > 0;
  }

  public boolean isLast() {
    return index == steps.size() - 1;
  }

  public int stepCount() {
    return steps.size();
  }

  public StepStatus statusOf(int stepIndex) {
    checkIndex(stepIndex);
    return statuses[stepIndex];
  }

  public List<StepState> states() {
    List<StepState> states = new ArrayList<>(steps.size());
    for (int i = 0; i < steps.size(); i++) {
      states.add(new StepState(i, steps.get(i).id(), statuses[i]));
    }
    return List.copyOf(states);
  }

  public int completedCount() {
    int count = 0;
    for (StepStatus status : statuses) {
      if (status == StepStatus.COMPLETED) {
        count++;
      }
    }
    return count;
  }

  /** Position as a percentage, 0 on the first step and 100 on the last. */
  public double progressPercentage() {
    if (steps.size() == 1) {
      return 100.0;
    }
    return (index * 100.0) / (steps.size() - 1);
  }

  public NavigationResult goNext() {
    ensureStarted();
    WizardStep step = steps.get(index);

    ValidationResult validation = step.validate(context.view());
    if (!validation.valid()) {
      LOG.debug("Step {} failed validation: {}", step.id(), validation.errors());
      return NavigationResult.invalid(index, step.id(), validation);
    }

    StepOutcome outcome;
    try {
      outcome = step.onNext(context, guard);
    } catch (RuntimeException e) {
      outcome = StepOutcome.fromFailure(classifier.classify(step.id(), e));
    }

    if (outcome instanceof StepOutcome.RetryWithErrors retry) {
      return NavigationResult.retry(index, step.id(), retry.failure());
    }
    if (outcome instanceof StepOutcome.Fatal fatal) {
      LOG.warn("Step {} failed fatally: {}", step.id(), fatal.failure().message());
      return NavigationResult.fatal(index, step.id(), fatal.failure());
    }

    statuses[index] = StepStatus.COMPLETED;
    if (isLast()) {
      LOG.debug("Last step {} completed, handing over to finish", step.id());
      return finishHandler.finish();
    }

    step.onHide(context.view());
    index++;
    activate(index);
    return NavigationResult.moved(index, steps.get(index).id());
  }

  public NavigationResult goBack() {
    ensureStarted();
    if (!canGoBack()) {
      return NavigationResult.noOp(index, steps.get(index).id());
    }
    steps.get(index).onHide(context.view());
    index--;
    activate(index);
    return NavigationResult.moved(index, steps.get(index).id());
  }

  /**
   * Jump back to an earlier step. Only the current step is hidden and only the target shown; the
   * steps in between run no callbacks. A target at or ahead of the current step is a no-op, since
   * forward movement always goes through {@link #goNext()}.
   */
  public NavigationResult goTo(int target) {
    ensureStarted();
    checkIndex(target);
    if (target >= index) {
      return NavigationResult.noOp(index, steps.get(index).id());
    }
    steps.get(index).onHide(context.view());
    index = target;
    activate(target);
    return NavigationResult.moved(index, steps.get(index).id());
  }

  /** Go back to {@code target} and mark it active again after its committed values were reset. */
  public void reopen(int target) {
    ensureStarted();
    checkIndex(target);
    if (target > index) {
      throw new IllegalStateException(
          "Cannot reopen step " + target + " ahead of the current step " + index);
    }
    goTo(target);
    statuses[index] = StepStatus.ACTIVE;
  }

  private void activate(int target) {
    WizardStep step = steps.get(target);
    if (!setUp[target]) {
      step.setup();
      setUp[target] = true;
    }
    statuses[target] = StepStatus.ACTIVE;
    step.onShow(context.view());
    LOG.debug("Showing step {} ({})", target, step.id());
  }

  private void ensureStarted() {
    if (!started) {
      throw new IllegalStateException("Navigator has not been started");
    }
  }

  private void checkIndex(int stepIndex) {
    if (stepIndex < 0 || stepIndex >= steps.size()) {
      throw new IndexOutOfBoundsException(
          "Step index " + stepIndex + " outside [0, " + (steps.size() - 1) + "]");
    }
  }
}
