package com.acme.wizard;

import com.acme.wizard.config.WizardConfig;
import com.acme.wizard.context.ContextView;
import com.acme.wizard.context.WizardContext;
import com.acme.wizard.draft.DraftNotFoundException;
import com.acme.wizard.draft.DraftRecord;
import com.acme.wizard.draft.DraftStore;
import com.acme.wizard.event.WizardEvent;
import com.acme.wizard.event.WizardListener;
import com.acme.wizard.guard.IdempotencyGuard;
import com.acme.wizard.navigation.NavigationResult;
import com.acme.wizard.navigation.StepNavigator;
import com.acme.wizard.remote.DefaultErrorClassifier;
import com.acme.wizard.remote.ErrorClassifier;
import com.acme.wizard.remote.ErrorKind;
import com.acme.wizard.remote.StepFailure;
import com.acme.wizard.step.StepCommitter;
import com.acme.wizard.step.StepOutcome;
import com.acme.wizard.step.StepState;
import com.acme.wizard.step.WizardStep;
import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one wizard instance: owns its context, idempotency guard and navigator, and exposes the
 * user commands next, previous, goToStep, finish, cancel, saveDraft and loadDraft.
 *
 * <p>Commands that may call a remote service or read the whole state run under one lock, so at
 * most one remote call is in flight and a draft is only taken once that call has settled. {@link
 * #cancel(boolean)} does not take the lock: it destroys the context, which makes any in-flight
 * response stale so it is discarded instead of applied.
 */
public class WizardController {

  private static final Logger LOG = LoggerFactory.getLogger(WizardController.class);

  private final WizardDefinition definition;
  private final DraftStore draftStore;
  private final WizardConfig config;
  private final StepCommitter committer;
  private final WizardContext context;
  private final IdempotencyGuard guard = new IdempotencyGuard();
  private final List<WizardStep> steps;
  private final StepNavigator navigator;
  private final ReentrantLock lock = new ReentrantLock();
  // guards the switch to COMPLETED or CANCELLED
  private final Object closeLock = new Object();
  private final List<WizardListener> listeners = new CopyOnWriteArrayList<>();

  private volatile WizardStatus status = WizardStatus.NEW;
  private volatile StepFailure blockingFailure;
  private String ownerId;
  private DraftRecord draft;
  private Map<String, Object> completionResult;

  public WizardController(WizardDefinition definition, DraftStore draftStore) {
    this(
        definition,
        draftStore,
        new WizardConfig(),
        new DefaultErrorClassifier(),
        Clock.systemDefaultZone(),
        null);
  }

  public WizardController(
      WizardDefinition definition,
      DraftStore draftStore,
      WizardConfig config,
      ErrorClassifier classifier,
      Clock clock,
      String ownerId) {
    this.definition = Objects.requireNonNull(definition, "definition");
    this.draftStore = Objects.requireNonNull(draftStore, "draftStore");
    this.config = Objects.requireNonNull(config, "config");
    this.committer = new StepCommitter(Objects.requireNonNull(classifier, "classifier"));
    this.ownerId = ownerId;
    this.context = new WizardContext(config.getReferencePrefix(), clock);
    this.steps = definition.newSteps();
    this.navigator = new StepNavigator(steps, context, guard, classifier, this::completeWizard);
  }

  public void addListener(WizardListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public void removeListener(WizardListener listener) {
    listeners.remove(listener);
  }

  /** Show the first step of a new wizard. */
  public NavigationResult start() {
    lock.lock();
    try {
      requireStatus(WizardStatus.NEW, "start");
      navigator.start();
      status = WizardStatus.ACTIVE;
      LOG.info(
          "Started wizard {} ({}) reference {}",
          context.wizardId(),
          definition.getType(),
          context.referenceNumber());
      publish(
          new WizardEvent.WizardStarted(
              context.wizardId(), definition.getType(), context.referenceNumber()));
      return NavigationResult.moved(0, steps.get(0).id());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Validate and commit the current step, then move forward. On the last step this finishes the
   * wizard.
   */
  public NavigationResult next() {
    lock.lock();
    try {
      Optional<NavigationResult> blocked = checkNavigable();
      if (blocked.isPresent()) {
        return blocked.get();
      }
      String fromStep = navigator.currentStep().id();
      boolean wasCommitted = guard.hasCommitted(fromStep);

      NavigationResult result;
      try {
        result = navigator.goNext();
      } catch (IllegalStateException e) {
        if (context.isDestroyed()) {
          return NavigationResult.cancelled(navigator.current(), fromStep);
        }
        throw e;
      }

      result = settle(result);
      if (result.kind() == NavigationResult.Kind.MOVED) {
        LOG.info(
            "Wizard {} advanced from {} to {}{}",
            context.wizardId(),
            fromStep,
            result.stepId(),
            wasCommitted ? " (already committed)" : "");
        publish(
            new WizardEvent.StepAdvanced(context.wizardId(), fromStep, result.stepId(), wasCommitted));
      }
      return result;
    } finally {
      lock.unlock();
    }
  }

  /** Go back one step. Never validates and never calls a remote service. */
  public NavigationResult previous() {
    lock.lock();
    try {
      Optional<NavigationResult> blocked = checkNavigable();
      if (blocked.isPresent()) {
        return blocked.get();
      }
      String fromStep = navigator.currentStep().id();
      NavigationResult result;
      try {
        result = navigator.goBack();
      } catch (IllegalStateException e) {
        if (context.isDestroyed()) {
          return NavigationResult.cancelled(navigator.current(), fromStep);
        }
        throw e;
      }
      if (result.moved()) {
        LOG.debug("Wizard {} returned from {} to {}", context.wizardId(), fromStep, result.stepId());
        publish(new WizardEvent.StepReturned(context.wizardId(), fromStep, result.stepId()));
      }
      return result;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Jump back to any earlier step. Like {@link #previous()} it never validates and never calls a
   * remote service; committed steps stay committed.
   *
   * @throws IndexOutOfBoundsException if there is no step at {@code index}
   */
  public NavigationResult goToStep(int index) {
    lock.lock();
    try {
      Optional<NavigationResult> blocked = checkNavigable();
      if (blocked.isPresent()) {
        return blocked.get();
      }
      String fromStep = navigator.currentStep().id();
      NavigationResult result;
      try {
        result = navigator.goTo(index);
      } catch (IllegalStateException e) {
        if (context.isDestroyed()) {
          return NavigationResult.cancelled(navigator.current(), fromStep);
        }
        throw e;
      }
      if (result.moved()) {
        LOG.debug("Wizard {} jumped from {} to {}", context.wizardId(), fromStep, result.stepId());
        publish(new WizardEvent.StepReturned(context.wizardId(), fromStep, result.stepId()));
      }
      return result;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Run the final operation. Used to retry a failed finish; a successful next() on the last step
   * finishes on its own.
   *
   * @throws IllegalStateException if the wizard is not on the last step or that step has not been
   *     committed
   */
  public NavigationResult finish() {
    lock.lock();
    try {
      Optional<NavigationResult> blocked = checkNavigable();
      if (blocked.isPresent()) {
        return blocked.get();
      }
      int last = steps.size() - 1;
      WizardStep lastStep = steps.get(last);
      if (!navigator.isLast() || !guard.hasCommitted(lastStep.id())) {
        throw new IllegalStateException(
            "Cannot finish wizard " + context.wizardId() + ": step " + lastStep.id()
                + " has not been committed");
      }
      try {
        return settle(completeWizard());
      } catch (IllegalStateException e) {
        if (context.isDestroyed() && status == WizardStatus.CANCELLED) {
          return NavigationResult.cancelled(last, lastStep.id());
        }
        throw e;
      }
    } finally {
      lock.unlock();
    }
  }

  /** Same as {@code cancel(false)}. */
  public CancelResult cancel() {
    return cancel(false);
  }

  /**
   * Discard the wizard. When a step already created remote records, nothing is discarded unless
   * {@code confirmed} is true. Does not wait for an in-flight remote call; its response is dropped.
   * A wizard that is already closing as finished is not cancelled.
   */
  public CancelResult cancel(boolean confirmed) {
    String wizardId = context.wizardId();
    boolean hadCommitted;
    synchronized (closeLock) {
      WizardStatus current = status;
      if (current == WizardStatus.COMPLETED || current == WizardStatus.CANCELLED) {
        return CancelResult.ALREADY_CLOSED;
      }
      hadCommitted = guard.anyCommitted();
      if (hadCommitted && !confirmed && config.isConfirmCancelWhenCommitted()) {
        LOG.info("Cancel of wizard {} needs confirmation: steps already committed", wizardId);
        return CancelResult.CONFIRMATION_REQUIRED;
      }
      status = WizardStatus.CANCELLED;
      context.destroy();
      guard.resetAll();
    }
    String currentDraftId = draftId();
    if (config.isDeleteDraftOnCancel() && currentDraftId != null) {
      draftStore.delete(currentDraftId);
    }
    LOG.info("Cancelled wizard {} (committed steps: {})", wizardId, hadCommitted);
    publish(new WizardEvent.WizardCancelled(wizardId, hadCommitted));
    return CancelResult.CANCELLED;
  }

  /**
   * Persist the current state. Waits until any in-flight command has settled.
   *
   * @return the draft id, stable across repeated saves of the same wizard
   */
  public String saveDraft() {
    lock.lock();
    try {
      if (status == WizardStatus.NEW
          || status == WizardStatus.COMPLETED
          || status == WizardStatus.CANCELLED) {
        throw new IllegalStateException(
            "Cannot save a draft of wizard " + context.wizardId() + " in status " + status);
      }
      Map<String, Map<String, Object>> stepData = new LinkedHashMap<>();
      for (WizardStep step : steps) {
        stepData.put(step.id(), step.collectData());
      }
      DraftRecord record =
          draft == null
              ? DraftRecord.create(
                  definition.getType(),
                  ownerId,
                  context.referenceNumber(),
                  context.toSnapshot(),
                  navigator.current(),
                  guard.flags(),
                  stepData)
              : draft.withState(context.toSnapshot(), navigator.current(), guard.flags(), stepData);

      String id = draftStore.save(record);
      draft = record.withId(id);
      LOG.info("Saved draft {} of wizard {} at step {}", id, context.wizardId(), navigator.current());
      publish(new WizardEvent.DraftSaved(context.wizardId(), id, navigator.current()));
      return id;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Resume a saved wizard into this (not yet started) controller. Restores context, guard flags
   * and step data and shows the saved step without re-running any validate or onNext.
   *
   * @throws DraftNotFoundException if no draft has this id
   * @throws IllegalArgumentException if the draft belongs to another wizard type, is completed or
   *     points past the last step
   */
  public NavigationResult loadDraft(String id) {
    lock.lock();
    try {
      requireStatus(WizardStatus.NEW, "load a draft into");
      DraftRecord record = draftStore.load(id).orElseThrow(() -> new DraftNotFoundException(id));
      if (!definition.getType().equals(record.wizardType())) {
        throw new IllegalArgumentException(
            "Draft " + id + " belongs to wizard type " + record.wizardType() + ", not "
                + definition.getType());
      }
      if (record.completed()) {
        throw new IllegalArgumentException("Draft " + id + " belongs to a finished wizard");
      }
      if (record.currentStepIndex() >= steps.size()) {
        throw new IllegalArgumentException(
            "Draft " + id + " points to step " + record.currentStepIndex() + " but wizard "
                + definition.getType() + " has " + steps.size() + " steps");
      }

      context.restoreFromSnapshot(record.contextSnapshot());
      guard.restore(record.guardFlags());
      for (WizardStep step : steps) {
        Map<String, Object> saved = record.stepData().get(step.id());
        if (saved != null) {
          step.restoreData(saved);
        }
      }
      navigator.resumeAt(record.currentStepIndex());

      draft = record;
      if (ownerId == null) {
        ownerId = record.ownerId();
      }
      status = WizardStatus.ACTIVE;
      publish(new WizardEvent.DraftLoaded(context.wizardId(), id, record.currentStepIndex()));
      return NavigationResult.moved(record.currentStepIndex(), navigator.currentStep().id());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Lift the navigation block after the user signed in again. The step that failed can then be
   * retried.
   *
   * @return false if navigation was not blocked by authentication
   */
  public boolean reauthenticated() {
    lock.lock();
    try {
      if (status != WizardStatus.AUTH_REQUIRED) {
        return false;
      }
      status = WizardStatus.ACTIVE;
      blockingFailure = null;
      LOG.info("Wizard {} re-authenticated", context.wizardId());
      publish(new WizardEvent.Reauthenticated(context.wizardId()));
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Explicitly undo a committed step so it can be edited and committed again: clears its guard
   * flag and the context values it produced, then walks back to it. Remote records it created are
   * not touched.
   *
   * @throws IllegalStateException if the step lies ahead of the current step
   */
  public NavigationResult resetStep(int index) {
    lock.lock();
    try {
      Optional<NavigationResult> blocked = checkNavigable();
      if (blocked.isPresent()) {
        return blocked.get();
      }
      if (index < 0 || index >= steps.size()) {
        throw new IndexOutOfBoundsException("No step at index " + index);
      }
      if (index > navigator.current()) {
        throw new IllegalStateException(
            "Cannot reset step " + index + " ahead of the current step " + navigator.current());
      }
      WizardStep step = steps.get(index);
      guard.reset(step.id());
      for (String key : step.committedKeys()) {
        context.reset(key);
      }
      navigator.reopen(index);
      LOG.info("Reset step {} of wizard {}", step.id(), context.wizardId());
      publish(new WizardEvent.StepReset(context.wizardId(), step.id()));
      return NavigationResult.moved(navigator.current(), step.id());
    } finally {
      lock.unlock();
    }
  }

  public NavigationResult resetCurrentStep() {
    return resetStep(navigator.current());
  }

  /** Unfinished drafts of this wizard type, most recent first. */
  public List<DraftRecord> listResumableDrafts() {
    return draftStore.findIncomplete(definition.getType(), config.getDraftListLimit());
  }

  public WizardStatus status() {
    return status;
  }

  public String wizardType() {
    return definition.getType();
  }

  public String wizardId() {
    return context.wizardId();
  }

  public String referenceNumber() {
    return context.referenceNumber();
  }

  public String ownerId() {
    return ownerId;
  }

  /** Id of the draft this wizard was saved to or loaded from; null if none. */
  public String draftId() {
    DraftRecord current = draft;
    return current == null ? null : current.id();
  }

  /** Read-only view of the live context. Unusable once the wizard finished or was cancelled. */
  public ContextView context() {
    return context.view();
  }

  /** Copy of the live context state, in the shape stored in drafts. */
  public Map<String, Object> contextSnapshot() {
    lock.lock();
    try {
      return context.toSnapshot();
    } finally {
      lock.unlock();
    }
  }

  public int currentIndex() {
    return navigator.current();
  }

  public WizardStep currentStep() {
    return navigator.currentStep();
  }

  /** Step instance at {@code index}, for the presentation layer to bind its inputs. */
  public WizardStep step(int index) {
    return steps.get(index);
  }

  public List<StepState> stepStates() {
    return navigator.states();
  }

  public double progressPercentage() {
    return navigator.progressPercentage();
  }

  public boolean isCommitted(String stepId) {
    return guard.hasCommitted(stepId);
  }

  public Map<String, Boolean> guardFlags() {
    return guard.flags();
  }

  /** Failure that put the wizard in AUTH_REQUIRED or HALTED. */
  public Optional<StepFailure> blockingFailure() {
    return Optional.ofNullable(blockingFailure);
  }

  /** Context values at the moment the wizard finished; empty before that. */
  public Map<String, Object> completionResult() {
    return completionResult == null ? Map.of() : completionResult;
  }

  /**
   * Final operation, invoked by the navigator when the last step advances and by {@link
   * #finish()}. Runs under the lock held by the calling command.
   */
  private NavigationResult completeWizard() {
    int last = steps.size() - 1;
    String lastStepId = steps.get(last).id();

    if (!guard.hasCommitted(WizardDefinition.FINISH_GUARD_KEY)) {
      StepOutcome outcome =
          committer.commit(
              WizardDefinition.FINISH_GUARD_KEY,
              definition.getFinishService(),
              context,
              guard,
              Map.of(),
              definition.getFinishIdentifierKeys());
      if (outcome instanceof StepOutcome.RetryWithErrors retry) {
        return NavigationResult.retry(last, lastStepId, retry.failure());
      }
      if (outcome instanceof StepOutcome.Fatal fatal) {
        return NavigationResult.fatal(last, lastStepId, fatal.failure());
      }
    }

    String wizardId = context.wizardId();
    String reference = context.referenceNumber();
    Map<String, Object> values;
    synchronized (closeLock) {
      if (status == WizardStatus.CANCELLED) {
        return NavigationResult.cancelled(last, lastStepId);
      }
      Map<String, Object> result = context.toSnapshot();
      @SuppressWarnings("unchecked")
      Map<String, Object> snapshotValues =
          (Map<String, Object>) result.get(WizardContext.SNAPSHOT_VALUES);
      values = snapshotValues;
      completionResult = Collections.unmodifiableMap(values);

      if (draft != null) {
        if (config.isRetainCompletedDrafts()) {
          DraftRecord completed =
              draft.withState(result, last, guard.flags(), Map.of()).asCompleted();
          draftStore.save(completed);
          draft = completed;
        } else {
          draftStore.delete(draft.id());
        }
      }

      status = WizardStatus.COMPLETED;
      context.destroy();
      guard.resetAll();
    }
    LOG.info("Finished wizard {} reference {}", wizardId, reference);
    publish(new WizardEvent.WizardFinished(wizardId, reference, values));
    return NavigationResult.finished(last, lastStepId);
  }

  /** Apply the status side effects of a navigation result. */
  private NavigationResult settle(NavigationResult result) {
    if (status == WizardStatus.CANCELLED) {
      return NavigationResult.cancelled(result.index(), result.stepId());
    }
    StepFailure failure = result.failure();
    switch (result.kind()) {
      case RETRY -> publish(
          new WizardEvent.StepRetryRequired(
              context.wizardId(),
              result.stepId(),
              failure.kind(),
              failure.message(),
              failure.callToAction()));
      case FATAL -> {
        if (failure.kind() == ErrorKind.CANCELLED) {
          return NavigationResult.cancelled(result.index(), result.stepId());
        }
        blockingFailure = failure;
        if (failure.kind() == ErrorKind.AUTH) {
          status = WizardStatus.AUTH_REQUIRED;
          LOG.warn("Wizard {} needs re-authentication: {}", context.wizardId(), failure.message());
          publish(
              new WizardEvent.AuthenticationRequired(
                  context.wizardId(), result.stepId(), failure.message()));
        } else {
          status = WizardStatus.HALTED;
          LOG.error(
              "Wizard {} halted at step {}: {}",
              context.wizardId(),
              result.stepId(),
              failure.message());
          publish(
              new WizardEvent.WizardHalted(
                  context.wizardId(), result.stepId(), failure.kind(), failure.message()));
        }
      }
      default -> {
        // nothing to record
      }
    }
    return result;
  }

  private Optional<NavigationResult> checkNavigable() {
    switch (status) {
      case NEW -> throw new IllegalStateException(
          "Wizard " + context.wizardId() + " has not been started");
      case COMPLETED -> throw new IllegalStateException(
          "Wizard " + context.wizardId() + " has already finished");
      case CANCELLED -> {
        return Optional.of(
            NavigationResult.cancelled(navigator.current(), navigator.currentStep().id()));
      }
      case AUTH_REQUIRED, HALTED -> {
        return Optional.of(
            NavigationResult.blocked(
                navigator.current(), navigator.currentStep().id(), blockingFailure));
      }
      default -> {
        return Optional.empty();
      }
    }
  }

  private void requireStatus(WizardStatus expected, String action) {
    if (status != expected) {
      throw new IllegalStateException(
          "Cannot " + action + " wizard " + context.wizardId() + " in status " + status);
    }
  }

  private void publish(WizardEvent event) {
    for (WizardListener listener : listeners) {
      try {
        listener.onEvent(event);
      } catch (RuntimeException e) {
        LOG.warn("Listener {} failed on {}", listener, event.getClass().getSimpleName(), e);
      }
    }
  }
}
