package com.acme.wizard.step;

import com.acme.wizard.context.WizardContext;
import com.acme.wizard.guard.IdempotencyGuard;
import com.acme.wizard.remote.ErrorClassifier;
import com.acme.wizard.remote.FailureCategory;
import com.acme.wizard.remote.RemoteResult;
import com.acme.wizard.remote.RemoteStepService;
import com.acme.wizard.remote.StepFailure;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared commit routine for steps and for the wizard's finish operation.
 *
 * <ol>
 *   <li>stage local values into the context (not finalized) so the remote service can read them
 *   <li>call the remote service, if any, and classify any failure; a success that lacks a mapped
 *       identifier counts as a server error
 *   <li>write staged values and returned identifiers, finalize them and set the guard flag, all
 *       in one atomic context update that is dropped if the wizard was cancelled meanwhile
 * </ol>
 *
 * Callers check the guard before calling; this class never skips.
 */
public final class StepCommitter {

  private static final Logger LOG = LoggerFactory.getLogger(StepCommitter.class);

  private final ErrorClassifier classifier;

  public StepCommitter(ErrorClassifier classifier) {
    this.classifier = classifier;
  }

  public ErrorClassifier classifier() {
    return classifier;
  }

  /**
   * @param guardKey guard flag to set on success (the step id, or the finish key)
   * @param service remote call to perform; null for purely local commits
   * @param staged local values to write and finalize
   * @param identifierKeys response identifier name to context key; empty copies identifiers as-is
   */
  public StepOutcome commit(
      String guardKey,
      RemoteStepService service,
      WizardContext context,
      IdempotencyGuard guard,
      Map<String, Object> staged,
      Map<String, String> identifierKeys) {
    if (context.isDestroyed()) {
      return new StepOutcome.Fatal(StepFailure.cancelled(guardKey));
    }

    long generation;
    try {
      if (service != null) {
        staged.forEach(
            (key, value) -> {
              if (!context.isFinalized(key)) {
                context.set(key, value);
              }
            });
      }
      generation = context.generation();
    } catch (IllegalStateException e) {
      return context.isDestroyed()
          ? new StepOutcome.Fatal(StepFailure.cancelled(guardKey))
          : StepOutcome.fromFailure(classifier.classify(guardKey, e));
    }

    Map<String, Object> updates = new LinkedHashMap<>(staged);
    if (service != null) {
      RemoteResult result;
      try {
        LOG.debug("Calling remote service for {}", guardKey);
        result = service.execute(context.view());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return StepOutcome.fromFailure(classifier.classify(guardKey, e));
      } catch (Exception e) {
        return StepOutcome.fromFailure(classifier.classify(guardKey, e));
      }

      if (result == null) {
        return StepOutcome.fromFailure(
            classifier.classify(
                guardKey, new IllegalStateException("Remote service returned no result")));
      }
      if (result instanceof RemoteResult.Failure failure) {
        return StepOutcome.fromFailure(classifier.classify(guardKey, failure));
      }
      Map<String, Object> identifiers = ((RemoteResult.Success) result).identifiers();
      List<String> missing = missingIdentifiers(identifiers, identifierKeys);
      if (!missing.isEmpty()) {
        LOG.warn("Remote response for {} is missing identifiers {}", guardKey, missing);
        return StepOutcome.fromFailure(
            classifier.classify(
                guardKey,
                new RemoteResult.Failure(
                    FailureCategory.SERVER_ERROR,
                    "The server response did not contain " + String.join(", ", missing),
                    List.of())));
      }
      updates.putAll(mapIdentifiers(identifiers, identifierKeys));
    }

    try {
      boolean applied =
          context.applyCommit(generation, updates, () -> guard.markCommitted(guardKey));
      if (!applied) {
        LOG.warn("Result of {} arrived after the wizard was reset or cancelled; discarded", guardKey);
        return new StepOutcome.Fatal(StepFailure.cancelled(guardKey));
      }
    } catch (IllegalStateException e) {
      return StepOutcome.fromFailure(classifier.classify(guardKey, e));
    }

    LOG.info("Committed {} (fields {})", guardKey, updates.keySet());
    return StepOutcome.advance();
  }

  private static List<String> missingIdentifiers(
      Map<String, Object> identifiers, Map<String, String> identifierKeys) {
    List<String> missing = new ArrayList<>();
    for (String responseName : identifierKeys.keySet()) {
      if (identifiers.get(responseName) == null) {
        missing.add(responseName);
      }
    }
    return missing;
  }

  private static Map<String, Object> mapIdentifiers(
      Map<String, Object> identifiers, Map<String, String> identifierKeys) {
    if (identifierKeys.isEmpty()) {
      return identifiers;
    }
    Map<String, Object> mapped = new LinkedHashMap<>();
    identifierKeys.forEach(
        (responseName, contextKey) -> mapped.put(contextKey, identifiers.get(responseName)));
    return mapped;
  }
}
