package com.acme.wizard.remote;

/**
 * Maps raw remote failures into {@link StepFailure}s. The navigator only ever sees classified
 * failures.
 */
public interface ErrorClassifier {

  StepFailure classify(String stepId, RemoteResult.Failure failure);

  StepFailure classify(String stepId, Throwable error);
}
