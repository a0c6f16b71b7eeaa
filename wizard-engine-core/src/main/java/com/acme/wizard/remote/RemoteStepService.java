package com.acme.wizard.remote;

import com.acme.wizard.context.ContextView;

/**
 * Boundary for the side-effecting call behind a step (or behind the wizard's finish). An
 * implementation either returns a {@link RemoteResult} or throws; thrown exceptions are
 * classified by the {@link ErrorClassifier} before they reach navigation.
 */
@FunctionalInterface
public interface RemoteStepService {

  RemoteResult execute(ContextView context) throws Exception;
}
