package com.acme.wizard.event;

/**
 * Receives wizard lifecycle events. Called synchronously on the thread that performed the
 * operation; exceptions thrown by a listener are logged and do not affect the wizard.
 */
@FunctionalInterface
public interface WizardListener {

  void onEvent(WizardEvent event);
}
