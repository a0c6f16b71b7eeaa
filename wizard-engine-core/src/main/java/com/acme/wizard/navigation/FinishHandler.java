package com.acme.wizard.navigation;

/** Invoked by the navigator when the last step advances. */
@FunctionalInterface
public interface FinishHandler {

  NavigationResult finish();
}
