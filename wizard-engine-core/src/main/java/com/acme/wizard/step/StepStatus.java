package com.acme.wizard.step;

/** Lifecycle status of a single step within one wizard instance */
public enum StepStatus {
  /** Step has never been shown */
  NOT_STARTED,

  /** Step has been shown at least once and has not advanced since its last activation */
  ACTIVE,

  /** Step advanced successfully; its guard flag is set */
  COMPLETED
}
