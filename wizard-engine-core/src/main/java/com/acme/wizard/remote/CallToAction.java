package com.acme.wizard.remote;

/** What the presentation layer should offer the user alongside a failure message. */
public enum CallToAction {
  CORRECT_FIELDS,
  VIEW_CONFLICT,
  REAUTHENTICATE,
  RETRY,
  CONTACT_SUPPORT,
  NONE
}
