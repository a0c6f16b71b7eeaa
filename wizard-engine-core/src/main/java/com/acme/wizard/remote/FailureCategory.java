package com.acme.wizard.remote;

/** Failure categories reported by a remote step service. */
public enum FailureCategory {
  VALIDATION,
  UNAUTHORIZED,
  FORBIDDEN,
  NOT_FOUND,
  CONFLICT,
  SERVER_ERROR,
  NETWORK_ERROR,
  TIMEOUT
}
