package com.acme.wizard.core;

/** Failure that may succeed when the same operation is attempted again. */
public class TransientException extends RuntimeException {
  public TransientException(String message) {
    super(message);
  }

  public TransientException(String message, Throwable e) {
    super(message, e);
  }
}
