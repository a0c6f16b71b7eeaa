package com.acme.wizard.core;

/** Failure that repeating the same operation with the same input cannot fix. */
public class PermanentException extends RuntimeException {
  public PermanentException(String message, Throwable cause) {
    super(message, cause);
  }
}
