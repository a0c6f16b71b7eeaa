package com.acme.wizard.context;

/** Thrown when a finalized context slot is written before an explicit reset. */
public class ImmutableFieldException extends IllegalStateException {

  private final String key;

  public ImmutableFieldException(String key) {
    super("Context field '" + key + "' is finalized and cannot be changed until reset");
    this.key = key;
  }

  public String getKey() {
    return key;
  }
}
