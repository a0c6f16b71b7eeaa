package com.acme.wizard.draft;

/** Thrown when a draft id does not resolve to a stored draft. */
public class DraftNotFoundException extends RuntimeException {

  private final String draftId;

  public DraftNotFoundException(String draftId) {
    super("Draft not found: " + draftId);
    this.draftId = draftId;
  }

  public String getDraftId() {
    return draftId;
  }
}
