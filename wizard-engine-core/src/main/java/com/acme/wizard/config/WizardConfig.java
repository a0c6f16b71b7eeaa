package com.acme.wizard.config;

/**
 * Behavioural settings for a wizard controller. Pure POJO - no framework dependencies.
 */
public class WizardConfig {

  private String referencePrefix = "WIZ";
  private boolean confirmCancelWhenCommitted = true;
  private boolean deleteDraftOnCancel = true;
  private boolean retainCompletedDrafts = true;
  private int draftListLimit = 50;

  public String getReferencePrefix() {
    return referencePrefix;
  }

  public void setReferencePrefix(String referencePrefix) {
    if (referencePrefix == null || referencePrefix.isBlank()) {
      throw new IllegalArgumentException("referencePrefix must not be blank");
    }
    this.referencePrefix = referencePrefix;
  }

  /** When false, cancel() discards immediately even if remote records already exist. */
  public boolean isConfirmCancelWhenCommitted() {
    return confirmCancelWhenCommitted;
  }

  public void setConfirmCancelWhenCommitted(boolean confirmCancelWhenCommitted) {
    this.confirmCancelWhenCommitted = confirmCancelWhenCommitted;
  }

  public boolean isDeleteDraftOnCancel() {
    return deleteDraftOnCancel;
  }

  public void setDeleteDraftOnCancel(boolean deleteDraftOnCancel) {
    this.deleteDraftOnCancel = deleteDraftOnCancel;
  }

  /** Keep the draft row (flagged completed) after finish instead of deleting it. */
  public boolean isRetainCompletedDrafts() {
    return retainCompletedDrafts;
  }

  public void setRetainCompletedDrafts(boolean retainCompletedDrafts) {
    this.retainCompletedDrafts = retainCompletedDrafts;
  }

  public int getDraftListLimit() {
    return draftListLimit;
  }

  public void setDraftListLimit(int draftListLimit) {
    if (draftListLimit <= 0) {
      throw new IllegalArgumentException("draftListLimit must be positive");
    }
    this.draftListLimit = draftListLimit;
  }
}
