package com.acme.wizard.guard;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-step record of whether a step's remote mutation has already committed. A flag only moves
 * from false to true; it goes back to false solely through {@link #reset(String)} or {@link
 * #resetAll()}, which the controller calls on explicit context reset or discard.
 *
 * <p>One guard belongs to one wizard instance.
 */
public class IdempotencyGuard {

  private static final Logger LOG = LoggerFactory.getLogger(IdempotencyGuard.class);

  private final Map<String, Boolean> flags = new LinkedHashMap<>();

  public synchronized boolean hasCommitted(String stepId) {
    return Boolean.TRUE.equals(flags.get(stepId));
  }

  public synchronized void markCommitted(String stepId) {
    if (stepId == null || stepId.isBlank()) {
      throw new IllegalArgumentException("stepId must not be blank");
    }
    if (!Boolean.TRUE.equals(flags.put(stepId, Boolean.TRUE))) {
      LOG.debug("Guard set for step {}", stepId);
    }
  }

  public synchronized void reset(String stepId) {
    if (flags.remove(stepId) != null) {
      LOG.info("Guard reset for step {}", stepId);
    }
  }

  public synchronized void resetAll() {
    flags.clear();
  }

  public synchronized boolean anyCommitted() {
    return flags.containsValue(Boolean.TRUE);
  }

  /** Copy of the current flags, in the order the steps first committed. */
  public synchronized Map<String, Boolean> flags() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(flags));
  }

  /** Replace all flags, e.g. when resuming from a draft. False entries are dropped. */
  public synchronized void restore(Map<String, Boolean> saved) {
    flags.clear();
    saved.forEach(
        (stepId, committed) -> {
          if (Boolean.TRUE.equals(committed)) {
            flags.put(stepId, Boolean.TRUE);
          }
        });
  }
}
