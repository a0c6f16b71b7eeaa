package com.acme.wizard.step;

import com.acme.wizard.context.ContextView;
import com.acme.wizard.context.WizardContext;
import com.acme.wizard.guard.IdempotencyGuard;
import java.util.Map;
import java.util.Set;

/**
 * Contract every wizard step implements. The navigator drives the lifecycle:
 *
 * <pre>
 *   setup()            once, before the first activation
 *   onShow(view)       on every activation
 *   validate(view)     before every forward attempt, pure
 *   onNext(ctx, guard) forward attempt, the only place with side effects
 *   onHide(view)       on leaving in either direction
 * </pre>
 */
public interface WizardStep {

  /** Stable identity; keys the idempotency guard and draft step data. */
  String id();

  default String title() {
    return id();
  }

  default String description() {
    return "";
  }

  /** Context keys that earlier steps must have written and finalized. */
  default Set<String> requiredKeys() {
    return Set.of();
  }

  /** Context keys this step writes and finalizes when it commits. */
  default Set<String> producedKeys() {
    return Set.of();
  }

  /** Context keys a reset of this step must clear. */
  default Set<String> committedKeys() {
    return producedKeys();
  }

  void setup();

  void onShow(ContextView context);

  ValidationResult validate(ContextView context);

  StepOutcome onNext(WizardContext context, IdempotencyGuard guard);

  void onHide(ContextView context);

  Map<String, Object> collectData();

  /** Re-seed local editable data from a saved draft. */
  default void restoreData(Map<String, Object> data) {
  }
}
