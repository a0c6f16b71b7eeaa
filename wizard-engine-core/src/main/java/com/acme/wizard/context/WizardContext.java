package com.acme.wizard.context;

import com.acme.wizard.core.Jsons;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared state bag owned by exactly one wizard instance. Steps exchange data only through this
 * object. A slot marked finalized stays immutable until {@link #reset(String)} or {@link
 * #reset()}.
 *
 * <p>Every reset, restore or destroy bumps the {@link #generation()} counter. Writes performed
 * on behalf of a remote response go through {@link #applyCommit} which refuses to apply when the
 * generation moved on, so a response arriving after cancellation never lands in a discarded
 * context.
 */
public class WizardContext implements ContextView {

  private static final Logger LOG = LoggerFactory.getLogger(WizardContext.class);

  public static final String SNAPSHOT_WIZARD_ID = "wizardId";
  public static final String SNAPSHOT_REFERENCE = "referenceNumber";
  public static final String SNAPSHOT_VALUES = "values";
  public static final String SNAPSHOT_FINALIZED = "finalized";

  private static final DateTimeFormatter REFERENCE_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

  private final Map<String, Object> values = new LinkedHashMap<>();
  private final Set<String> finalized = new LinkedHashSet<>();
  private final ContextView readOnlyView = new ReadOnlyView();

  private String wizardId;
  private String referenceNumber;
  private long generation;
  private boolean destroyed;

  public WizardContext() {
    this("WIZ", Clock.systemDefaultZone());
  }

  public WizardContext(String referencePrefix, Clock clock) {
    this.wizardId = UUID.randomUUID().toString();
    this.referenceNumber = buildReferenceNumber(referencePrefix, wizardId, clock);
  }

  /** Format: {PREFIX}-{yyyyMMddHHmmss}-{first four characters of the wizard id}. */
  static String buildReferenceNumber(String prefix, String wizardId, Clock clock) {
    String timestamp = LocalDateTime.now(clock).format(REFERENCE_TIMESTAMP);
    String shortId = wizardId.substring(0, 4).toUpperCase(Locale.ROOT);
    return prefix + "-" + timestamp + "-" + shortId;
  }

  @Override
  public synchronized String wizardId() {
    return wizardId;
  }

  @Override
  public synchronized String referenceNumber() {
    return referenceNumber;
  }

  @Override
  public synchronized Object get(String key) {
    ensureActive();
    return values.get(key);
  }

  @Override
  public synchronized boolean contains(String key) {
    ensureActive();
    return values.containsKey(key);
  }

  @Override
  public synchronized boolean isFinalized(String key) {
    ensureActive();
    return finalized.contains(key);
  }

  @Override
  public synchronized Set<String> keys() {
    ensureActive();
    return Set.copyOf(values.keySet());
  }

  /**
   * Write a slot.
   *
   * @throws ImmutableFieldException if the slot is finalized
   */
  public synchronized void set(String key, Object value) {
    ensureActive();
    requireKey(key);
    if (finalized.contains(key)) {
      throw new ImmutableFieldException(key);
    }
    values.put(key, Jsons.normalize(value));
  }

  public synchronized void markFinalized(String key) {
    ensureActive();
    requireKey(key);
    if (!values.containsKey(key)) {
      throw new IllegalArgumentException("Cannot finalize unset context field: " + key);
    }
    finalized.add(key);
  }

  /**
   * Atomically write and finalize {@code updates}, then run {@code onApplied}, but only if the
   * context is still at {@code expectedGeneration}. Values already finalized with an equal value
   * are accepted as-is.
   *
   * @return false when the context was reset, restored or destroyed in the meantime
   * @throws ImmutableFieldException if an update would change a finalized slot
   */
  public synchronized boolean applyCommit(
      long expectedGeneration, Map<String, Object> updates, Runnable onApplied) {
    if (destroyed || generation != expectedGeneration) {
      LOG.warn(
          "Discarding commit for wizard {}: generation {} is stale (current {}, destroyed={})",
          wizardId,
          expectedGeneration,
          generation,
          destroyed);
      return false;
    }

    Map<String, Object> normalized = new LinkedHashMap<>();
    updates.forEach((key, value) -> normalized.put(requireKey(key), Jsons.normalize(value)));
    for (Map.Entry<String, Object> entry : normalized.entrySet()) {
      if (finalized.contains(entry.getKey())
          && !Objects.equals(values.get(entry.getKey()), entry.getValue())) {
        throw new ImmutableFieldException(entry.getKey());
      }
    }

    values.putAll(normalized);
    finalized.addAll(normalized.keySet());
    onApplied.run();
    return true;
  }

  public synchronized long generation() {
    return generation;
  }

  public synchronized boolean isDestroyed() {
    return destroyed;
  }

  /** Read-only facade over this context; casting it back to WizardContext is not possible. */
  public ContextView view() {
    return readOnlyView;
  }

  public synchronized Map<String, Object> toSnapshot() {
    ensureActive();
    Map<String, Object> snapshot = new LinkedHashMap<>();
    snapshot.put(SNAPSHOT_WIZARD_ID, wizardId);
    snapshot.put(SNAPSHOT_REFERENCE, referenceNumber);
    snapshot.put(SNAPSHOT_VALUES, Jsons.deepCopy(values));
    snapshot.put(SNAPSHOT_FINALIZED, new ArrayList<>(finalized));
    return snapshot;
  }

  /** Replace the whole state with a snapshot previously produced by {@link #toSnapshot()}. */
  @SuppressWarnings("unchecked")
  public synchronized void restoreFromSnapshot(Map<String, Object> snapshot) {
    ensureActive();
    Objects.requireNonNull(snapshot, "snapshot");

    Object restoredValues = snapshot.getOrDefault(SNAPSHOT_VALUES, Map.of());
    Object restoredFinalized = snapshot.getOrDefault(SNAPSHOT_FINALIZED, List.of());
    if (!(restoredValues instanceof Map) || !(restoredFinalized instanceof Collection)) {
      throw new IllegalArgumentException("Malformed context snapshot: " + snapshot.keySet());
    }

    Object restoredId = snapshot.get(SNAPSHOT_WIZARD_ID);
    if (restoredId != null) {
      wizardId = restoredId.toString();
    }
    Object restoredReference = snapshot.get(SNAPSHOT_REFERENCE);
    if (restoredReference != null) {
      referenceNumber = restoredReference.toString();
    }

    values.clear();
    values.putAll(Jsons.deepCopy((Map<String, Object>) restoredValues));
    finalized.clear();
    for (Object key : (Collection<Object>) restoredFinalized) {
      finalized.add(String.valueOf(key));
    }
    generation++;

    LOG.debug(
        "Restored context {} with {} fields ({} finalized)", wizardId, values.size(), finalized.size());
  }

  /** Clear one slot including its finalized mark. */
  public synchronized void reset(String key) {
    ensureActive();
    values.remove(key);
    finalized.remove(key);
  }

  /** Clear every slot. The wizard id and reference number are kept. */
  public synchronized void reset() {
    ensureActive();
    values.clear();
    finalized.clear();
    generation++;
  }

  /** Drop all state for good. Any later access fails. */
  public synchronized void destroy() {
    values.clear();
    finalized.clear();
    generation++;
    destroyed = true;
    LOG.debug("Destroyed context {}", wizardId);
  }

  private void ensureActive() {
    if (destroyed) {
      throw new IllegalStateException("Wizard context " + wizardId + " has been destroyed");
    }
  }

  private static String requireKey(String key) {
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException("Context key must not be blank");
    }
    return key;
  }

  private final class ReadOnlyView implements ContextView {

    @Override
    public String wizardId() {
      return WizardContext.this.wizardId();
    }

    @Override
    public String referenceNumber() {
      return WizardContext.this.referenceNumber();
    }

    @Override
    public Object get(String key) {
      return WizardContext.this.get(key);
    }

    @Override
    public boolean contains(String key) {
      return WizardContext.this.contains(key);
    }

    @Override
    public boolean isFinalized(String key) {
      return WizardContext.this.isFinalized(key);
    }

    @Override
    public Set<String> keys() {
      return WizardContext.this.keys();
    }
  }
}
