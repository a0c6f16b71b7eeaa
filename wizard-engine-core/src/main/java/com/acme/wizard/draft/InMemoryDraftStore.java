package com.acme.wizard.draft;

import com.acme.wizard.core.Jsons;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Draft store backed by a map. Stored and returned records never share mutable state with the
 * caller: snapshots and step data are deep-copied on the way in and out.
 */
public class InMemoryDraftStore implements DraftStore {

  private static final Logger LOG = LoggerFactory.getLogger(InMemoryDraftStore.class);

  private final Map<String, DraftRecord> drafts = new ConcurrentHashMap<>();

  @Override
  public String save(DraftRecord draft) {
    String id = draft.id() != null ? draft.id() : UUID.randomUUID().toString();
    drafts.put(id, copy(draft.withId(id)));
    LOG.debug("Saved draft {} at step {}", id, draft.currentStepIndex());
    return id;
  }

  @Override
  public Optional<DraftRecord> load(String id) {
    DraftRecord stored = drafts.get(id);
    return stored == null ? Optional.empty() : Optional.of(copy(stored));
  }

  @Override
  public void delete(String id) {
    if (drafts.remove(id) != null) {
      LOG.debug("Deleted draft {}", id);
    }
  }

  @Override
  public List<DraftRecord> findIncomplete(String wizardType, int limit) {
    return drafts.values().stream()
        .filter(d -> !d.completed() && d.wizardType().equals(wizardType))
        .sorted(Comparator.comparing(DraftRecord::updatedAt).reversed())
        .limit(limit)
        .map(InMemoryDraftStore::copy)
        .toList();
  }

  public int size() {
    return drafts.size();
  }

  private static DraftRecord copy(DraftRecord draft) {
    Map<String, Map<String, Object>> stepData = new LinkedHashMap<>();
    draft.stepData().forEach((stepId, data) -> stepData.put(stepId, Jsons.deepCopy(data)));
    return new DraftRecord(
        draft.id(),
        draft.wizardType(),
        draft.ownerId(),
        draft.referenceNumber(),
        Jsons.deepCopy(draft.contextSnapshot()),
        draft.currentStepIndex(),
        draft.guardFlags(),
        stepData,
        draft.createdAt(),
        draft.updatedAt(),
        draft.completed());
  }
}
