package com.acme.wizard.draft;

import java.util.List;
import java.util.Optional;

/** Persistence boundary for wizard drafts. */
public interface DraftStore {

  /**
   * Insert the draft when its id is null, otherwise overwrite the stored draft with that id.
   *
   * @return the draft's id
   */
  String save(DraftRecord draft);

  Optional<DraftRecord> load(String id);

  /** Delete a draft. Deleting an unknown id is not an error. */
  void delete(String id);

  /** Unfinished drafts of one wizard type, most recently updated first. */
  List<DraftRecord> findIncomplete(String wizardType, int limit);
}
