package com.datapipeline.setup.collaborator;

/** Local snapshot of what was last processed, used to compute incremental changes. */
public interface StateManager {
  ChangeSet detectChanges() throws Exception;

  void saveCurrentState() throws Exception;
}
