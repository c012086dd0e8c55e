package se.alipsa.pddlls.core;

import se.alipsa.pddlls.core.model.FileInfo;

/** Called synchronously, on the thread that changed the workspace, after each transition. */
@FunctionalInterface
public interface WorkspaceListener {
  void onFileEvent(FileEvent event, FileInfo fileInfo);
}
