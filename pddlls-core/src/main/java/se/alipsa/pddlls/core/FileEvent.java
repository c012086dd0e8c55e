package se.alipsa.pddlls.core;

public enum FileEvent {
  /** Once, when a URI is first stored. */
  INSERTED,
  /** After a parse whose version is newer than the last one announced for the URI. */
  UPDATED,
  /** Before a file leaves the workspace. */
  REMOVING
}
