package se.alipsa.pddlls.core.model;

public enum FileStatus {
  /** Text or dependencies changed since the last parse. */
  DIRTY,
  PARSED
}
