package se.alipsa.pddlls.core.model;

/** Content-derived classification of a file; decided once per parse. */
public enum FileKind {
  DOMAIN,
  PROBLEM,
  PLAN,
  HAPPENINGS,
  UNKNOWN
}
