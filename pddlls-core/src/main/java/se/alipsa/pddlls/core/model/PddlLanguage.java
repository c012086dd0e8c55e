package se.alipsa.pddlls.core.model;

/** Language tag supplied by the caller together with the file text. */
public enum PddlLanguage {
  /** Generic planning language; resolved to domain, problem or unknown by content. */
  PDDL,
  PLAN,
  HAPPENINGS
}
