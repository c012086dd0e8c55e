package se.alipsa.pddlls.core.model;

/** Repeatable domain constructs, keyed by the section keyword that declares them. */
public enum ConstructKind {
  ACTION(":action"),
  DURATIVE_ACTION(":durative-action"),
  DERIVED(":derived"),
  PROCESS(":process"),
  EVENT(":event");

  private final String keyword;

  ConstructKind(String keyword) {
    this.keyword = keyword;
  }

  public String getKeyword() {
    return keyword;
  }
}
