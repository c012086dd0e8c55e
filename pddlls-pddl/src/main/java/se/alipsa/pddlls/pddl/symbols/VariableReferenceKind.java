package se.alipsa.pddlls.pddl.symbols;

/** How a construct accesses a predicate or function. */
public enum VariableReferenceKind {
  READ,
  WRITE,
  READ_OR_WRITE,
  UNRECOGNIZED
}
