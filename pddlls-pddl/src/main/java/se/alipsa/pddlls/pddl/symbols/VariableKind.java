package se.alipsa.pddlls.pddl.symbols;

/** Whether an undeclared variable should be declared as a predicate or a function. */
public enum VariableKind {
  PREDICATE,
  FUNCTION,
  UNDECIDED
}
