package se.alipsa.pddlls.pddl.symbols;

import se.alipsa.pddlls.core.model.Variable;
import se.alipsa.pddlls.core.parser.SyntaxNode;

import java.util.Objects;

/** A variable inferred from where it is used, together with the bracket of that use. */
public final class VariableUsage {
  private final Variable variable;
  private final SyntaxNode node;

  VariableUsage(Variable variable, SyntaxNode node) {
    this.variable = Objects.requireNonNull(variable, "variable");
    this.node = Objects.requireNonNull(node, "node");
  }

  public Variable getVariable() { return variable; }

  public SyntaxNode getNode() { return node; }
}
