package se.alipsa.pddlls.core.model.constraints;

import se.alipsa.pddlls.core.parser.SyntaxNode;

import java.util.Objects;

/** A constraint of a {@code :constraints} section, tied to the node it was read from. */
public abstract class Constraint {
  private final SyntaxNode node;

  protected Constraint(SyntaxNode node) {
    this.node = Objects.requireNonNull(node, "node");
  }

  public SyntaxNode getNode() {
    return node;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{" + node.getText() + "}";
  }
}
