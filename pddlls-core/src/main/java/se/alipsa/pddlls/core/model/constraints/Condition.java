package se.alipsa.pddlls.core.model.constraints;

import se.alipsa.pddlls.core.parser.SyntaxNode;

import java.util.Objects;

/** A goal-description expression used inside a constraint. */
public final class Condition {
  private final SyntaxNode node;

  public Condition(SyntaxNode node) {
    this.node = Objects.requireNonNull(node, "node");
  }

  public SyntaxNode getNode() {
    return node;
  }

  public String getText() {
    return node.getText();
  }

  @Override
  public String toString() {
    return getText();
  }
}
