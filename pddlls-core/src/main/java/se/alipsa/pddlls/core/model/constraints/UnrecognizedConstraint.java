package se.alipsa.pddlls.core.model.constraints;

import se.alipsa.pddlls.core.parser.SyntaxNode;

/** A constraint expression the parser does not understand; the node is kept for reporting. */
public final class UnrecognizedConstraint extends Constraint {

  public UnrecognizedConstraint(SyntaxNode node) {
    super(node);
  }
}
