package se.alipsa.pddlls.core.model.constraints;

import se.alipsa.pddlls.core.parser.SyntaxNode;

import java.util.Objects;

/** {@code (after A B)}: B may only become true after A has been true. */
public final class AfterConstraint extends Constraint {
  private final NamedConditionConstraint predecessor;
  private final NamedConditionConstraint successor;

  public AfterConstraint(SyntaxNode node, NamedConditionConstraint predecessor, NamedConditionConstraint successor) {
    super(node);
    this.predecessor = Objects.requireNonNull(predecessor, "predecessor");
    this.successor = Objects.requireNonNull(successor, "successor");
  }

  public NamedConditionConstraint getPredecessor() {
    return predecessor;
  }

  public NamedConditionConstraint getSuccessor() {
    return successor;
  }
}
