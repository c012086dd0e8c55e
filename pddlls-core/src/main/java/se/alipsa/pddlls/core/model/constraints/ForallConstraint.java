package se.alipsa.pddlls.core.model.constraints;

import se.alipsa.pddlls.core.model.Parameter;
import se.alipsa.pddlls.core.parser.SyntaxNode;

import java.util.List;
import java.util.Objects;

/** {@code (forall (?x - t) CONSTRAINT)}. */
public final class ForallConstraint extends Constraint {
  private final List<Parameter> parameters;
  private final Constraint constraint;

  public ForallConstraint(SyntaxNode node, List<Parameter> parameters, Constraint constraint) {
    super(node);
    this.parameters = List.copyOf(parameters);
    this.constraint = Objects.requireNonNull(constraint, "constraint");
  }

  public List<Parameter> getParameters() { return parameters; }

  public Constraint getConstraint() { return constraint; }
}
