package se.alipsa.pddlls.core.model.constraints;

import se.alipsa.pddlls.core.parser.SyntaxNode;

import java.util.Objects;
import java.util.Optional;

/** {@code (preference [NAME] CONSTRAINT)}: a soft constraint. */
public final class PreferenceConstraint extends Constraint {
  private final String name;
  private final Constraint constraint;

  public PreferenceConstraint(SyntaxNode node, String name, Constraint constraint) {
    super(node);
    this.name = name;
    this.constraint = Objects.requireNonNull(constraint, "constraint");
  }

  /** Empty for an anonymous preference. */
  public Optional<String> getName() { return Optional.ofNullable(name); }

  public Constraint getConstraint() { return constraint; }
}
