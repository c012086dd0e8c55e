package se.alipsa.pddlls.core.model.constraints;

import se.alipsa.pddlls.core.parser.SyntaxNode;

import java.util.Optional;

/**
 * {@code (name LABEL CONDITION)}. Inside {@code after} either side may be a bare label (no
 * condition) or an inline condition (no name).
 */
public final class NamedConditionConstraint extends Constraint {
  private final String name;
  private final Condition condition;

  public NamedConditionConstraint(SyntaxNode node, String name, Condition condition) {
    super(node);
    this.name = name;
    this.condition = condition;
  }

  public Optional<String> getName() {
    return Optional.ofNullable(name);
  }

  public Optional<Condition> getCondition() {
    return Optional.ofNullable(condition);
  }
}
