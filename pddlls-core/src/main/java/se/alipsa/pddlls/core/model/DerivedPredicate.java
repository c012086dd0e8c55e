package se.alipsa.pddlls.core.model;

import se.alipsa.pddlls.core.parser.SyntaxNode;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/** {@code (:derived (name ?p - t) CONDITION)}. */
public final class DerivedPredicate extends DomainConstruct {
  public static final String CONDITION_PART = "condition";

  private final Variable variable;

  public DerivedPredicate(Variable variable, Range location, List<String> documentation,
                          SyntaxNode node, Map<String, SyntaxNode> parts) {
    super(variable.getName(), variable.getParameters(), location, documentation, node, parts);
    this.variable = variable;
  }

  @Override
  public ConstructKind getKind() { return ConstructKind.DERIVED; }

  public Variable getVariable() { return variable; }

  public Optional<SyntaxNode> getCondition() { return getPart(CONDITION_PART); }
}
