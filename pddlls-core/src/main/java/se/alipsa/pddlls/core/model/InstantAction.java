package se.alipsa.pddlls.core.model;

import se.alipsa.pddlls.core.parser.Keywords;
import se.alipsa.pddlls.core.parser.SyntaxNode;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/** {@code :action}, {@code :process} and {@code :event} share the precondition/effect shape. */
public final class InstantAction extends DomainConstruct {
  private final ConstructKind kind;

  public InstantAction(ConstructKind kind, String name, List<Parameter> parameters, Range location,
                       List<String> documentation, SyntaxNode node, Map<String, SyntaxNode> parts) {
    super(name, parameters, location, documentation, node, parts);
    if (kind == ConstructKind.DURATIVE_ACTION || kind == ConstructKind.DERIVED) {
      throw new IllegalArgumentException("Not an instantaneous construct: " + kind);
    }
    this.kind = kind;
  }

  @Override
  public ConstructKind getKind() { return kind; }

  public Optional<SyntaxNode> getPrecondition() { return getPart(Keywords.PRECONDITION); }

  public Optional<SyntaxNode> getEffect() { return getPart(Keywords.EFFECT); }
}
