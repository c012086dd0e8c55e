package se.alipsa.pddlls.core.model;

import se.alipsa.pddlls.core.parser.Keywords;
import se.alipsa.pddlls.core.parser.SyntaxNode;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class DurativeAction extends DomainConstruct {

  public DurativeAction(String name, List<Parameter> parameters, Range location,
                        List<String> documentation, SyntaxNode node, Map<String, SyntaxNode> parts) {
    super(name, parameters, location, documentation, node, parts);
  }

  @Override
  public ConstructKind getKind() { return ConstructKind.DURATIVE_ACTION; }

  public Optional<SyntaxNode> getDuration() { return getPart(Keywords.DURATION); }

  public Optional<SyntaxNode> getCondition() { return getPart(Keywords.CONDITION); }

  public Optional<SyntaxNode> getEffect() { return getPart(Keywords.EFFECT); }
}
