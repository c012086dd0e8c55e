package se.alipsa.pddlls.pddl.parser;

import se.alipsa.pddlls.core.model.ConstructKind;
import se.alipsa.pddlls.core.model.DerivedPredicate;
import se.alipsa.pddlls.core.model.DomainConstruct;
import se.alipsa.pddlls.core.model.DurativeAction;
import se.alipsa.pddlls.core.model.InstantAction;
import se.alipsa.pddlls.core.model.Parameter;
import se.alipsa.pddlls.core.model.PositionResolver;
import se.alipsa.pddlls.core.model.Range;
import se.alipsa.pddlls.core.model.Variable;
import se.alipsa.pddlls.core.parser.Keywords;
import se.alipsa.pddlls.core.parser.SyntaxNode;
import se.alipsa.pddlls.core.parser.TokenType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** Actions, durative actions, processes, events and derived predicates of a domain. */
final class ConstructParser {
  private ConstructParser() {}

  private static final Set<String> PART_KEYWORDS = Set.of(
      Keywords.PRECONDITION, Keywords.EFFECT, Keywords.CONDITION, Keywords.DURATION);

  static DomainConstruct parse(ConstructKind kind, SyntaxNode node, PositionResolver resolver) {
    Range location = resolver.resolveToRange(node.getStart(), node.getEnd());
    List<String> documentation = VariablesParser.documentationOf(node);
    List<SyntaxNode> children = node.getNonWhitespaceNonCommentChildren();

    if (kind == ConstructKind.DERIVED) {
      SyntaxNode head = children.stream().filter(SyntaxNode::isOpenBracket).findFirst()
          .orElseThrow(() -> new IllegalArgumentException("Derived predicate has no (name ?params) declaration"));
      Variable variable = VariablesParser.parseVariable(head, resolver)
          .orElseThrow(() -> new IllegalArgumentException("Derived predicate has no name"));
      Map<String, SyntaxNode> parts = new LinkedHashMap<>();
      head.getNextSibling().filter(SyntaxNode::isOpenBracket)
          .ifPresent(c -> parts.put(DerivedPredicate.CONDITION_PART, c));
      return new DerivedPredicate(variable, location, documentation, node, parts);
    }

    String name = null;
    if (!children.isEmpty() && children.get(0).isType(TokenType.OTHER)) {
      name = children.get(0).getToken().getText();
    }
    if (name == null) throw new IllegalArgumentException(kind.getKeyword() + " has no name");

    List<Parameter> parameters = node.getParameterDefinition()
        .map(def -> VariablesParser.parseParameters(def.getNonWhitespaceNonCommentChildren()))
        .orElse(List.of());

    Map<String, SyntaxNode> parts = new LinkedHashMap<>();
    for (int i = 0; i < children.size() - 1; i++) {
      SyntaxNode c = children.get(i);
      String keyword = c.getToken().getText().toLowerCase(Locale.ROOT);
      if (c.isType(TokenType.KEYWORD) && PART_KEYWORDS.contains(keyword)) {
        parts.put(keyword, children.get(i + 1));
      }
    }

    if (kind == ConstructKind.DURATIVE_ACTION) {
      return new DurativeAction(name, parameters, location, documentation, node, parts);
    }
    return new InstantAction(kind, name, parameters, location, documentation, node, parts);
  }
}
