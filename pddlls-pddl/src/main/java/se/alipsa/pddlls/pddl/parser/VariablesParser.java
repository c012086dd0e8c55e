package se.alipsa.pddlls.pddl.parser;

import se.alipsa.pddlls.core.TextUtil;
import se.alipsa.pddlls.core.model.Parameter;
import se.alipsa.pddlls.core.model.PositionResolver;
import se.alipsa.pddlls.core.model.Variable;
import se.alipsa.pddlls.core.parser.SyntaxNode;
import se.alipsa.pddlls.core.parser.SyntaxTreeBuilder;
import se.alipsa.pddlls.core.parser.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/** Predicate and function declarations, and typed parameter lists. */
public final class VariablesParser {
  private VariablesParser() {}

  /**
   * Every bracket directly inside a {@code :predicates} or {@code :functions} section becomes a
   * variable. Tokens between brackets, such as the {@code - number} return type of a function, are
   * skipped.
   */
  public static List<Variable> parseVariables(SyntaxNode sectionNode, PositionResolver resolver) {
    List<Variable> out = new ArrayList<>();
    for (SyntaxNode child : sectionNode.getChildren()) {
      if (child.isOpenBracket()) {
        parseVariable(child, resolver).ifPresent(out::add);
      }
    }
    return out;
  }

  /** {@code (name ?a ?b - type)}; empty when the bracket has no name. */
  public static Optional<Variable> parseVariable(SyntaxNode bracket, PositionResolver resolver) {
    List<SyntaxNode> children = bracket.getNonWhitespaceNonCommentChildren();
    String name;
    List<SyntaxNode> rest;
    if (bracket.isType(TokenType.OPEN_BRACKET_OPERATOR)) {
      // a predicate such as (at ?x ?y) is tokenized as an operator bracket; keep its spelling
      name = bracket.getToken().getText().substring(1).trim().replaceAll("\\s+", " ");
      rest = children;
    } else {
      if (children.isEmpty() || children.get(0).isNotType(TokenType.OTHER)) return Optional.empty();
      name = children.get(0).getToken().getText();
      rest = children.subList(1, children.size());
    }
    return Optional.of(new Variable(name, parseParameters(rest),
        resolver == null ? null : resolver.resolveToRange(bracket.getStart(), bracket.getEnd()),
        documentationOf(bracket)));
  }

  /** Parses {@code ?a ?b - type ?c - (either t1 t2) ?d}; untyped parameters get {@code object}. */
  public static List<Parameter> parseParameters(String parametersText) {
    return parseParameters(SyntaxTreeBuilder.build(parametersText).getRootNode().getNonWhitespaceNonCommentChildren());
  }

  public static List<Parameter> parseParameters(List<SyntaxNode> nodes) {
    List<Parameter> out = new ArrayList<>();
    List<String> pending = new ArrayList<>();
    for (int i = 0; i < nodes.size(); i++) {
      SyntaxNode n = nodes.get(i);
      if (n.isType(TokenType.PARAMETER)) {
        pending.add(n.getToken().getText());
      } else if (n.isType(TokenType.OTHER) && n.getToken().getText().equals("-") && i + 1 < nodes.size()) {
        String type = typeName(nodes.get(++i));
        for (String p : pending) out.add(new Parameter(p, type));
        pending.clear();
      }
    }
    for (String p : pending) out.add(new Parameter(p, Parameter.DEFAULT_TYPE));
    return out;
  }

  private static String typeName(SyntaxNode typeNode) {
    return typeNode.isOpenBracket()
        ? TextUtil.normalizeWhitespace(typeNode.getText())
        : typeNode.getToken().getText();
  }

  /**
   * The {@code ;} comment lines directly above a declaration. A comment that trails another
   * declaration on the same line is not documentation.
   */
  public static List<String> documentationOf(SyntaxNode node) {
    SyntaxNode parent = node.getParent();
    if (parent == null) return List.of();
    List<SyntaxNode> siblings = parent.getChildren();
    int at = -1;
    for (int i = 0; i < siblings.size(); i++) {
      if (siblings.get(i).getStart() == node.getStart()) {
        at = i;
        break;
      }
    }
    List<String> lines = new ArrayList<>();
    for (int i = at - 1; i >= 0; i--) {
      SyntaxNode s = siblings.get(i);
      if (s.isType(TokenType.WHITESPACE)) continue;
      if (s.isNotType(TokenType.COMMENT)) break;
      boolean startsLine = i == 0 || (siblings.get(i - 1).isType(TokenType.WHITESPACE)
          && siblings.get(i - 1).getToken().getText().contains("\n"));
      if (!startsLine) break;
      lines.add(s.getToken().getText().replaceFirst("^;+", "").trim());
    }
    Collections.reverse(lines);
    return lines;
  }
}
