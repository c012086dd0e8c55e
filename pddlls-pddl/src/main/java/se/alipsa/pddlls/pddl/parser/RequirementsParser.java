package se.alipsa.pddlls.pddl.parser;

import se.alipsa.pddlls.core.parser.SyntaxNode;
import se.alipsa.pddlls.core.parser.TokenType;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/** {@code (:requirements :strips :typing)} to {@code [:strips, :typing]}. */
public final class RequirementsParser {
  private RequirementsParser() {}

  public static Set<String> parse(SyntaxNode requirementsNode) {
    Set<String> out = new LinkedHashSet<>();
    for (SyntaxNode n : requirementsNode.getNonWhitespaceNonCommentChildren()) {
      if (n.isType(TokenType.KEYWORD)) out.add(n.getToken().getText().toLowerCase(Locale.ROOT));
    }
    return out;
  }
}
