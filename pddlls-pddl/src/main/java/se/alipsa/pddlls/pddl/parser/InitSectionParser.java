package se.alipsa.pddlls.pddl.parser;

import se.alipsa.pddlls.core.TextUtil;
import se.alipsa.pddlls.core.model.SupplyDemand;
import se.alipsa.pddlls.core.model.TimedVariableValue;
import se.alipsa.pddlls.core.model.VariableValue;
import se.alipsa.pddlls.core.parser.SyntaxNode;
import se.alipsa.pddlls.core.parser.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reads the {@code :init} section of a problem. Every top-level bracket yields one value: a timed
 * fact for {@code (at T FACT)} with a numeric {@code T}, otherwise a fact at time 0. Shapes that
 * cannot be evaluated are kept as unsupported values so that consumers can report them.
 */
public final class InitSectionParser {

  private static final Set<String> UNSUPPORTED = Set.of("forall", "assign", "increase", "decrease");

  private final List<TimedVariableValue> values = new ArrayList<>();
  private final List<SupplyDemand> supplyDemands = new ArrayList<>();

  public static InitSectionParser parse(SyntaxNode initNode) {
    InitSectionParser parser = new InitSectionParser();
    for (SyntaxNode child : initNode.getChildren()) {
      if (!child.isOpenBracket()) continue;
      if (child.isOperator("supply-demand")) {
        parseSupplyDemand(child).ifPresent(parser.supplyDemands::add);
      } else {
        parser.values.add(parseInit(child));
      }
    }
    return parser;
  }

  public List<TimedVariableValue> getValues() {
    return List.copyOf(values);
  }

  public List<SupplyDemand> getSupplyDemands() {
    return List.copyOf(supplyDemands);
  }

  static TimedVariableValue parseInit(SyntaxNode bracket) {
    if (bracket.isOperator("at")) {
      List<SyntaxNode> tokens = bracket.getNonWhitespaceNonCommentChildren();
      if (tokens.size() > 1 && tokens.get(0).getToken().isNumeric() && tokens.get(1).isOpenBracket()) {
        double time = Double.parseDouble(tokens.get(0).getToken().getText());
        return TimedVariableValue.from(time, parseVariableValue(tokens.get(1)));
      }
    }
    return TimedVariableValue.from(0, parseVariableValue(bracket));
  }

  static VariableValue parseVariableValue(SyntaxNode node) {
    String keyword = node.getKeyword();
    if ("=".equals(keyword)) {
      List<SyntaxNode> tokens = node.getNonWhitespaceNonCommentChildren();
      if (tokens.size() == 2 && tokens.get(0).isOpenBracket() && tokens.get(1).getToken().isNumeric()) {
        return VariableValue.of(variableName(tokens.get(0)), Double.parseDouble(tokens.get(1).getToken().getText()));
      }
      String name = !tokens.isEmpty() && tokens.get(0).isOpenBracket() ? variableName(tokens.get(0)) : variableName(node);
      return VariableValue.unsupported(name, node.getText());
    }
    if ("not".equals(keyword)) {
      Optional<SyntaxNode> nested = node.getNonWhitespaceNonCommentChildren().stream()
          .filter(SyntaxNode::isOpenBracket)
          .findFirst();
      if (nested.isEmpty()) return VariableValue.unsupported(variableName(node), node.getText());
      return parseVariableValue(nested.get()).negate(node.getText());
    }
    if (keyword != null && UNSUPPORTED.contains(keyword)) {
      return VariableValue.unsupported(variableName(node), node.getText());
    }
    // a bare fact may only hold names and numbers
    boolean nestedBracket = node.getChildren().stream().anyMatch(SyntaxNode::isOpenBracket);
    if (nestedBracket || !node.isOpenBracket()) {
      return VariableValue.unsupported(variableName(node), node.getText());
    }
    return VariableValue.of(variableName(node), true);
  }

  /** {@code (at  truck1 depot)} to {@code at truck1 depot}. */
  static String variableName(SyntaxNode bracket) {
    if (!bracket.isOpenBracket()) return bracket.getToken().getText();
    String head = bracket.getToken().getText().substring(1);
    return TextUtil.normalizeWhitespace(head + " " + bracket.getNestedNonCommentText());
  }

  private static Optional<SupplyDemand> parseSupplyDemand(SyntaxNode node) {
    List<SyntaxNode> tokens = node.getNonWhitespaceNonCommentChildren();
    if (!tokens.isEmpty() && tokens.get(0).isType(TokenType.OTHER)) {
      return Optional.of(new SupplyDemand(tokens.get(0).getToken().getText()));
    }
    return Optional.empty();
  }
}
