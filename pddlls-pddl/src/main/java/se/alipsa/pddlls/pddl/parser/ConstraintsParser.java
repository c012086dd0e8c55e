package se.alipsa.pddlls.pddl.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.pddlls.core.TextUtil;
import se.alipsa.pddlls.core.model.ParsingProblem;
import se.alipsa.pddlls.core.model.Position;
import se.alipsa.pddlls.core.model.PositionResolver;
import se.alipsa.pddlls.core.model.constraints.AfterConstraint;
import se.alipsa.pddlls.core.model.constraints.Condition;
import se.alipsa.pddlls.core.model.constraints.Constraint;
import se.alipsa.pddlls.core.model.constraints.ForallConstraint;
import se.alipsa.pddlls.core.model.constraints.ModalConstraint;
import se.alipsa.pddlls.core.model.constraints.NamedConditionConstraint;
import se.alipsa.pddlls.core.model.constraints.PreferenceConstraint;
import se.alipsa.pddlls.core.model.constraints.UnrecognizedConstraint;
import se.alipsa.pddlls.core.parser.SyntaxNode;
import se.alipsa.pddlls.core.parser.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recursive descent over a {@code :constraints} section. Top-level {@code and} is flattened;
 * forms the parser does not know become {@link UnrecognizedConstraint}s plus a warning.
 */
public final class ConstraintsParser {
  private static final Logger logger = LoggerFactory.getLogger(ConstraintsParser.class);

  private final PositionResolver resolver;
  private final List<ParsingProblem> problems = new ArrayList<>();

  public ConstraintsParser(PositionResolver resolver) {
    this.resolver = resolver;
  }

  public List<Constraint> parseConstraints(SyntaxNode constraintsNode) {
    List<Constraint> out = new ArrayList<>();
    for (SyntaxNode child : constraintsNode.getNonWhitespaceNonCommentChildren()) {
      collect(child, out);
    }
    return out;
  }

  /** Warnings collected by the last calls to {@link #parseConstraints}. */
  public List<ParsingProblem> getProblems() {
    return List.copyOf(problems);
  }

  private void collect(SyntaxNode node, List<Constraint> out) {
    if (node.isOperator("and")) {
      for (SyntaxNode child : node.getNonWhitespaceNonCommentChildren()) collect(child, out);
    } else {
      out.add(parseConstraint(node));
    }
  }

  Constraint parseConstraint(SyntaxNode node) {
    String keyword = node.getKeyword();
    if (keyword == null) return unrecognized(node);
    List<SyntaxNode> args = node.getNonWhitespaceNonCommentChildren();

    switch (keyword) {
      case "name":
        return parseNamed(node, args).map(Constraint.class::cast).orElseGet(() -> unrecognized(node));
      case "after":
        if (args.size() == 2) {
          Optional<NamedConditionConstraint> first = parseAfterOperand(args.get(0));
          Optional<NamedConditionConstraint> second = parseAfterOperand(args.get(1));
          if (first.isPresent() && second.isPresent()) return new AfterConstraint(node, first.get(), second.get());
        }
        return unrecognized(node);
      case "preference":
        if (args.size() == 2 && args.get(0).isType(TokenType.OTHER) && args.get(1).isOpenBracket()) {
          return new PreferenceConstraint(node, args.get(0).getToken().getText(), parseConstraint(args.get(1)));
        }
        if (args.size() == 1 && args.get(0).isOpenBracket()) {
          return new PreferenceConstraint(node, null, parseConstraint(args.get(0)));
        }
        return unrecognized(node);
      case "forall":
        if (args.size() == 2 && args.get(0).isOpenBracket() && args.get(1).isOpenBracket()) {
          return new ForallConstraint(node,
              VariablesParser.parseParameters(args.get(0).getNonWhitespaceNonCommentChildren()),
              parseConstraint(args.get(1)));
        }
        return unrecognized(node);
      default:
        return ModalConstraint.Modality.fromKeyword(keyword)
            .map(m -> parseModal(node, m, args))
            .orElseGet(() -> unrecognized(node));
    }
  }

  private Optional<NamedConditionConstraint> parseNamed(SyntaxNode node, List<SyntaxNode> args) {
    if (args.size() == 2 && args.get(0).isType(TokenType.OTHER) && args.get(1).isOpenBracket()) {
      return Optional.of(new NamedConditionConstraint(node, args.get(0).getToken().getText(), new Condition(args.get(1))));
    }
    return Optional.empty();
  }

  // a bare label, a (name ...) form or an inline condition
  private Optional<NamedConditionConstraint> parseAfterOperand(SyntaxNode operand) {
    if (operand.isType(TokenType.OTHER)) {
      return Optional.of(new NamedConditionConstraint(operand, operand.getToken().getText(), null));
    }
    if (operand.isOperator("name")) {
      return parseNamed(operand, operand.getNonWhitespaceNonCommentChildren());
    }
    if (operand.isOpenBracket()) {
      return Optional.of(new NamedConditionConstraint(operand, null, new Condition(operand)));
    }
    return Optional.empty();
  }

  private Constraint parseModal(SyntaxNode node, ModalConstraint.Modality modality, List<SyntaxNode> args) {
    if (args.size() != modality.getTimeArity() + modality.getConditionArity()) return unrecognized(node);
    List<Double> times = new ArrayList<>();
    for (int i = 0; i < modality.getTimeArity(); i++) {
      SyntaxNode t = args.get(i);
      if (!t.getToken().isNumeric()) return unrecognized(node);
      times.add(Double.parseDouble(t.getToken().getText()));
    }
    List<Condition> conditions = new ArrayList<>();
    for (int i = modality.getTimeArity(); i < args.size(); i++) {
      if (!args.get(i).isOpenBracket()) return unrecognized(node);
      conditions.add(new Condition(args.get(i)));
    }
    return new ModalConstraint(node, modality, times, conditions);
  }

  private Constraint unrecognized(SyntaxNode node) {
    String text = TextUtil.normalizeWhitespace(node.getText());
    logger.debug("Unrecognized constraint {}", text);
    if (resolver != null) {
      Position p = resolver.resolveToPosition(node.getStart());
      problems.add(new ParsingProblem("Unrecognized constraint: " + text, p.line, p.column,
          ParsingProblem.Severity.WARNING));
    }
    return new UnrecognizedConstraint(node);
  }
}
