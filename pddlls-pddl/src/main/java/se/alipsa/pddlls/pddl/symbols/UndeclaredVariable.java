package se.alipsa.pddlls.pddl.symbols;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.pddlls.core.model.Parameter;
import se.alipsa.pddlls.core.model.Variable;
import se.alipsa.pddlls.core.parser.Keywords;
import se.alipsa.pddlls.core.parser.SyntaxNode;
import se.alipsa.pddlls.core.parser.SyntaxTree;
import se.alipsa.pddlls.core.parser.TokenType;
import se.alipsa.pddlls.pddl.parser.VariablesParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Infers the declaration of a predicate or function that a domain uses without declaring it.
 */
public final class UndeclaredVariable {
  private static final Logger logger = LoggerFactory.getLogger(UndeclaredVariable.class);

  private static final Set<String> FUNCTION_CONTEXTS = Set.of(
      "+", "-", "/", "*", "<", "<=", ">", ">=", "=",
      "assign", "increase", "decrease", "scale-up", "scale-down", "sumall");
  private static final Set<String> PREDICATE_CONTEXTS = Set.of(
      "and", "not", "or", "at start", "over all", "at end", "forall");

  // sections that may precede :predicates and :functions, in canonical order
  private static final List<String> LEADING_SECTIONS = List.of(
      Keywords.REQUIREMENTS, Keywords.TYPES, Keywords.CONSTANTS, Keywords.PREDICATES, Keywords.FUNCTIONS);

  private final SyntaxTree tree;

  public UndeclaredVariable(SyntaxTree tree) {
    this.tree = Objects.requireNonNull(tree, "tree");
  }

  /**
   * The variable used at the offset, with every {@code ?parameter} typed through the scope that
   * declares it.
   *
   * @return empty when nothing is found at the offset or a parameter has no declaring scope
   */
  public Optional<VariableUsage> getVariable(String variableName, int offset) {
    SyntaxNode usage = tree.getNodeAt(offset).expand();
    if (usage.isDocument()) {
      logger.debug("No usage of {} at offset {}", variableName, offset);
      return Optional.empty();
    }
    List<Parameter> parameters = new ArrayList<>();
    for (SyntaxNode n : usage.getNestedChildren()) {
      if (!n.isType(TokenType.PARAMETER)) continue;
      String name = n.getToken().getText().substring(1);
      Optional<Parameter> parameter = findParameterDefinition(usage, name);
      if (parameter.isEmpty()) {
        logger.debug("Parameter ?{} of {} is not declared by any enclosing scope", name, variableName);
        return Optional.empty();
      }
      parameters.add(parameter.get());
    }
    return Optional.of(new VariableUsage(new Variable(variableName, parameters), usage));
  }

  Optional<Parameter> findParameterDefinition(SyntaxNode usage, String parameterName) {
    return usage.findParametrisableScope(parameterName)
        .flatMap(SyntaxNode::getParameterDefinition)
        .flatMap(def -> VariablesParser.parseParameters(def.getNonWhitespaceNonCommentChildren()).stream()
            .filter(p -> p.getName().equalsIgnoreCase(parameterName))
            .findFirst());
  }

  /** Decides from the nearest enclosing operator that tells predicates and functions apart. */
  public VariableKind determineKind(SyntaxNode usage) {
    SyntaxNode node = usage;
    while (!node.isDocument()) {
      node = node.getParent();
      if (node == null) break;
      if (node.isType(TokenType.OPEN_BRACKET_OPERATOR)) {
        String keyword = node.getKeyword();
        if (FUNCTION_CONTEXTS.contains(keyword)) return VariableKind.FUNCTION;
        if (PREDICATE_CONTEXTS.contains(keyword)) return VariableKind.PREDICATE;
      }
    }
    return VariableKind.UNDECIDED;
  }

  /**
   * @throws IllegalStateException when the usage does not tell whether it is a predicate or a function
   */
  public VariableKind requireKind(VariableUsage usage) {
    VariableKind kind = determineKind(usage.getNode());
    if (kind == VariableKind.UNDECIDED) {
      throw new IllegalStateException("Could not determine whether " + usage.getVariable().getFullName()
          + " is a predicate or a function");
    }
    return kind;
  }

  /**
   * Where and what to insert to declare the variable: into the existing {@code :predicates} or
   * {@code :functions} section, or as a new section after the sections that precede it.
   *
   * @throws IllegalStateException when the kind cannot be decided or the document has no define node
   */
  public TextInsertion createDeclaration(VariableUsage usage, String indent, String eol) {
    VariableKind kind = requireKind(usage);
    String section = kind == VariableKind.FUNCTION ? Keywords.FUNCTIONS : Keywords.PREDICATES;
    String declaration = "(" + usage.getVariable().getFullName() + ")";
    SyntaxNode define = tree.getDefineNodeOrThrow();

    Optional<SyntaxNode> existing = define.getFirstOpenBracket(section);
    if (existing.isPresent() && existing.get().isClosed()) {
      int closing = existing.get().getClosingToken().getStart();
      return new TextInsertion(closing, indent + declaration + eol);
    }
    return new TextInsertion(precedingSectionEnd(define, section),
        eol + indent + "(" + section + eol + indent + indent + declaration + eol + indent + ")");
  }

  private static int precedingSectionEnd(SyntaxNode define, String section) {
    int end = -1;
    for (String preceding : LEADING_SECTIONS.subList(0, LEADING_SECTIONS.indexOf(section))) {
      Optional<SyntaxNode> node = define.getFirstOpenBracket(preceding);
      if (node.isPresent()) end = Math.max(end, node.get().getEnd());
    }
    if (end >= 0) return end;
    return define.getNonWhitespaceNonCommentChildren().stream()
        .filter(n -> n.isOperator(Keywords.DOMAIN))
        .findFirst()
        .map(SyntaxNode::getEnd)
        .orElse(define.getToken().getEnd());
  }
}
