package se.alipsa.pddlls.pddl.symbols;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.pddlls.core.TextUtil;
import se.alipsa.pddlls.core.model.DerivedPredicate;
import se.alipsa.pddlls.core.model.DomainConstruct;
import se.alipsa.pddlls.core.model.DomainInfo;
import se.alipsa.pddlls.core.model.Variable;
import se.alipsa.pddlls.core.parser.Keywords;
import se.alipsa.pddlls.core.parser.SyntaxNode;
import se.alipsa.pddlls.core.parser.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Finds where a domain reads and writes its predicates and functions.
 */
public final class ModelHierarchy {
  private static final Logger logger = LoggerFactory.getLogger(ModelHierarchy.class);

  /** Part name of the {@code (name ?params)} head of a derived predicate. */
  public static final String DERIVED_HEAD_PART = "derived";

  private static final Set<String> TIME_QUALIFIERS = Set.of("at start", "at end", "over all");
  private static final Set<String> STRUCTURAL = Set.of("and", "forall", "at start", "at end", "over all");
  private static final Set<String> READ_PARTS = Set.of("precondition", "condition", "duration");

  private final DomainInfo domain;

  public ModelHierarchy(DomainInfo domain) {
    this.domain = Objects.requireNonNull(domain, "domain");
  }

  /** Every reference to the variable inside the domain's constructs, in document order. */
  public List<VariableReferenceInfo> getReferences(Variable variable) {
    List<VariableReferenceInfo> out = new ArrayList<>();
    for (DomainConstruct construct : domain.getConstructs()) {
      SyntaxNode root = construct.getNode();
      for (SyntaxNode n : root.getNestedChildren()) {
        if (isReferenceTo(n, variable)) out.add(classify(construct, n));
      }
    }
    logger.debug("{} references to {} in {}", out.size(), variable.getFullName(), domain.getFileUri());
    return out;
  }

  /**
   * Classifies the reference at the offset.
   *
   * @param offset any offset inside the reference, e.g. on the variable name
   */
  public VariableReferenceInfo getReferenceInfo(Variable variable, int offset) {
    SyntaxNode node = domain.getSyntaxTree().getNodeAt(offset).expand();
    Optional<DomainConstruct> construct = domain.getConstructs().stream()
        .filter(c -> isAncestorOrSelf(c.getNode(), node))
        .findFirst();
    if (construct.isEmpty() || !isReferenceTo(node, variable)) {
      return unrecognized(construct.orElse(null), node);
    }
    return classify(construct.get(), node);
  }

  static boolean isReferenceTo(SyntaxNode node, Variable variable) {
    if (node.isType(TokenType.OPEN_BRACKET_OPERATOR)) {
      return variable.getName().equalsIgnoreCase(node.getKeyword());
    }
    if (!node.isType(TokenType.OPEN_BRACKET)) return false;
    List<SyntaxNode> children = node.getNonWhitespaceNonCommentChildren();
    return !children.isEmpty() && children.get(0).isType(TokenType.OTHER)
        && children.get(0).getToken().getText().equalsIgnoreCase(variable.getName());
  }

  private VariableReferenceInfo classify(DomainConstruct construct, SyntaxNode ref) {
    String timeQualifier = ref.findAncestor(a -> a.getKeyword() != null && TIME_QUALIFIERS.contains(a.getKeyword()))
        .filter(a -> isAncestorOrSelf(construct.getNode(), a))
        .map(SyntaxNode::getKeyword)
        .orElse("");

    if (construct instanceof DerivedPredicate && isDerivedHead(construct, ref)) {
      return new VariableReferenceInfo(construct, DERIVED_HEAD_PART, ref, VariableReferenceKind.WRITE, null,
          timeQualifier, code(ref));
    }

    for (Map.Entry<String, SyntaxNode> part : construct.getParts().entrySet()) {
      if (!isAncestorOrSelf(part.getValue(), ref)) continue;
      String partName = partName(part.getKey());
      if (READ_PARTS.contains(partName)) {
        return new VariableReferenceInfo(construct, partName, ref, VariableReferenceKind.READ, null,
            timeQualifier, code(ref));
      }
      if (Keywords.EFFECT.equals(part.getKey())) {
        return classifyEffect(construct, partName, part.getValue(), ref, timeQualifier);
      }
    }
    return unrecognized(construct, ref);
  }

  /*
   * Walks from the reference up to the effect root. Numeric effects write their first argument and
   * read the rest, "not" makes false, a "when" reads its condition, and a reference reached only
   * through and/forall/time qualifiers is made true.
   */
  private VariableReferenceInfo classifyEffect(DomainConstruct construct, String partName, SyntaxNode effectRoot,
                                               SyntaxNode ref, String timeQualifier) {
    boolean insideExpression = false;
    SyntaxNode child = ref;
    while (child != effectRoot) {
      SyntaxNode parent = child.getParent();
      if (parent == null) break;
      String keyword = parent.getKeyword();
      Optional<EffectKind> numeric = EffectKind.fromNumericOperator(keyword);
      if (numeric.isPresent()) {
        boolean target = child == ref && firstBracket(parent) == ref;
        return new VariableReferenceInfo(construct, partName, ref,
            target ? VariableReferenceKind.WRITE : VariableReferenceKind.READ,
            target ? numeric.get() : null, timeQualifier, code(parent));
      }
      if ("not".equals(keyword) && child == ref) {
        return new VariableReferenceInfo(construct, partName, ref, VariableReferenceKind.WRITE,
            EffectKind.MAKE_FALSE, timeQualifier, code(parent));
      }
      if ("when".equals(keyword) && firstBracket(parent) == child) {
        return new VariableReferenceInfo(construct, partName, ref, VariableReferenceKind.READ, null,
            timeQualifier, code(child));
      }
      if (keyword == null || !STRUCTURAL.contains(keyword) && !"when".equals(keyword)) insideExpression = true;
      child = parent;
    }
    if (insideExpression) {
      return new VariableReferenceInfo(construct, partName, ref, VariableReferenceKind.READ_OR_WRITE, null,
          timeQualifier, code(ref));
    }
    return new VariableReferenceInfo(construct, partName, ref, VariableReferenceKind.WRITE, EffectKind.MAKE_TRUE,
        timeQualifier, code(ref));
  }

  private static VariableReferenceInfo unrecognized(DomainConstruct construct, SyntaxNode node) {
    return new VariableReferenceInfo(construct, "", node, VariableReferenceKind.UNRECOGNIZED, null, "", code(node));
  }

  private static boolean isDerivedHead(DomainConstruct construct, SyntaxNode ref) {
    return construct.getNode().getNonWhitespaceNonCommentChildren().stream()
        .filter(SyntaxNode::isOpenBracket)
        .findFirst()
        .map(head -> head == ref)
        .orElse(false);
  }

  private static SyntaxNode firstBracket(SyntaxNode node) {
    return node.getNonWhitespaceNonCommentChildren().stream()
        .filter(SyntaxNode::isOpenBracket)
        .findFirst()
        .orElse(null);
  }

  static boolean isAncestorOrSelf(SyntaxNode ancestor, SyntaxNode node) {
    SyntaxNode n = node;
    while (n != null) {
      if (n == ancestor) return true;
      n = n.getParent();
    }
    return false;
  }

  private static String partName(String keyword) {
    return keyword.startsWith(":") ? keyword.substring(1) : keyword;
  }

  private static String code(SyntaxNode node) {
    return TextUtil.normalizeWhitespace(TextUtil.stripComments(node.getText()));
  }
}
