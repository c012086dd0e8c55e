package se.alipsa.pddlls.pddl.symbols;

import se.alipsa.pddlls.core.model.DomainConstruct;
import se.alipsa.pddlls.core.parser.SyntaxNode;

import java.util.Objects;
import java.util.Optional;

/** One occurrence of a predicate or function in a domain, classified by where and how it is used. */
public final class VariableReferenceInfo {
  private final DomainConstruct construct;
  private final String part;
  private final SyntaxNode node;
  private final VariableReferenceKind kind;
  private final EffectKind effectKind;
  private final String timeQualifier;
  private final String relevantCode;

  VariableReferenceInfo(DomainConstruct construct, String part, SyntaxNode node, VariableReferenceKind kind,
                        EffectKind effectKind, String timeQualifier, String relevantCode) {
    this.construct = construct;
    this.part = Objects.requireNonNull(part, "part");
    this.node = Objects.requireNonNull(node, "node");
    this.kind = Objects.requireNonNull(kind, "kind");
    this.effectKind = effectKind;
    this.timeQualifier = Objects.requireNonNull(timeQualifier, "timeQualifier");
    this.relevantCode = Objects.requireNonNull(relevantCode, "relevantCode");
  }

  /** The action, process, event or derived predicate containing the reference. */
  public Optional<DomainConstruct> getConstruct() { return Optional.ofNullable(construct); }

  /** {@code precondition}, {@code effect}, {@code condition}, {@code duration}, or empty. */
  public String getPart() { return part; }

  /** The bracket of the reference, e.g. {@code (at ?t ?l)}. */
  public SyntaxNode getNode() { return node; }

  public VariableReferenceKind getKind() { return kind; }

  /** Present for {@link VariableReferenceKind#WRITE} references in effects. */
  public Optional<EffectKind> getEffectKind() { return Optional.ofNullable(effectKind); }

  /** {@code at start}, {@code at end}, {@code over all}, or empty. */
  public String getTimeQualifier() { return timeQualifier; }

  /** The smallest expression that shows how the variable is used. */
  public String getRelevantCode() { return relevantCode; }

  @Override
  public String toString() {
    String where = construct == null ? "?" : construct.getName();
    return kind + (effectKind == null ? "" : "(" + effectKind + ")") + " in " + where
        + (timeQualifier.isEmpty() ? "" : " " + timeQualifier) + (part.isEmpty() ? "" : " " + part)
        + ": " + relevantCode;
  }
}
