package se.alipsa.pddlls.core.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * A node of a {@link SyntaxTree}: one token plus, for brackets, the ordered child nodes up to the
 * matching close bracket.
 * <p>
 * Nodes are stored in an arena owned by the tree. The parent link is an index into that arena, so
 * a node never owns its parent.
 */
public final class SyntaxNode {

  private final List<SyntaxNode> arena;
  private final int index;
  private final int parentIndex;
  private final Token token;
  private final List<Integer> childIndices = new ArrayList<>();
  private Token closingToken;

  SyntaxNode(List<SyntaxNode> arena, int index, int parentIndex, Token token) {
    this.arena = arena;
    this.index = index;
    this.parentIndex = parentIndex;
    this.token = token;
  }

  // --- construction (SyntaxTreeBuilder only) ---------------------------------------------------

  void addChild(SyntaxNode child) {
    childIndices.add(child.index);
  }

  void close(Token closeBracket) {
    this.closingToken = closeBracket;
  }

  // --- identity ---------------------------------------------------------------------------------

  int getIndex() { return index; }

  public Token getToken() { return token; }

  public TokenType getType() { return token.getType(); }

  public boolean isType(TokenType type) { return token.getType() == type; }

  public boolean isNotType(TokenType type) { return token.getType() != type; }

  public boolean isDocument() { return token.getType() == TokenType.DOCUMENT; }

  public boolean isOpenBracket() { return token.isOpenBracket(); }

  /** Normalized keyword of an operator bracket, {@code null} otherwise. */
  public String getKeyword() { return token.getKeyword(); }

  public boolean isOperator(String keyword) {
    return keyword.equalsIgnoreCase(token.getKeyword());
  }

  /** The close bracket that ended this node, or {@code null} for leaves and unmatched brackets. */
  public Token getClosingToken() { return closingToken; }

  public boolean isClosed() { return closingToken != null; }

  public int getStart() { return token.getStart(); }

  public int getEnd() {
    if (closingToken != null) return closingToken.getEnd();
    if (!childIndices.isEmpty()) return child(childIndices.size() - 1).getEnd();
    return token.getEnd();
  }

  public boolean includesOffset(int offset) {
    return getStart() <= offset && offset < getEnd();
  }

  // --- navigation -------------------------------------------------------------------------------

  /** The parent node, or {@code null} for the document node. */
  public SyntaxNode getParent() {
    return parentIndex < 0 ? null : arena.get(parentIndex);
  }

  public boolean hasChildren() { return !childIndices.isEmpty(); }

  public List<SyntaxNode> getChildren() {
    List<SyntaxNode> out = new ArrayList<>(childIndices.size());
    for (int i = 0; i < childIndices.size(); i++) out.add(child(i));
    return Collections.unmodifiableList(out);
  }

  public List<SyntaxNode> getNonWhitespaceChildren() {
    return filterChildren(n -> n.isNotType(TokenType.WHITESPACE));
  }

  public List<SyntaxNode> getNonWhitespaceNonCommentChildren() {
    return filterChildren(n -> n.isNotType(TokenType.WHITESPACE) && n.isNotType(TokenType.COMMENT));
  }

  /** All descendants in document order. */
  public List<SyntaxNode> getNestedChildren() {
    List<SyntaxNode> out = new ArrayList<>();
    collectNested(this, out);
    return Collections.unmodifiableList(out);
  }

  public List<SyntaxNode> getChildrenOfType(TokenType type, Pattern textPattern) {
    return filterChildren(n -> n.isType(type) && textPattern.matcher(n.getToken().getText()).find());
  }

  public Optional<SyntaxNode> getFirstChild(TokenType type, Pattern textPattern) {
    return getChildrenOfType(type, textPattern).stream().findFirst();
  }

  /** First direct child that is an operator bracket with the given keyword, e.g. {@code :init}. */
  public Optional<SyntaxNode> getFirstOpenBracket(String keyword) {
    return getChildren().stream().filter(n -> n.isOperator(keyword)).findFirst();
  }

  public SyntaxNode getFirstOpenBracketOrThrow(String keyword) {
    return getFirstOpenBracket(keyword)
        .orElseThrow(() -> new IllegalStateException("Expected a (" + keyword + " bracket at offset " + getStart()));
  }

  public List<SyntaxNode> getOpenBrackets(String keyword) {
    return filterChildren(n -> n.isOperator(keyword));
  }

  /** This node itself when it is a bracket (or the document), otherwise its parent. */
  public SyntaxNode expand() {
    if (isOpenBracket() || isDocument()) return this;
    SyntaxNode parent = getParent();
    return parent == null ? this : parent;
  }

  /** Nearest ancestor (not this node) matching the predicate. */
  public Optional<SyntaxNode> findAncestor(Predicate<SyntaxNode> predicate) {
    SyntaxNode node = getParent();
    while (node != null) {
      if (predicate.test(node)) return Optional.of(node);
      node = node.getParent();
    }
    return Optional.empty();
  }

  /**
   * Innermost scope (this node or an ancestor) among {@code :action}, {@code :durative-action},
   * {@code :derived}, {@code :process}, {@code :event}, {@code forall} and {@code exists} that
   * declares the given parameter.
   *
   * @param parameterName parameter name with or without the leading {@code ?}
   */
  public Optional<SyntaxNode> findParametrisableScope(String parameterName) {
    String wanted = parameterName.startsWith("?") ? parameterName : "?" + parameterName;
    SyntaxNode node = this;
    while (node != null && !node.isDocument()) {
      if (Keywords.isParametrisableScope(node.getKeyword()) && node.declaresParameter(wanted)) {
        return Optional.of(node);
      }
      node = node.getParent();
    }
    return Optional.empty();
  }

  /**
   * The bracket that declares the parameters of a parametrisable scope: the bracket after
   * {@code :parameters} for action-like constructs, the first bracket otherwise.
   */
  public Optional<SyntaxNode> getParameterDefinition() {
    List<SyntaxNode> children = getNonWhitespaceNonCommentChildren();
    String keyword = getKeyword();
    if (keyword == null) return Optional.empty();
    if (Keywords.FORALL_LIKE.contains(keyword) || Keywords.DERIVED.equals(keyword)) {
      return children.stream().filter(SyntaxNode::isOpenBracket).findFirst();
    }
    for (int i = 0; i < children.size() - 1; i++) {
      SyntaxNode c = children.get(i);
      if (c.isType(TokenType.KEYWORD) && c.getToken().getText().equalsIgnoreCase(Keywords.PARAMETERS)) {
        SyntaxNode next = children.get(i + 1);
        return next.isOpenBracket() ? Optional.of(next) : Optional.empty();
      }
    }
    return Optional.empty();
  }

  private boolean declaresParameter(String parameter) {
    return getParameterDefinition()
        .map(def -> def.getNestedChildren().stream()
            .anyMatch(n -> n.isType(TokenType.PARAMETER) && n.getToken().getText().equalsIgnoreCase(parameter)))
        .orElse(false);
  }

  /** Non-whitespace, non-comment sibling following this node, if any. */
  public Optional<SyntaxNode> getNextSibling() {
    SyntaxNode parent = getParent();
    if (parent == null) return Optional.empty();
    List<SyntaxNode> siblings = parent.getNonWhitespaceNonCommentChildren();
    for (int i = 0; i < siblings.size() - 1; i++) {
      if (siblings.get(i).index == index) return Optional.of(siblings.get(i + 1));
    }
    return Optional.empty();
  }

  // --- text -------------------------------------------------------------------------------------

  /** Full text of this node: its token, all nested tokens and the closing bracket. */
  public String getText() {
    StringBuilder sb = new StringBuilder();
    appendText(sb, true, true);
    return sb.toString();
  }

  /** Text of the children only (without this node's own token and closing bracket). */
  public String getNestedText() {
    StringBuilder sb = new StringBuilder();
    appendNested(sb, true);
    return sb.toString();
  }

  public String getNestedNonCommentText() {
    StringBuilder sb = new StringBuilder();
    appendNested(sb, false);
    return sb.toString();
  }

  private void appendText(StringBuilder sb, boolean includeComments, boolean self) {
    if (!includeComments && isType(TokenType.COMMENT)) return;
    if (self) sb.append(token.getText());
    appendNested(sb, includeComments);
    if (self && closingToken != null) sb.append(closingToken.getText());
  }

  private void appendNested(StringBuilder sb, boolean includeComments) {
    for (int i = 0; i < childIndices.size(); i++) child(i).appendText(sb, includeComments, true);
  }

  // --- helpers ----------------------------------------------------------------------------------

  private SyntaxNode child(int i) {
    return arena.get(childIndices.get(i));
  }

  private List<SyntaxNode> filterChildren(Predicate<SyntaxNode> predicate) {
    List<SyntaxNode> out = new ArrayList<>();
    for (int i = 0; i < childIndices.size(); i++) {
      SyntaxNode c = child(i);
      if (predicate.test(c)) out.add(c);
    }
    return Collections.unmodifiableList(out);
  }

  private static void collectNested(SyntaxNode node, List<SyntaxNode> out) {
    for (int i = 0; i < node.childIndices.size(); i++) {
      SyntaxNode c = node.child(i);
      out.add(c);
      collectNested(c, out);
    }
  }

  @Override
  public String toString() {
    return isDocument() ? "<document>" : token.getText() + "@" + getStart();
  }
}
