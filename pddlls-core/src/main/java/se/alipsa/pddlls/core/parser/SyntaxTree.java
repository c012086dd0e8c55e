package se.alipsa.pddlls.core.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Immutable result of {@link SyntaxTreeBuilder}: the node arena rooted in a document node, plus the
 * tokens that could not be placed structurally. Rebuilding means building a new tree.
 */
public final class SyntaxTree {

  public static final SyntaxTree EMPTY = emptyTree();

  private final List<SyntaxNode> nodes;
  private final List<Token> offendingTokens;

  SyntaxTree(List<SyntaxNode> nodes, List<Token> offendingTokens) {
    this.nodes = Collections.unmodifiableList(nodes);
    this.offendingTokens = List.copyOf(offendingTokens);
  }

  public SyntaxNode getRootNode() {
    return nodes.get(0);
  }

  /** Unmatched close brackets and brackets left open at the end of input, in document order. */
  public List<Token> getOffendingTokens() {
    return offendingTokens;
  }

  public boolean hasOffendingTokens() {
    return !offendingTokens.isEmpty();
  }

  public int getNodeCount() {
    return nodes.size();
  }

  public String getText() {
    return getRootNode().getText();
  }

  public Optional<SyntaxNode> getDefineNode() {
    return getRootNode().getFirstOpenBracket(Keywords.DEFINE);
  }

  public SyntaxNode getDefineNodeOrThrow() {
    return getDefineNode().orElseThrow(() -> new IllegalStateException("Document has no (define ...) node"));
  }

  /**
   * The most specific node covering the character at {@code offset}. Returns the document node
   * when no token covers it.
   */
  public SyntaxNode getNodeAt(int offset) {
    SyntaxNode node = getRootNode();
    while (true) {
      SyntaxNode next = null;
      for (SyntaxNode child : node.getChildren()) {
        if (child.includesOffset(offset)) {
          next = child;
          break;
        }
      }
      // offset on the bracket's own token or its closing bracket: the bracket is the answer
      if (next == null) return node;
      if (next.isOpenBracket() && (offset < next.getToken().getEnd() || isOnClosingToken(next, offset))) return next;
      node = next;
    }
  }

  private static boolean isOnClosingToken(SyntaxNode node, int offset) {
    Token close = node.getClosingToken();
    return close != null && close.getStart() <= offset;
  }

  private static SyntaxTree emptyTree() {
    List<SyntaxNode> arena = new ArrayList<>();
    arena.add(new SyntaxNode(arena, 0, -1, Token.document()));
    return new SyntaxTree(arena, List.of());
  }
}
