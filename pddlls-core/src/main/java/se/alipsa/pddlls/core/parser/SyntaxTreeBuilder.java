package se.alipsa.pddlls.core.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Builds a {@link SyntaxTree} from a token stream in one pass with an explicit bracket stack.
 * <p>
 * Malformed input never makes the builder fail: a close bracket without an open one and brackets
 * still open at the end of input are reported as offending tokens, and the rest of the tree is
 * built as usual.
 */
public final class SyntaxTreeBuilder {
  private SyntaxTreeBuilder() {}

  public static SyntaxTree build(String text) {
    return build(Tokenizer.tokenize(text));
  }

  public static SyntaxTree build(Iterable<Token> tokens) {
    Objects.requireNonNull(tokens, "tokens");
    List<SyntaxNode> arena = new ArrayList<>();
    List<Token> offending = new ArrayList<>();
    Deque<SyntaxNode> open = new ArrayDeque<>();
    open.push(newNode(arena, -1, Token.document()));

    for (Token token : tokens) {
      SyntaxNode top = open.peek();
      switch (token.getType()) {
        case OPEN_BRACKET, OPEN_BRACKET_OPERATOR -> {
          SyntaxNode bracket = newNode(arena, top.getIndex(), token);
          top.addChild(bracket);
          open.push(bracket);
        }
        case CLOSE_BRACKET -> {
          if (open.size() > 1) {
            open.pop().close(token);
          } else {
            offending.add(token);
          }
        }
        default -> top.addChild(newNode(arena, top.getIndex(), token));
      }
    }
    while (open.size() > 1) {
      offending.add(open.pop().getToken());
    }
    offending.sort(Comparator.comparingInt(Token::getStart));
    return new SyntaxTree(arena, offending);
  }

  private static SyntaxNode newNode(List<SyntaxNode> arena, int parentIndex, Token token) {
    SyntaxNode node = new SyntaxNode(arena, arena.size(), parentIndex, token);
    arena.add(node);
    return node;
  }
}
