package se.alipsa.pddlls.core.parser;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.regex.Matcher;

/**
 * Splits PDDL text into tokens. The returned sequence is lazy and restartable: every call to
 * {@link Iterable#iterator()} scans the text from the beginning.
 * <p>
 * Tokenizing is total. Every character of the input ends up in exactly one token (whitespace and
 * comments included), so concatenating the token texts reproduces the input.
 */
public final class Tokenizer {
  private Tokenizer() {}

  public static Iterable<Token> tokenize(String text) {
    Objects.requireNonNull(text, "text");
    return () -> new TokenIterator(text);
  }

  public static List<Token> tokenizeToList(String text) {
    List<Token> out = new ArrayList<>();
    tokenize(text).forEach(out::add);
    return out;
  }

  private static final class TokenIterator implements Iterator<Token> {
    private final String text;
    private final Matcher operatorMatcher;
    private int pos;

    TokenIterator(String text) {
      this.text = text;
      this.operatorMatcher = Keywords.OPERATOR_BRACKET.matcher(text);
    }

    @Override
    public boolean hasNext() {
      return pos < text.length();
    }

    @Override
    public Token next() {
      if (!hasNext()) throw new NoSuchElementException();
      int start = pos;
      char c = text.charAt(pos);
      TokenType type;
      if (c == ';') {
        type = TokenType.COMMENT;
        pos = endOfLine(pos);
      } else if (Character.isWhitespace(c)) {
        type = TokenType.WHITESPACE;
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) pos++;
      } else if (c == '(') {
        operatorMatcher.region(pos, text.length());
        if (operatorMatcher.lookingAt()) {
          type = TokenType.OPEN_BRACKET_OPERATOR;
          pos = operatorMatcher.end();
        } else {
          type = TokenType.OPEN_BRACKET;
          pos++;
        }
      } else if (c == ')') {
        type = TokenType.CLOSE_BRACKET;
        pos++;
      } else if (c == '"') {
        type = TokenType.OTHER;
        pos = endOfString(pos);
      } else {
        type = c == '?' ? TokenType.PARAMETER : c == ':' ? TokenType.KEYWORD : TokenType.OTHER;
        pos = endOfWord(pos);
      }
      return new Token(type, text.substring(start, pos), start);
    }

    private int endOfLine(int from) {
      int i = from;
      while (i < text.length() && text.charAt(i) != '\n' && text.charAt(i) != '\r') i++;
      return i;
    }

    private int endOfWord(int from) {
      int i = from + 1;
      while (i < text.length() && !isDelimiter(text.charAt(i))) i++;
      return i;
    }

    // an unterminated string stops at the end of its line; unknown escapes are kept as they are
    private int endOfString(int from) {
      int i = from + 1;
      while (i < text.length()) {
        char c = text.charAt(i);
        if (c == '\\' && i + 1 < text.length() && text.charAt(i + 1) != '\n') {
          i += 2;
        } else if (c == '"') {
          return i + 1;
        } else if (c == '\n' || c == '\r') {
          return i;
        } else {
          i++;
        }
      }
      return text.length();
    }

    private static boolean isDelimiter(char c) {
      return Character.isWhitespace(c) || c == '(' || c == ')' || c == ';';
    }
  }
}
