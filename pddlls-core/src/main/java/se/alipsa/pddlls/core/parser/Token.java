package se.alipsa.pddlls.core.parser;

import java.util.Objects;
import java.util.regex.Pattern;

/** An immutable, typed span of source text. */
public final class Token {

  private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

  private final TokenType type;
  private final String text;
  private final int start;

  public Token(TokenType type, String text, int start) {
    this.type = Objects.requireNonNull(type, "type");
    this.text = Objects.requireNonNull(text, "text");
    if (start < 0) throw new IllegalArgumentException("Negative token offset: " + start);
    this.start = start;
  }

  static Token document() {
    return new Token(TokenType.DOCUMENT, "", 0);
  }

  public TokenType getType() { return type; }

  public String getText() { return text; }

  public int getStart() { return start; }

  /** Offset just past the last character of this token. */
  public int getEnd() { return start + text.length(); }

  public boolean isOpenBracket() {
    return type == TokenType.OPEN_BRACKET || type == TokenType.OPEN_BRACKET_OPERATOR;
  }

  public boolean isNumeric() {
    return type == TokenType.OTHER && NUMBER.matcher(text).matches();
  }

  /**
   * The normalized keyword of an operator bracket ({@code "( At  start"} gives {@code "at start"}),
   * or {@code null} for every other token type.
   */
  public String getKeyword() {
    return type == TokenType.OPEN_BRACKET_OPERATOR ? Keywords.normalize(text) : null;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Token that)) return false;
    return start == that.start && type == that.type && text.equals(that.text);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, text, start);
  }

  @Override
  public String toString() {
    return text;
  }
}
