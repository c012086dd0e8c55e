package se.alipsa.pddlls.core.parser;

/** Lexical categories produced by {@link Tokenizer}. */
public enum TokenType {
  /** Synthetic token of the root node; never produced by the tokenizer. */
  DOCUMENT,
  OPEN_BRACKET,
  /** An open bracket followed by a known keyword, e.g. {@code (at} or {@code (:init}. */
  OPEN_BRACKET_OPERATOR,
  CLOSE_BRACKET,
  /** {@code ?x} style parameter. */
  PARAMETER,
  /** {@code :name} outside of a bracket head, e.g. {@code :parameters} or {@code :typing}. */
  KEYWORD,
  COMMENT,
  WHITESPACE,
  /** Identifiers, numbers, quoted strings and anything else. */
  OTHER
}
