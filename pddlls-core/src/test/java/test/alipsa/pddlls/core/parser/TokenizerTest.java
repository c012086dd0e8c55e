package test.alipsa.pddlls.core.parser;

import org.junit.jupiter.api.Test;
import se.alipsa.pddlls.core.parser.Token;
import se.alipsa.pddlls.core.parser.TokenType;
import se.alipsa.pddlls.core.parser.Tokenizer;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TokenizerTest {

  @Test
  void tokenize_concatenationReproducesInput() {
    String text = "(define (domain d1) ; comment\n\t(:predicates (at ?x - truck)))\n) \"str\" ?p";
    String joined = Tokenizer.tokenizeToList(text).stream().map(Token::getText).collect(Collectors.joining());
    assertEquals(text, joined);
  }

  @Test
  void operatorBrackets_areRecognizedWithWhitespaceAndCase() {
    List<Token> tokens = Tokenizer.tokenizeToList("( At\tStart (p))");
    assertEquals(TokenType.OPEN_BRACKET_OPERATOR, tokens.get(0).getType());
    assertEquals("at start", tokens.get(0).getKeyword());
    assertEquals(TokenType.OPEN_BRACKET, tokens.get(2).getType());
  }

  @Test
  void keywordPrefix_isNotAnOperator() {
    // "atx" is an identifier, not the "at" operator
    List<Token> tokens = Tokenizer.tokenizeToList("(atx ?a)");
    assertEquals(TokenType.OPEN_BRACKET, tokens.get(0).getType());
    assertEquals("atx", tokens.get(1).getText());
    assertEquals(TokenType.PARAMETER, tokens.get(3).getType());
  }

  @Test
  void longestKeywordWins() {
    List<Token> tokens = Tokenizer.tokenizeToList("(at-most-once (p))");
    assertEquals("at-most-once", tokens.get(0).getKeyword());
  }

  @Test
  void commentsRunToEndOfLine() {
    List<Token> tokens = Tokenizer.tokenizeToList("; hello (world)\n(p)");
    assertEquals(TokenType.COMMENT, tokens.get(0).getType());
    assertEquals("; hello (world)", tokens.get(0).getText());
    assertEquals(TokenType.WHITESPACE, tokens.get(1).getType());
  }

  @Test
  void keywordsAndNumbers() {
    List<Token> tokens = Tokenizer.tokenizeToList(":parameters 12.5 x");
    assertEquals(TokenType.KEYWORD, tokens.get(0).getType());
    assertTrue(tokens.get(2).isNumeric());
    assertFalse(tokens.get(4).isNumeric());
  }

  @Test
  void iterableIsRestartable() {
    Iterable<Token> tokens = Tokenizer.tokenize("(a b)");
    int first = 0;
    for (Token ignored : tokens) first++;
    int second = 0;
    for (Token ignored : tokens) second++;
    assertEquals(first, second);
    assertEquals(5, first);
  }
}
