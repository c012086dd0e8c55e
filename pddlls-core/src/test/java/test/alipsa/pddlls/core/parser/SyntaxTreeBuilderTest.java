package test.alipsa.pddlls.core.parser;

import org.junit.jupiter.api.Test;
import se.alipsa.pddlls.core.parser.SyntaxNode;
import se.alipsa.pddlls.core.parser.SyntaxTree;
import se.alipsa.pddlls.core.parser.SyntaxTreeBuilder;
import se.alipsa.pddlls.core.parser.TokenType;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyntaxTreeBuilderTest {

  private static final String DOMAIN = """
      (define (domain d1)
        (:predicates (at ?t - truck ?l - location))
        (:action drive
          :parameters (?t - truck ?from ?to - location)
          :precondition (at ?t ?from)
          :effect (and (not (at ?t ?from)) (at ?t ?to))))
      """;

  @Test
  void wellFormed_hasNoOffendingTokens() {
    SyntaxTree tree = SyntaxTreeBuilder.build(DOMAIN);
    assertFalse(tree.hasOffendingTokens());
    assertEquals(DOMAIN, tree.getText());
    SyntaxNode define = tree.getDefineNodeOrThrow();
    assertTrue(define.getFirstOpenBracket(":predicates").isPresent());
    assertEquals(1, define.getOpenBrackets(":action").size());
  }

  @Test
  void strayCloseBracket_isReportedAndParsingContinues() {
    SyntaxTree tree = SyntaxTreeBuilder.build("(a)) (b)");
    assertEquals(1, tree.getOffendingTokens().size());
    assertEquals(3, tree.getOffendingTokens().get(0).getStart());
    long brackets = tree.getRootNode().getChildren().stream().filter(SyntaxNode::isOpenBracket).count();
    assertEquals(2, brackets);
  }

  @Test
  void unclosedBrackets_areReportedInDocumentOrder() {
    SyntaxTree tree = SyntaxTreeBuilder.build("(define (domain x)\n (:types a");
    assertEquals(List.of(0, 20), tree.getOffendingTokens().stream().map(t -> t.getStart()).toList());
    assertFalse(tree.getDefineNodeOrThrow().isClosed());
  }

  @Test
  void noDefine_throwsOnOrThrow() {
    SyntaxTree tree = SyntaxTreeBuilder.build("(foo)");
    assertTrue(tree.getDefineNode().isEmpty());
    assertThrows(IllegalStateException.class, tree::getDefineNodeOrThrow);
  }

  @Test
  void getNodeAt_findsInnermostAndExpandsToBracket() {
    SyntaxTree tree = SyntaxTreeBuilder.build(DOMAIN);
    int offset = DOMAIN.indexOf("drive") + 1;
    SyntaxNode node = tree.getNodeAt(offset);
    assertEquals(TokenType.OTHER, node.getType());
    assertEquals("drive", node.getToken().getText());
    assertEquals(":action", node.expand().getKeyword());
  }

  @Test
  void parametrisableScope_andParameterDefinition() {
    SyntaxTree tree = SyntaxTreeBuilder.build(DOMAIN);
    int offset = DOMAIN.indexOf("(at ?t ?to)") + 1;
    SyntaxNode usage = tree.getNodeAt(offset).expand();
    SyntaxNode scope = usage.findParametrisableScope("to").orElseThrow();
    assertEquals(":action", scope.getKeyword());
    String params = scope.getParameterDefinition().orElseThrow().getText();
    assertEquals("(?t - truck ?from ?to - location)", params);
    assertTrue(usage.findParametrisableScope("?nope").isEmpty());
  }

  @Test
  void forallDeclaresItsParameters() {
    String text = "(forall (?c - crate) (in ?c))";
    SyntaxTree tree = SyntaxTreeBuilder.build(text);
    SyntaxNode usage = tree.getNodeAt(text.indexOf("(in") + 1).expand();
    SyntaxNode scope = usage.findParametrisableScope("?c").orElseThrow();
    assertEquals("forall", scope.getKeyword());
    assertEquals("(?c - crate)", scope.getParameterDefinition().orElseThrow().getText());
  }

  @Test
  void nestedNonCommentText_dropsComments() {
    SyntaxTree tree = SyntaxTreeBuilder.build("(:objects a b ; gone\n c - t)");
    SyntaxNode objects = tree.getRootNode().getChildren().get(0);
    assertEquals(" a b \n c - t", objects.getNestedNonCommentText());
  }
}
