package test.alipsa.pddlls.pddl.parser;

import org.junit.jupiter.api.Test;
import se.alipsa.pddlls.core.SimplePositionResolver;
import se.alipsa.pddlls.core.model.constraints.AfterConstraint;
import se.alipsa.pddlls.core.model.constraints.Constraint;
import se.alipsa.pddlls.core.model.constraints.ForallConstraint;
import se.alipsa.pddlls.core.model.constraints.ModalConstraint;
import se.alipsa.pddlls.core.model.constraints.NamedConditionConstraint;
import se.alipsa.pddlls.core.model.constraints.PreferenceConstraint;
import se.alipsa.pddlls.core.model.constraints.UnrecognizedConstraint;
import se.alipsa.pddlls.core.parser.SyntaxNode;
import se.alipsa.pddlls.core.parser.SyntaxTreeBuilder;
import se.alipsa.pddlls.pddl.parser.ConstraintsParser;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConstraintsParserTest {

  private ConstraintsParser parser;

  private List<Constraint> parse(String text) {
    parser = new ConstraintsParser(new SimplePositionResolver(text));
    SyntaxNode section = SyntaxTreeBuilder.build(text).getRootNode().getNonWhitespaceNonCommentChildren().get(0);
    return parser.parseConstraints(section);
  }

  @Test
  void namedConditionsAndAfter() {
    List<Constraint> constraints = parse("""
        (:constraints (and
          (name c1 (loaded p1))
          (after c1 (delivered p1))))
        """);
    assertEquals(2, constraints.size());
    NamedConditionConstraint named = (NamedConditionConstraint) constraints.get(0);
    assertEquals("c1", named.getName().orElseThrow());
    assertEquals("(loaded p1)", named.getCondition().orElseThrow().getText());

    AfterConstraint after = (AfterConstraint) constraints.get(1);
    assertEquals("c1", after.getPredecessor().getName().orElseThrow());
    assertTrue(after.getPredecessor().getCondition().isEmpty());
    assertTrue(after.getSuccessor().getName().isEmpty());
    assertEquals("(delivered p1)", after.getSuccessor().getCondition().orElseThrow().getText());
    assertTrue(parser.getProblems().isEmpty());
  }

  @Test
  void modalOperators() {
    List<Constraint> constraints = parse("""
        (:constraints (and
          (always (safe))
          (hold-during 2 5 (open))
          (sometime-before (b) (a))
          (at end (done))))
        """);
    assertEquals(List.of(ModalConstraint.Modality.ALWAYS, ModalConstraint.Modality.HOLD_DURING,
            ModalConstraint.Modality.SOMETIME_BEFORE, ModalConstraint.Modality.AT_END),
        constraints.stream().map(c -> ((ModalConstraint) c).getModality()).toList());
    assertEquals(List.of(2.0, 5.0), ((ModalConstraint) constraints.get(1)).getTimes());
    assertEquals(2, ((ModalConstraint) constraints.get(2)).getConditions().size());
  }

  @Test
  void preferenceAndForallWrapConstraints() {
    List<Constraint> constraints = parse("""
        (:constraints (and
          (preference p1 (always (clean)))
          (forall (?r - room) (sometime (visited ?r)))))
        """);
    PreferenceConstraint preference = (PreferenceConstraint) constraints.get(0);
    assertEquals("p1", preference.getName().orElseThrow());
    assertInstanceOf(ModalConstraint.class, preference.getConstraint());

    ForallConstraint forall = (ForallConstraint) constraints.get(1);
    assertEquals("room", forall.getParameters().get(0).getType());
    assertEquals(ModalConstraint.Modality.SOMETIME, ((ModalConstraint) forall.getConstraint()).getModality());
  }

  @Test
  void wrongArity_isUnrecognizedWithWarning() {
    List<Constraint> constraints = parse("(:constraints (within (x)))");
    assertInstanceOf(UnrecognizedConstraint.class, constraints.get(0));
    assertEquals(1, parser.getProblems().size());
    assertTrue(parser.getProblems().get(0).getMessage().contains("(within (x))"));
  }
}
