package test.alipsa.pddlls.pddl.parser;

import org.junit.jupiter.api.Test;
import se.alipsa.pddlls.core.SimplePositionResolver;
import se.alipsa.pddlls.core.model.ParsingProblem;
import se.alipsa.pddlls.core.model.ProblemInfo;
import se.alipsa.pddlls.core.model.SupplyDemand;
import se.alipsa.pddlls.core.model.TimedVariableValue;
import se.alipsa.pddlls.core.model.VariableValue;
import se.alipsa.pddlls.core.parser.SyntaxTreeBuilder;
import se.alipsa.pddlls.pddl.parser.ProblemParser;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static test.alipsa.pddlls.pddl.PddlFixtures.resource;

class ProblemParserTest {

  private static Optional<ProblemInfo> parse(String text) {
    return new ProblemParser().parse("file:///work/p.pddl", 1, text, SyntaxTreeBuilder.build(text), text,
        new SimplePositionResolver(text));
  }

  @Test
  void namesObjectsAndTimedInit() {
    ProblemInfo problem = parse("""
        (define (problem p1) (:domain d1)
          (:objects a b - loc)
          (:init (at 10 (visited a)))
        )
        """).orElseThrow();
    assertEquals("p1", problem.getName());
    assertEquals("d1", problem.getDomainName());
    assertEquals("loc", problem.getObjects().getTypeOf("a").orElseThrow());
    assertEquals("loc", problem.getObjects().getTypeOf("b").orElseThrow());
    assertEquals(List.of(TimedVariableValue.from(10, VariableValue.of("visited a", true))), problem.getInits());
  }

  @Test
  void atWithoutTime_isUnsupportedAtTimeZero() {
    ProblemInfo problem = parse("(define (problem p1) (:domain d1) (:init (at (foo))))").orElseThrow();
    TimedVariableValue init = problem.getInits().get(0);
    assertEquals(0, init.getTime());
    assertFalse(init.isSupported());
  }

  @Test
  void negatedFact_isFalse() {
    ProblemInfo problem = parse("(define (problem p1) (:domain d1) (:init (not (at-location a room1))))")
        .orElseThrow();
    assertEquals(List.of(TimedVariableValue.from(0, VariableValue.of("at-location a room1", false))),
        problem.getInits());
  }

  @Test
  void logisticsProblem() {
    ProblemInfo problem = parse(resource("/logistics/p01.pddl")).orElseThrow();
    assertEquals("p01", problem.getName());
    assertEquals("logistics", problem.getDomainName());
    assertEquals(4, problem.getObjects().size());
    assertTrue(problem.getParsingProblems().isEmpty(), problem.getParsingProblems().toString());

    List<TimedVariableValue> inits = problem.getInits();
    assertEquals(7, inits.size());
    assertEquals(VariableValue.of("at t1 depot", true), inits.get(0).getVariableValue());
    assertEquals(VariableValue.of("fuel t1", 50.0), inits.get(3).getVariableValue());
    assertEquals(VariableValue.of("at t2 harbour", false), inits.get(5).getVariableValue());
    assertEquals(10, inits.get(6).getTime());
    assertEquals("road market harbour", inits.get(6).getVariableName());

    assertEquals("and", problem.getGoal().orElseThrow().getKeyword());
    assertTrue(problem.getMetric().isPresent());
    assertTrue(problem.getPreProcessor().isEmpty());
  }

  @Test
  void supplyDemandAndUnsupportedShapes() {
    ProblemInfo problem = parse("""
        (define (problem p) (:domain d)
          (:init
            (supply-demand sd1 (over all (x)))
            (= (level) (+ 1 2))
            (increase (level) 1)))
        """).orElseThrow();
    assertEquals(List.of(new SupplyDemand("sd1")), problem.getSupplyDemands());
    assertEquals(2, problem.getInits().size());
    assertTrue(problem.getInits().stream().noneMatch(TimedVariableValue::isSupported));
    assertEquals("level", problem.getInits().get(0).getVariableName());
  }

  @Test
  void notAProblem() {
    assertTrue(parse("(define (domain d))").isEmpty());
    assertTrue(parse("(define (problem p))").isEmpty());
  }

  @Test
  void duplicateInit_isWarned() {
    ProblemInfo problem = parse("(define (problem p) (:domain d) (:init (a)) (:init (b)))").orElseThrow();
    assertEquals(1, problem.getInits().size());
    assertEquals(ParsingProblem.Severity.WARNING, problem.getParsingProblems().get(0).getSeverity());
  }
}
