package test.alipsa.pddlls.pddl.parser;

import org.junit.jupiter.api.Test;
import se.alipsa.pddlls.core.model.ConstructKind;
import se.alipsa.pddlls.core.model.DerivedPredicate;
import se.alipsa.pddlls.core.model.DomainConstruct;
import se.alipsa.pddlls.core.model.DomainInfo;
import se.alipsa.pddlls.core.model.DurativeAction;
import se.alipsa.pddlls.core.model.InstantAction;
import se.alipsa.pddlls.core.model.Parameter;
import se.alipsa.pddlls.core.model.ParsingProblem;
import se.alipsa.pddlls.core.model.Variable;
import se.alipsa.pddlls.core.model.constraints.ModalConstraint;
import se.alipsa.pddlls.pddl.parser.DomainParser;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static test.alipsa.pddlls.pddl.PddlFixtures.request;
import static test.alipsa.pddlls.pddl.PddlFixtures.resource;

class DomainParserTest {

  private static DomainInfo parse(String text) {
    return new DomainParser().parse(request("file:///work/domain.pddl", text)).orElseThrow();
  }

  @Test
  void logistics_extractsEverySection() {
    DomainInfo domain = parse(resource("/logistics/domain.pddl"));
    assertEquals("logistics", domain.getName());
    assertTrue(domain.getParsingProblems().isEmpty(), domain.getParsingProblems().toString());
    assertTrue(domain.getRequirements().contains(":durative-actions"));
    assertEquals(Set.of("truck", "airplane"), domain.getTypesInheritingFrom("vehicle"));
    assertEquals("location", domain.getConstants().getTypeOf("depot").orElseThrow());

    List<Variable> predicates = domain.getPredicates();
    assertEquals(2, predicates.size());
    Variable at = predicates.get(0);
    assertEquals("at", at.getName());
    assertEquals(List.of(new Parameter("v", "vehicle"), new Parameter("l", "location")), at.getParameters());
    assertEquals(List.of("vehicle position"), at.getDocumentation());
    assertNotNull(at.getLocation());

    assertEquals(List.of("fuel", "distance"), domain.getFunctions().stream().map(Variable::getName).toList());
  }

  @Test
  void logistics_constructs() {
    DomainInfo domain = parse(resource("/logistics/domain.pddl"));
    assertEquals(3, domain.getConstructs().size());

    DurativeAction drive = (DurativeAction) domain.getConstruct("drive").orElseThrow();
    assertEquals(ConstructKind.DURATIVE_ACTION, drive.getKind());
    assertEquals(3, drive.getParameters().size());
    assertEquals("truck", drive.getParameters().get(0).getType());
    assertEquals(List.of("Moves a truck along a road."), drive.getDocumentation());
    assertTrue(drive.getDuration().isPresent());
    assertEquals("and", drive.getCondition().orElseThrow().getKeyword());
    assertTrue(drive.getEffect().isPresent());

    InstantAction refuel = (InstantAction) domain.getConstructs(ConstructKind.ACTION).get(0);
    assertEquals("refuel", refuel.getName());
    assertTrue(refuel.getPrecondition().isPresent());

    DerivedPredicate connected = domain.getDerived().get(0);
    assertEquals("connected", connected.getVariable().getName());
    assertEquals(2, connected.getParameters().size());
    assertEquals("(road ?a ?b)", connected.getCondition().orElseThrow().getText());
  }

  @Test
  void notADomain_yieldsEmpty() {
    assertTrue(new DomainParser().parse(request("file:///p.pddl", "(define (problem p) (:domain d))")).isEmpty());
    assertTrue(new DomainParser().parse(request("file:///x.pddl", "")).isEmpty());
  }

  @Test
  void brokenSection_isReportedAndOthersSurvive() {
    DomainInfo domain = parse("""
        (define (domain broken)
          (:predicates (p ?x))
          (:action
            :parameters (?x)
            :effect (p ?x))
          (:action ok :parameters (?x) :effect (not (p ?x)))
        )
        """);
    assertEquals(1, domain.getPredicates().size());
    assertEquals(List.of("ok"), domain.getConstructs().stream().map(DomainConstruct::getName).toList());
    ParsingProblem problem = domain.getParsingProblems().get(0);
    assertEquals(ParsingProblem.Severity.ERROR, problem.getSeverity());
    assertEquals(2, problem.getLine());
    assertTrue(problem.getMessage().startsWith("Cannot parse :action"));
  }

  @Test
  void duplicateSection_isIgnoredWithWarning() {
    DomainInfo domain = parse("(define (domain d) (:types a) (:types b))");
    assertEquals(Set.of("a"), domain.getTypes().getChildren("object"));
    assertEquals(ParsingProblem.Severity.WARNING, domain.getParsingProblems().get(0).getSeverity());
  }

  @Test
  void domainConstraints() {
    DomainInfo domain = parse("""
        (define (domain c)
          (:constraints (and (always (safe)) (within 10 (done)) (bogus))))
        """);
    assertEquals(3, domain.getConstraints().size());
    ModalConstraint within = (ModalConstraint) domain.getConstraints().get(1);
    assertEquals(ModalConstraint.Modality.WITHIN, within.getModality());
    assertEquals(List.of(10.0), within.getTimes());
    assertEquals(1, domain.getParsingProblems().size());
  }
}
