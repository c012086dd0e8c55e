package test.alipsa.pddlls.pddl.symbols;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import se.alipsa.pddlls.core.model.DomainInfo;
import se.alipsa.pddlls.core.model.Variable;
import se.alipsa.pddlls.pddl.parser.DomainParser;
import se.alipsa.pddlls.pddl.symbols.EffectKind;
import se.alipsa.pddlls.pddl.symbols.ModelHierarchy;
import se.alipsa.pddlls.pddl.symbols.VariableReferenceInfo;
import se.alipsa.pddlls.pddl.symbols.VariableReferenceKind;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static test.alipsa.pddlls.pddl.PddlFixtures.request;
import static test.alipsa.pddlls.pddl.PddlFixtures.resource;

class ModelHierarchyTest {

  private String text;
  private DomainInfo domain;
  private ModelHierarchy hierarchy;

  @BeforeEach
  void parseLogistics() {
    text = resource("/logistics/domain.pddl");
    domain = new DomainParser().parse(request("file:///work/domain.pddl", text)).orElseThrow();
    hierarchy = new ModelHierarchy(domain);
  }

  private Variable predicate(String name) {
    return domain.getPredicates().stream().filter(v -> v.getName().equals(name)).findFirst().orElseThrow();
  }

  private Variable function(String name) {
    return domain.getFunctions().stream().filter(v -> v.getName().equals(name)).findFirst().orElseThrow();
  }

  @Test
  void predicateReadAndWritten() {
    List<VariableReferenceInfo> refs = hierarchy.getReferences(predicate("at"));
    assertEquals(4, refs.size());

    assertEquals(VariableReferenceKind.READ, refs.get(0).getKind());
    assertEquals("condition", refs.get(0).getPart());
    assertEquals("at start", refs.get(0).getTimeQualifier());
    assertEquals("drive", refs.get(0).getConstruct().orElseThrow().getName());

    assertEquals(VariableReferenceKind.WRITE, refs.get(1).getKind());
    assertEquals(Optional.of(EffectKind.MAKE_FALSE), refs.get(1).getEffectKind());
    assertEquals("(not (at ?t ?from))", refs.get(1).getRelevantCode());

    assertEquals(Optional.of(EffectKind.MAKE_TRUE), refs.get(2).getEffectKind());
    assertEquals("at end", refs.get(2).getTimeQualifier());

    assertEquals("refuel", refs.get(3).getConstruct().orElseThrow().getName());
    assertEquals("precondition", refs.get(3).getPart());
    assertEquals("", refs.get(3).getTimeQualifier());
  }

  @Test
  void functionReadDecreasedAndAssigned() {
    List<VariableReferenceInfo> refs = hierarchy.getReferences(function("fuel"));
    assertEquals(3, refs.size());
    assertEquals(VariableReferenceKind.READ, refs.get(0).getKind());
    assertEquals(Optional.of(EffectKind.DECREASE), refs.get(1).getEffectKind());
    assertEquals("(decrease (fuel ?t) (distance ?from ?to))", refs.get(1).getRelevantCode());
    assertEquals(VariableReferenceKind.WRITE, refs.get(2).getKind());
    assertEquals("assign", refs.get(2).getEffectKind().orElseThrow().getLabel());
  }

  @Test
  void numericEffectReadsItsOperand() {
    List<VariableReferenceInfo> refs = hierarchy.getReferences(function("distance"));
    assertEquals(List.of("duration", "condition", "effect"), refs.stream().map(VariableReferenceInfo::getPart).toList());
    assertTrue(refs.stream().allMatch(r -> r.getKind() == VariableReferenceKind.READ));
    assertTrue(refs.get(2).getEffectKind().isEmpty());
  }

  @Test
  void derivedPredicate() {
    List<VariableReferenceInfo> road = hierarchy.getReferences(predicate("road"));
    assertEquals(2, road.size());
    assertEquals("over all", road.get(0).getTimeQualifier());
    assertEquals("connected", road.get(1).getConstruct().orElseThrow().getName());
    assertEquals("condition", road.get(1).getPart());

    Variable connected = domain.getDerived().get(0).getVariable();
    VariableReferenceInfo head = hierarchy.getReferences(connected).get(0);
    assertEquals(VariableReferenceKind.WRITE, head.getKind());
    assertEquals(ModelHierarchy.DERIVED_HEAD_PART, head.getPart());
  }

  @Test
  void referenceAtOffset() {
    int offset = text.indexOf("(fuel ?t) 100") + 2;
    VariableReferenceInfo info = hierarchy.getReferenceInfo(function("fuel"), offset);
    assertEquals(VariableReferenceKind.WRITE, info.getKind());
    assertEquals(Optional.of(EffectKind.ASSIGN), info.getEffectKind());
    assertEquals("refuel", info.getConstruct().orElseThrow().getName());

    int outside = text.indexOf("(:types");
    assertEquals(VariableReferenceKind.UNRECOGNIZED, hierarchy.getReferenceInfo(function("fuel"), outside).getKind());
  }

  @Test
  void effectInsideUnknownOperator_isReadOrWrite() {
    String source = """
        (define (domain d)
          (:predicates (p))
          (:action a :parameters () :effect (and (oneof (p) (q)))))
        """;
    DomainInfo d = new DomainParser().parse(request("file:///d.pddl", source)).orElseThrow();
    VariableReferenceInfo ref = new ModelHierarchy(d).getReferences(d.getPredicates().get(0)).get(0);
    assertEquals(VariableReferenceKind.READ_OR_WRITE, ref.getKind());
    assertEquals("effect", ref.getPart());
  }
}
