package test.alipsa.pddlls.pddl.parser;

import org.junit.jupiter.api.Test;
import se.alipsa.pddlls.core.model.TypeHierarchy;
import se.alipsa.pddlls.core.model.TypeObjectMap;
import se.alipsa.pddlls.pddl.parser.InheritanceParser;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InheritanceParserTest {

  @Test
  void groupsBeforeADashShareTheParent() {
    TypeHierarchy h = InheritanceParser.parseInheritance("truck airplane - vehicle\n vehicle location - object");
    assertEquals(Set.of("truck", "airplane"), h.getChildren("vehicle"));
    assertEquals(Set.of("vehicle", "location"), h.getChildren("object"));
  }

  @Test
  void untypedNamesGoBelowObject() {
    TypeHierarchy h = InheritanceParser.parseInheritance("a b c - d e");
    assertEquals(Set.of("a", "b", "c"), h.getChildren("d"));
    assertEquals(Set.of("e"), h.getChildren(TypeHierarchy.ROOT));
  }

  @Test
  void commentsAndTrailingDashAreTolerated() {
    TypeHierarchy h = InheritanceParser.parseInheritance("a ; not a type\n b -");
    assertEquals(Set.of("a", "b"), h.getChildren(TypeHierarchy.ROOT));
    assertTrue(InheritanceParser.parseInheritance("  ").isEmpty());
  }

  @Test
  void objectsMapToTheirTypes() {
    TypeObjectMap objects = InheritanceParser.toTypeObjects(InheritanceParser.parseInheritance("a b - loc"));
    assertEquals("loc", objects.getTypeOf("a").orElseThrow());
    assertEquals("loc", objects.getTypeOf("b").orElseThrow());
    assertEquals(2, objects.size());
  }
}
