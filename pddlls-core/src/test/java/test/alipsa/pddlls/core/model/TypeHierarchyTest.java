package test.alipsa.pddlls.core.model;

import org.junit.jupiter.api.Test;
import se.alipsa.pddlls.core.model.TypeHierarchy;
import se.alipsa.pddlls.core.model.TypeObjectMap;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TypeHierarchyTest {

  private static TypeHierarchy vehicles() {
    TypeHierarchy h = new TypeHierarchy();
    h.addInheritance("vehicle", TypeHierarchy.ROOT);
    h.addInheritance("truck", "vehicle");
    h.addInheritance("airplane", "vehicle");
    h.addInheritance("tanker", "truck");
    h.addInheritance("location", TypeHierarchy.ROOT);
    return h;
  }

  @Test
  void descendants_areTransitiveAndExcludeTheType() {
    TypeHierarchy h = vehicles();
    assertEquals(Set.of("truck", "airplane", "tanker"), h.getDescendants("vehicle"));
    assertEquals(Set.of(), h.getDescendants("tanker"));
    assertTrue(h.isSubtypeOf("tanker", "vehicle"));
    assertTrue(h.isSubtypeOf("truck", "truck"));
    assertFalse(h.isSubtypeOf("location", "vehicle"));
  }

  @Test
  void descendantsCache_isClearedWhenTheHierarchyGrows() {
    TypeHierarchy h = vehicles();
    assertFalse(h.getDescendants("vehicle").contains("boat"));
    h.addInheritance("boat", "vehicle");
    assertTrue(h.getDescendants("vehicle").contains("boat"));
  }

  @Test
  void cycles_doNotLoop() {
    TypeHierarchy h = new TypeHierarchy();
    h.addInheritance("a", "b");
    h.addInheritance("b", "a");
    assertEquals(Set.of("a"), h.getDescendants("b"));
  }

  @Test
  void parentsAndTypes() {
    TypeHierarchy h = vehicles();
    assertEquals("vehicle", h.getParent("truck").orElseThrow());
    assertTrue(h.getParent(TypeHierarchy.ROOT).isEmpty());
    assertTrue(h.getTypes().containsAll(Set.of("object", "vehicle", "tanker", "location")));
  }

  @Test
  void objectsInheritingFrom() {
    TypeHierarchy h = vehicles();
    TypeObjectMap objects = new TypeObjectMap();
    objects.add("truck", "t1");
    objects.add("tanker", "t2");
    objects.add("location", "depot");
    assertEquals(Set.of("t1", "t2"), objects.getObjectsInheritingFrom("truck", h));
    assertEquals("tanker", objects.getTypeOf("t2").orElseThrow());
    assertEquals(3, objects.size());
  }
}
