package se.alipsa.pddlls.pddl.parser;

import se.alipsa.pddlls.core.TextUtil;
import se.alipsa.pddlls.core.model.TypeHierarchy;
import se.alipsa.pddlls.core.model.TypeObjectMap;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads {@code a b - parent c - parent2 d} declarations, as found in {@code :types},
 * {@code :constants} and {@code :objects}. Names that are not followed by {@code - parent} hang
 * below {@link TypeHierarchy#ROOT}.
 */
public final class InheritanceParser {
  private InheritanceParser() {}

  public static TypeHierarchy parseInheritance(String declarationText) {
    TypeHierarchy hierarchy = new TypeHierarchy();
    if (declarationText == null) return hierarchy;

    String text = TextUtil.normalizeWhitespace(TextUtil.stripComments(declarationText));
    if (text.isEmpty()) return hierarchy;

    List<String> pending = new ArrayList<>();
    String[] words = text.split(" ");
    for (int i = 0; i < words.length; i++) {
      String word = words[i];
      if (word.equals("-")) {
        if (i + 1 < words.length) {
          String parent = words[++i];
          for (String child : pending) hierarchy.addInheritance(child, parent);
          pending.clear();
        }
        // a trailing dash leaves the pending names for the root
      } else {
        pending.add(word);
      }
    }
    for (String child : pending) hierarchy.addInheritance(child, TypeHierarchy.ROOT);
    return hierarchy;
  }

  /** Turns an objects (or constants) hierarchy into object-to-type assignments. */
  public static TypeObjectMap toTypeObjects(TypeHierarchy hierarchy) {
    TypeObjectMap map = new TypeObjectMap();
    for (Map.Entry<String, Set<String>> e : hierarchy.getChildrenByParent().entrySet()) {
      for (String object : e.getValue()) map.add(e.getKey(), object);
    }
    return map;
  }
}
