package se.alipsa.pddlls.core.model;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Parent to ordered-children mapping of declared types (or of objects to their types). Names that
 * were declared without a parent hang below {@link #ROOT}.
 */
public final class TypeHierarchy {
  public static final String ROOT = "object";

  private final Map<String, Set<String>> childrenByParent = new LinkedHashMap<>();
  private final Map<String, String> parentByChild = new LinkedHashMap<>();
  private final Map<String, Set<String>> descendantsCache = new HashMap<>();

  public void addInheritance(String child, String parent) {
    descendantsCache.clear();
    if (child.equals(parent)) {
      childrenByParent.computeIfAbsent(parent, k -> new LinkedHashSet<>());
      return;
    }
    childrenByParent.computeIfAbsent(parent, k -> new LinkedHashSet<>()).add(child);
    parentByChild.put(child, parent);
  }

  /** Every name that appears, as parent or as child, in declaration order. */
  public Set<String> getTypes() {
    Set<String> out = new LinkedHashSet<>();
    childrenByParent.forEach((parent, children) -> {
      out.add(parent);
      out.addAll(children);
    });
    return Collections.unmodifiableSet(out);
  }

  public Map<String, Set<String>> getChildrenByParent() {
    Map<String, Set<String>> copy = new LinkedHashMap<>();
    childrenByParent.forEach((k, v) -> copy.put(k, Collections.unmodifiableSet(new LinkedHashSet<>(v))));
    return Collections.unmodifiableMap(copy);
  }

  public Set<String> getChildren(String parent) {
    return Collections.unmodifiableSet(childrenByParent.getOrDefault(parent, Set.of()));
  }

  public Optional<String> getParent(String child) {
    return Optional.ofNullable(parentByChild.get(child));
  }

  public boolean isEmpty() {
    return childrenByParent.isEmpty();
  }

  /**
   * All types inheriting from {@code type}, directly or transitively. The type itself is not
   * included. Cycles end the walk instead of looping.
   */
  public Set<String> getDescendants(String type) {
    Set<String> cached = descendantsCache.get(type);
    if (cached != null) return cached;

    Set<String> visited = new LinkedHashSet<>();
    Deque<String> pending = new ArrayDeque<>(getChildren(type));
    while (!pending.isEmpty()) {
      String next = pending.poll();
      if (next.equals(type) || !visited.add(next)) continue;
      pending.addAll(getChildren(next));
    }
    Set<String> result = Collections.unmodifiableSet(visited);
    descendantsCache.put(type, result);
    return result;
  }

  /** {@code true} if {@code type} equals {@code ancestor} or inherits from it. */
  public boolean isSubtypeOf(String type, String ancestor) {
    return type.equals(ancestor) || getDescendants(ancestor).contains(type);
  }

  @Override
  public String toString() {
    return childrenByParent.toString();
  }
}
