package se.alipsa.pddlls.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Objects (or constants) grouped by their declared type. */
public final class TypeObjectMap {

  private final Map<String, Set<String>> objectsByType = new LinkedHashMap<>();
  private final Map<String, String> typeByObject = new LinkedHashMap<>();

  public void add(String type, String object) {
    String previous = typeByObject.put(object, type);
    if (previous != null && !previous.equals(type)) {
      objectsByType.get(previous).remove(object);
    }
    objectsByType.computeIfAbsent(type, k -> new LinkedHashSet<>()).add(object);
  }

  public Set<String> getTypes() {
    return Collections.unmodifiableSet(objectsByType.keySet());
  }

  public Set<String> getObjects() {
    return Collections.unmodifiableSet(typeByObject.keySet());
  }

  public Set<String> getObjectsOfType(String type) {
    return Collections.unmodifiableSet(objectsByType.getOrDefault(type, Set.of()));
  }

  public Optional<String> getTypeOf(String object) {
    return Optional.ofNullable(typeByObject.get(object));
  }

  /** Objects of {@code type} and of every type inheriting from it. */
  public Set<String> getObjectsInheritingFrom(String type, TypeHierarchy types) {
    Set<String> out = new LinkedHashSet<>(getObjectsOfType(type));
    types.getDescendants(type).forEach(t -> out.addAll(getObjectsOfType(t)));
    return Collections.unmodifiableSet(out);
  }

  public Map<String, String> asObjectToTypeMap() {
    return Collections.unmodifiableMap(typeByObject);
  }

  public int size() {
    return typeByObject.size();
  }

  public boolean isEmpty() {
    return typeByObject.isEmpty();
  }

  @Override
  public String toString() {
    return objectsByType.toString();
  }
}
