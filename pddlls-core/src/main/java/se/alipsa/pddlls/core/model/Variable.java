package se.alipsa.pddlls.core.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A predicate or function signature. Two variables are equal when their names match
 * case-insensitively and they take the same number of parameters.
 */
public final class Variable {

  private final String name;
  private final List<Parameter> parameters;
  private final Range location;
  private final List<String> documentation;

  public Variable(String name, List<Parameter> parameters) {
    this(name, parameters, null, List.of());
  }

  public Variable(String name, List<Parameter> parameters, Range location, List<String> documentation) {
    this.name = Objects.requireNonNull(name, "name");
    this.parameters = List.copyOf(parameters);
    this.location = location;
    this.documentation = List.copyOf(documentation);
  }

  public String getName() { return name; }

  public List<Parameter> getParameters() { return parameters; }

  /** Declaration range, or {@code null} when the variable was not read from a declaration. */
  public Range getLocation() { return location; }

  public List<String> getDocumentation() { return documentation; }

  /** e.g. {@code at ?t - truck ?l - location} */
  public String getFullName() {
    if (parameters.isEmpty()) return name;
    return name + " " + parameters.stream().map(Parameter::toPddlString).collect(Collectors.joining(" "));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Variable that)) return false;
    return name.equalsIgnoreCase(that.name) && parameters.size() == that.parameters.size();
  }

  @Override
  public int hashCode() {
    return Objects.hash(name.toLowerCase(Locale.ROOT), parameters.size());
  }

  @Override
  public String toString() {
    return "(" + getFullName() + ")";
  }
}
