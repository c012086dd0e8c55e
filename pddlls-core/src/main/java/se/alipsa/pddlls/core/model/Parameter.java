package se.alipsa.pddlls.core.model;

import java.util.Locale;
import java.util.Objects;

/** A typed {@code ?name - type} parameter. The name is stored without the question mark. */
public final class Parameter {
  public static final String DEFAULT_TYPE = "object";

  private final String name;
  private final String type;

  public Parameter(String name, String type) {
    Objects.requireNonNull(name, "name");
    this.name = name.startsWith("?") ? name.substring(1) : name;
    this.type = type == null || type.isBlank() ? DEFAULT_TYPE : type;
  }

  public String getName() { return name; }

  public String getType() { return type; }

  public String toPddlString() {
    return "?" + name + " - " + type;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Parameter that)) return false;
    return name.equalsIgnoreCase(that.name) && type.equalsIgnoreCase(that.type);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name.toLowerCase(Locale.ROOT), type.toLowerCase(Locale.ROOT));
  }

  @Override
  public String toString() {
    return toPddlString();
  }
}
