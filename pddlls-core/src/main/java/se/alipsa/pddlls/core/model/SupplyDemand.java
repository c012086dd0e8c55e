package se.alipsa.pddlls.core.model;

import java.util.Objects;

/** A {@code (supply-demand NAME ...)} directive of a problem's initial state. */
public final class SupplyDemand {
  private final String name;

  public SupplyDemand(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  public String getName() { return name; }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof SupplyDemand that && name.equals(that.name));
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return "supply-demand " + name;
  }
}
