package se.alipsa.pddlls.core.model;

import java.util.Objects;

/** An initial-state assertion that takes effect at a given time (0 for untimed facts). */
public final class TimedVariableValue {

  private final double time;
  private final VariableValue value;

  public TimedVariableValue(double time, VariableValue value) {
    this.time = time;
    this.value = Objects.requireNonNull(value, "value");
  }

  public static TimedVariableValue from(double time, VariableValue value) {
    return new TimedVariableValue(time, value);
  }

  public double getTime() { return time; }

  public String getVariableName() { return value.getVariableName(); }

  public VariableValue getVariableValue() { return value; }

  /** {@link Boolean}, {@link Double} or the verbatim text of an unsupported value. */
  public Object getValue() { return value.getValue(); }

  public boolean isSupported() { return value.isSupported(); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof TimedVariableValue that)) return false;
    return Double.compare(time, that.time) == 0 && value.equals(that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(time, value);
  }

  @Override
  public String toString() {
    return time + ": " + value;
  }
}
