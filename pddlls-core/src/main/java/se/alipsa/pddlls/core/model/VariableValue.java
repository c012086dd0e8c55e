package se.alipsa.pddlls.core.model;

import java.util.Objects;

/**
 * Value of a ground variable in an initial state: boolean, numeric, or an unsupported expression
 * kept verbatim so that consumers can report it.
 */
public final class VariableValue {
  public enum Kind { BOOLEAN, NUMERIC, UNSUPPORTED }

  private final String variableName;
  private final Kind kind;
  private final boolean booleanValue;
  private final double numericValue;
  private final String verbatim;

  private VariableValue(String variableName, Kind kind, boolean booleanValue, double numericValue, String verbatim) {
    this.variableName = Objects.requireNonNull(variableName, "variableName");
    this.kind = kind;
    this.booleanValue = booleanValue;
    this.numericValue = numericValue;
    this.verbatim = verbatim;
  }

  public static VariableValue of(String variableName, boolean value) {
    return new VariableValue(variableName, Kind.BOOLEAN, value, Double.NaN, null);
  }

  public static VariableValue of(String variableName, double value) {
    return new VariableValue(variableName, Kind.NUMERIC, false, value, null);
  }

  public static VariableValue unsupported(String variableName, String verbatim) {
    return new VariableValue(variableName, Kind.UNSUPPORTED, false, Double.NaN, Objects.requireNonNull(verbatim));
  }

  public String getVariableName() { return variableName; }

  public Kind getKind() { return kind; }

  public boolean isSupported() { return kind != Kind.UNSUPPORTED; }

  public boolean getBooleanValue() {
    if (kind != Kind.BOOLEAN) throw new IllegalStateException(variableName + " is not a boolean value but " + kind);
    return booleanValue;
  }

  public double getNumericValue() {
    if (kind != Kind.NUMERIC) throw new IllegalStateException(variableName + " is not a numeric value but " + kind);
    return numericValue;
  }

  /** Original text of an unsupported expression, {@code null} for supported values. */
  public String getVerbatim() { return verbatim; }

  /**
   * Logical negation. Only boolean values can be negated; anything else becomes unsupported with
   * the given verbatim text.
   */
  public VariableValue negate(String verbatimOfNegation) {
    if (kind == Kind.BOOLEAN) return of(variableName, !booleanValue);
    return unsupported(variableName, verbatimOfNegation);
  }

  /** The value as an object: {@link Boolean}, {@link Double} or the verbatim {@link String}. */
  public Object getValue() {
    return switch (kind) {
      case BOOLEAN -> booleanValue;
      case NUMERIC -> numericValue;
      case UNSUPPORTED -> verbatim;
    };
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof VariableValue that)) return false;
    return kind == that.kind && booleanValue == that.booleanValue
        && Double.compare(numericValue, that.numericValue) == 0
        && variableName.equals(that.variableName) && Objects.equals(verbatim, that.verbatim);
  }

  @Override
  public int hashCode() {
    return Objects.hash(variableName, kind, booleanValue, numericValue, verbatim);
  }

  @Override
  public String toString() {
    return variableName + "=" + getValue();
  }
}
