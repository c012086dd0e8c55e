package se.alipsa.pddlls.pddl.symbols;

import java.util.Arrays;
import java.util.Optional;

/** The kind of change a write reference makes. */
public enum EffectKind {
  MAKE_TRUE("make-true"),
  MAKE_FALSE("make-false"),
  ASSIGN("assign"),
  INCREASE("increase"),
  DECREASE("decrease"),
  SCALE_UP("scale-up"),
  SCALE_DOWN("scale-down");

  private final String label;

  EffectKind(String label) {
    this.label = label;
  }

  public String getLabel() { return label; }

  /** The numeric effect introduced by an operator keyword such as {@code increase}. */
  public static Optional<EffectKind> fromNumericOperator(String keyword) {
    if (keyword == null) return Optional.empty();
    return Arrays.stream(values())
        .filter(k -> k != MAKE_TRUE && k != MAKE_FALSE)
        .filter(k -> k.label.equals(keyword))
        .findFirst();
  }

  @Override
  public String toString() {
    return label;
  }
}
