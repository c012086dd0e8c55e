package se.alipsa.pddlls.core.model.constraints;

import se.alipsa.pddlls.core.parser.SyntaxNode;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** A modal operator over one or two conditions, some of which take time arguments. */
public final class ModalConstraint extends Constraint {

  public enum Modality {
    AT_END("at end", 0, 1),
    ALWAYS("always", 0, 1),
    SOMETIME("sometime", 0, 1),
    WITHIN("within", 1, 1),
    AT_MOST_ONCE("at-most-once", 0, 1),
    SOMETIME_AFTER("sometime-after", 0, 2),
    SOMETIME_BEFORE("sometime-before", 0, 2),
    ALWAYS_WITHIN("always-within", 1, 2),
    HOLD_DURING("hold-during", 2, 1),
    HOLD_AFTER("hold-after", 1, 1);

    private final String keyword;
    private final int times;
    private final int conditions;

    Modality(String keyword, int times, int conditions) {
      this.keyword = keyword;
      this.times = times;
      this.conditions = conditions;
    }

    public String getKeyword() { return keyword; }

    /** Number of leading numeric arguments. */
    public int getTimeArity() { return times; }

    public int getConditionArity() { return conditions; }

    public static Optional<Modality> fromKeyword(String keyword) {
      if (keyword == null) return Optional.empty();
      String k = keyword.toLowerCase(Locale.ROOT);
      return Arrays.stream(values()).filter(m -> m.keyword.equals(k)).findFirst();
    }
  }

  private final Modality modality;
  private final List<Double> times;
  private final List<Condition> conditions;

  public ModalConstraint(SyntaxNode node, Modality modality, List<Double> times, List<Condition> conditions) {
    super(node);
    this.modality = modality;
    this.times = List.copyOf(times);
    this.conditions = List.copyOf(conditions);
  }

  public Modality getModality() { return modality; }

  public List<Double> getTimes() { return times; }

  public List<Condition> getConditions() { return conditions; }
}
