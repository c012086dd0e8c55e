package se.alipsa.pddlls.core.model;

import se.alipsa.pddlls.core.parser.SyntaxTree;

import java.util.List;
import java.util.OptionalDouble;

/** A plan produced by a planner, with its declared problem and domain names. */
public final class PlanInfo extends FileInfo {

  private final String problemName;
  private final String domainName;
  private List<PlanStep> steps = List.of();
  private Double metric;

  public PlanInfo(String fileUri, int version, String problemName, String domainName, String text,
                  SyntaxTree syntaxTree, PositionResolver positionResolver) {
    super(fileUri, version, PddlLanguage.PLAN, text, syntaxTree, positionResolver);
    this.problemName = problemName;
    this.domainName = domainName;
  }

  @Override
  public FileKind getKind() { return FileKind.PLAN; }

  /** From the {@code ;;!problem:} meta comment, {@code null} when absent. */
  public String getProblemName() { return problemName; }

  /** From the {@code ;;!domain:} meta comment, {@code null} when absent. */
  public String getDomainName() { return domainName; }

  public List<PlanStep> getSteps() { return steps; }

  public void setSteps(List<PlanStep> steps) { this.steps = List.copyOf(steps); }

  public OptionalDouble getMetric() {
    return metric == null ? OptionalDouble.empty() : OptionalDouble.of(metric);
  }

  public void setMetric(Double metric) { this.metric = metric; }

  /** Latest end time of all steps, 0 for an empty plan. */
  public double getMakespan() {
    return steps.stream().mapToDouble(PlanStep::getEndTime).max().orElse(0);
  }
}
