package se.alipsa.pddlls.core.model;

import se.alipsa.pddlls.core.model.constraints.Constraint;
import se.alipsa.pddlls.core.parser.SyntaxNode;
import se.alipsa.pddlls.core.parser.SyntaxTree;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** Semantic model of a problem file. */
public final class ProblemInfo extends FileInfo {

  private final String name;
  private final String domainName;
  private Set<String> requirements = Set.of();
  private TypeObjectMap objects = new TypeObjectMap();
  private List<TimedVariableValue> inits = List.of();
  private List<SupplyDemand> supplyDemands = List.of();
  private List<Constraint> constraints = List.of();
  private SyntaxNode goal;
  private SyntaxNode metric;
  private String preProcessor;

  public ProblemInfo(String fileUri, int version, String name, String domainName, String text,
                     SyntaxTree syntaxTree, PositionResolver positionResolver) {
    super(fileUri, version, PddlLanguage.PDDL, text, syntaxTree, positionResolver);
    this.name = name;
    this.domainName = domainName;
  }

  @Override
  public FileKind getKind() { return FileKind.PROBLEM; }

  public String getName() { return name; }

  public String getDomainName() { return domainName; }

  public Set<String> getRequirements() { return requirements; }

  public void setRequirements(Set<String> requirements) {
    this.requirements = Collections.unmodifiableSet(new LinkedHashSet<>(requirements));
  }

  public TypeObjectMap getObjects() { return objects; }

  public void setObjects(TypeObjectMap objects) { this.objects = objects; }

  public List<TimedVariableValue> getInits() { return inits; }

  public void setInits(List<TimedVariableValue> inits) { this.inits = List.copyOf(inits); }

  public List<SupplyDemand> getSupplyDemands() { return supplyDemands; }

  public void setSupplyDemands(List<SupplyDemand> supplyDemands) { this.supplyDemands = List.copyOf(supplyDemands); }

  public List<Constraint> getConstraints() { return constraints; }

  public void setConstraints(List<Constraint> constraints) { this.constraints = List.copyOf(constraints); }

  public Optional<SyntaxNode> getGoal() { return Optional.ofNullable(goal); }

  public void setGoal(SyntaxNode goal) { this.goal = goal; }

  public Optional<SyntaxNode> getMetric() { return Optional.ofNullable(metric); }

  public void setMetric(SyntaxNode metric) { this.metric = metric; }

  /** Label of the pre-processor that produced the parsed text, if any. */
  public Optional<String> getPreProcessor() { return Optional.ofNullable(preProcessor); }

  public void setPreProcessor(String preProcessor) { this.preProcessor = preProcessor; }
}
