package se.alipsa.pddlls.core.model;

import se.alipsa.pddlls.core.model.constraints.Constraint;
import se.alipsa.pddlls.core.parser.SyntaxTree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** Semantic model of a domain file. Sections that failed to parse stay empty. */
public final class DomainInfo extends FileInfo {

  private final String name;
  private Set<String> requirements = Set.of();
  private TypeHierarchy types = new TypeHierarchy();
  private TypeObjectMap constants = new TypeObjectMap();
  private List<Variable> predicates = List.of();
  private List<Variable> functions = List.of();
  private List<DomainConstruct> constructs = List.of();
  private List<Constraint> constraints = List.of();

  public DomainInfo(String fileUri, int version, String name, String text,
                    SyntaxTree syntaxTree, PositionResolver positionResolver) {
    super(fileUri, version, PddlLanguage.PDDL, text, syntaxTree, positionResolver);
    this.name = name;
  }

  @Override
  public FileKind getKind() { return FileKind.DOMAIN; }

  public String getName() { return name; }

  public Set<String> getRequirements() { return requirements; }

  public void setRequirements(Set<String> requirements) {
    this.requirements = Collections.unmodifiableSet(new LinkedHashSet<>(requirements));
  }

  public TypeHierarchy getTypes() { return types; }

  public void setTypes(TypeHierarchy types) { this.types = types; }

  /** Every declared type that inherits from {@code type}, directly or transitively. */
  public Set<String> getTypesInheritingFrom(String type) {
    return types.getDescendants(type);
  }

  public TypeObjectMap getConstants() { return constants; }

  public void setConstants(TypeObjectMap constants) { this.constants = constants; }

  public List<Variable> getPredicates() { return predicates; }

  public void setPredicates(List<Variable> predicates) { this.predicates = List.copyOf(predicates); }

  public List<Variable> getFunctions() { return functions; }

  public void setFunctions(List<Variable> functions) { this.functions = List.copyOf(functions); }

  public List<DomainConstruct> getConstructs() { return constructs; }

  public void setConstructs(List<DomainConstruct> constructs) { this.constructs = List.copyOf(constructs); }

  public List<DomainConstruct> getConstructs(ConstructKind kind) {
    List<DomainConstruct> out = new ArrayList<>();
    for (DomainConstruct c : constructs) {
      if (c.getKind() == kind) out.add(c);
    }
    return out;
  }

  public List<DerivedPredicate> getDerived() {
    List<DerivedPredicate> out = new ArrayList<>();
    for (DomainConstruct c : constructs) {
      if (c instanceof DerivedPredicate d) out.add(d);
    }
    return out;
  }

  /** First construct with the given name, compared case-insensitively. */
  public Optional<DomainConstruct> getConstruct(String constructName) {
    return constructs.stream()
        .filter(c -> c.getName() != null && c.getName().equalsIgnoreCase(constructName))
        .findFirst();
  }

  public List<Constraint> getConstraints() { return constraints; }

  public void setConstraints(List<Constraint> constraints) { this.constraints = List.copyOf(constraints); }
}
