package se.alipsa.pddlls.core.model;

import se.alipsa.pddlls.core.parser.SyntaxNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A named, parametrised construct of a domain: an action, durative action, derived predicate,
 * process or event. Parts are the bracket nodes following {@code :precondition}, {@code :effect},
 * {@code :condition} and {@code :duration}.
 */
public abstract class DomainConstruct {

  private final String name;
  private final List<Parameter> parameters;
  private final Range location;
  private final List<String> documentation;
  private final SyntaxNode node;
  private final Map<String, SyntaxNode> parts;

  protected DomainConstruct(String name, List<Parameter> parameters, Range location,
                            List<String> documentation, SyntaxNode node, Map<String, SyntaxNode> parts) {
    this.name = name;
    this.parameters = List.copyOf(parameters);
    this.location = location;
    this.documentation = List.copyOf(documentation);
    this.node = Objects.requireNonNull(node, "node");
    this.parts = Collections.unmodifiableMap(new LinkedHashMap<>(parts));
  }

  public abstract ConstructKind getKind();

  /** Construct name, or {@code null} when the declaration is incomplete. */
  public String getName() { return name; }

  public List<Parameter> getParameters() { return parameters; }

  public Range getLocation() { return location; }

  public List<String> getDocumentation() { return documentation; }

  /** The construct's own bracket, e.g. {@code (:action ...)}. */
  public SyntaxNode getNode() { return node; }

  /** Part nodes keyed by their keyword, e.g. {@code :effect}. */
  public Map<String, SyntaxNode> getParts() { return parts; }

  public Optional<SyntaxNode> getPart(String keyword) {
    return Optional.ofNullable(parts.get(keyword));
  }

  @Override
  public String toString() {
    return getKind().getKeyword() + " " + name;
  }
}
