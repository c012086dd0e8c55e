package se.alipsa.pddlls.core;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Explicit associations that override name matching: problem URI to domain URI, and plan (or
 * happenings) URI to problem URI.
 */
public final class AssociationGraph {

  private final Map<String, String> problemToDomain = new ConcurrentHashMap<>();
  private final Map<String, String> planToProblem = new ConcurrentHashMap<>();

  public void associateProblemToDomain(String problemUri, String domainUri) {
    problemToDomain.put(problemUri, domainUri);
  }

  public void associatePlanToProblem(String planUri, String problemUri) {
    planToProblem.put(planUri, problemUri);
  }

  public Optional<String> domainOf(String problemUri) {
    return Optional.ofNullable(problemToDomain.get(problemUri));
  }

  public Optional<String> problemOf(String planUri) {
    return Optional.ofNullable(planToProblem.get(planUri));
  }

  /** {@code true} if the URI appears on either side of any association. */
  public boolean hasExplicitAssociations(String uri) {
    return problemToDomain.containsKey(uri) || problemToDomain.containsValue(uri)
        || planToProblem.containsKey(uri) || planToProblem.containsValue(uri);
  }

  /** Drops every association the URI takes part in. */
  public void removeFile(String uri) {
    problemToDomain.remove(uri);
    problemToDomain.values().removeIf(uri::equals);
    planToProblem.remove(uri);
    planToProblem.values().removeIf(uri::equals);
  }

  public void clear() {
    problemToDomain.clear();
    planToProblem.clear();
  }
}
