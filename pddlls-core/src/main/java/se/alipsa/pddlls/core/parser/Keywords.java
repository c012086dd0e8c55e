package se.alipsa.pddlls.core.parser;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * The closed set of keywords that turn an open bracket into an operator bracket.
 * Keeping them in one table makes the recognized vocabulary auditable.
 */
public final class Keywords {
  private Keywords() {}

  public static final String DEFINE = "define";
  public static final String DOMAIN = "domain";
  public static final String PROBLEM = "problem";

  public static final String REQUIREMENTS = ":requirements";
  public static final String TYPES = ":types";
  public static final String CONSTANTS = ":constants";
  public static final String PREDICATES = ":predicates";
  public static final String FUNCTIONS = ":functions";
  public static final String CONSTRAINTS = ":constraints";
  public static final String ACTION = ":action";
  public static final String DURATIVE_ACTION = ":durative-action";
  public static final String DERIVED = ":derived";
  public static final String PROCESS = ":process";
  public static final String EVENT = ":event";
  public static final String DOMAIN_REF = ":domain";
  public static final String OBJECTS = ":objects";
  public static final String INIT = ":init";
  public static final String GOAL = ":goal";
  public static final String METRIC = ":metric";

  /** Non-bracketed keywords inside action-like constructs. */
  public static final String PARAMETERS = ":parameters";
  public static final String PRECONDITION = ":precondition";
  public static final String EFFECT = ":effect";
  public static final String CONDITION = ":condition";
  public static final String DURATION = ":duration";

  public static final Set<String> SECTIONS = Set.of(
      DOMAIN_REF, REQUIREMENTS, TYPES, CONSTANTS, PREDICATES, FUNCTIONS, CONSTRAINTS,
      ACTION, DURATIVE_ACTION, DERIVED, PROCESS, EVENT, OBJECTS, INIT, GOAL, METRIC);

  public static final Set<String> OPERATORS = Set.of(
      DEFINE, DOMAIN, PROBLEM,
      "and", "or", "not", "imply", "exists", "forall", "when", "either",
      "at", "at start", "at end", "over all",
      "=", "<", "<=", ">", ">=", "+", "-", "*", "/",
      "assign", "increase", "decrease", "scale-up", "scale-down",
      "minimize", "maximize", "total-time", "is-violated",
      "always", "sometime", "within", "at-most-once", "sometime-after", "sometime-before",
      "always-within", "hold-during", "hold-after", "preference", "name", "after",
      "supply-demand");

  /** Quantifiers: their first bracket declares the parameters. */
  public static final Set<String> FORALL_LIKE = Set.of("forall", "exists");

  /** Scopes that declare {@code ?parameters} visible to their nested expressions. */
  public static final Set<String> PARAMETRISABLE_SCOPES = Set.of(
      ACTION, DURATIVE_ACTION, DERIVED, PROCESS, EVENT, "forall", "exists");

  private static final Set<String> ALL = union(SECTIONS, OPERATORS);

  /** An open bracket, optional whitespace and a keyword that ends on a token boundary. */
  static final Pattern OPERATOR_BRACKET = Pattern.compile(
      "\\(\\s*(?:" + alternation(ALL) + ")(?=[\\s();]|$)",
      Pattern.CASE_INSENSITIVE);

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  public static boolean isKeyword(String keyword) {
    return keyword != null && ALL.contains(keyword.toLowerCase(Locale.ROOT));
  }

  public static boolean isParametrisableScope(String keyword) {
    return keyword != null && PARAMETRISABLE_SCOPES.contains(keyword);
  }

  /** {@code "( At\tstart"} -> {@code "at start"}. */
  public static String normalize(String operatorBracketText) {
    String s = operatorBracketText.startsWith("(") ? operatorBracketText.substring(1) : operatorBracketText;
    return WHITESPACE.matcher(s.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
  }

  private static Set<String> union(Set<String> a, Set<String> b) {
    Set<String> out = new LinkedHashSet<>(a);
    out.addAll(b);
    return Set.copyOf(out);
  }

  // longest first, so that "at start" and "at-most-once" win over "at"
  private static String alternation(Set<String> keywords) {
    List<String> sorted = new ArrayList<>(keywords);
    sorted.sort(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()));
    return sorted.stream()
        .map(k -> List.of(k.split(" ")).stream().map(Pattern::quote).collect(Collectors.joining("\\s+")))
        .collect(Collectors.joining("|"));
  }
}
