package se.alipsa.pddlls.pddl.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.pddlls.core.ParseRequest;
import se.alipsa.pddlls.core.TextUtil;
import se.alipsa.pddlls.core.model.ConstructKind;
import se.alipsa.pddlls.core.model.DomainConstruct;
import se.alipsa.pddlls.core.model.DomainInfo;
import se.alipsa.pddlls.core.model.ParsingProblem;
import se.alipsa.pddlls.core.model.Position;
import se.alipsa.pddlls.core.model.PositionResolver;
import se.alipsa.pddlls.core.parser.Keywords;
import se.alipsa.pddlls.core.parser.SyntaxNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a {@link DomainInfo} from a file whose comment-stripped text starts with
 * {@code (define (domain NAME)}. Sections are dispatched through a keyword table; a section that
 * fails to parse is reported and left empty while the others are still read.
 */
public final class DomainParser {
  private static final Logger logger = LoggerFactory.getLogger(DomainParser.class);

  static final Pattern DOMAIN_PATTERN =
      Pattern.compile("^\\s*\\(define\\s*\\(domain\\s+(\\S+)\\s*\\)", Pattern.CASE_INSENSITIVE);

  @FunctionalInterface
  interface SectionHandler {
    void parse(Extraction extraction, SyntaxNode section);
  }

  private static final Map<String, SectionHandler> SECTIONS = new LinkedHashMap<>();

  static {
    SECTIONS.put(Keywords.REQUIREMENTS, (x, n) -> x.domain.setRequirements(RequirementsParser.parse(n)));
    SECTIONS.put(Keywords.TYPES, (x, n) ->
        x.domain.setTypes(InheritanceParser.parseInheritance(n.getNestedNonCommentText())));
    SECTIONS.put(Keywords.CONSTANTS, (x, n) -> x.domain.setConstants(
        InheritanceParser.toTypeObjects(InheritanceParser.parseInheritance(n.getNestedNonCommentText()))));
    SECTIONS.put(Keywords.PREDICATES, (x, n) -> x.domain.setPredicates(VariablesParser.parseVariables(n, x.resolver)));
    SECTIONS.put(Keywords.FUNCTIONS, (x, n) -> x.domain.setFunctions(VariablesParser.parseVariables(n, x.resolver)));
    SECTIONS.put(Keywords.CONSTRAINTS, (x, n) -> {
      ConstraintsParser constraints = new ConstraintsParser(x.resolver);
      x.domain.setConstraints(constraints.parseConstraints(n));
      x.domain.addProblems(constraints.getProblems());
    });
    for (ConstructKind kind : ConstructKind.values()) {
      SECTIONS.put(kind.getKeyword(), (x, n) -> x.constructs.add(ConstructParser.parse(kind, n, x.resolver)));
    }
  }

  /** Section keywords this parser understands, in dispatch order. */
  public static Set<String> sectionKeywords() {
    return SECTIONS.keySet();
  }

  /** Empty when the text is not a domain. */
  public Optional<DomainInfo> parse(ParseRequest request) {
    Matcher m = DOMAIN_PATTERN.matcher(TextUtil.stripComments(request.getText()));
    if (!m.find()) return Optional.empty();

    DomainInfo domain = new DomainInfo(request.getFileUri(), request.getVersion(), m.group(1),
        request.getText(), request.getSyntaxTree(), request.getPositionResolver());
    Extraction x = new Extraction(domain, request.getPositionResolver());

    Optional<SyntaxNode> define = request.getSyntaxTree().getDefineNode();
    if (define.isEmpty()) {
      domain.addProblem(new ParsingProblem("Missing (define ...) structure", 0, 0));
      return Optional.of(domain);
    }

    Set<String> seen = new HashSet<>();
    for (SyntaxNode section : define.get().getNonWhitespaceNonCommentChildren()) {
      String keyword = section.getKeyword();
      SectionHandler handler = keyword == null ? null : SECTIONS.get(keyword);
      if (handler == null) continue;
      if (!isConstruct(keyword) && !seen.add(keyword)) {
        x.problem(section, "Duplicate " + keyword + " section is ignored", ParsingProblem.Severity.WARNING);
        continue;
      }
      try {
        handler.parse(x, section);
      } catch (RuntimeException e) {
        logger.debug("Failed to parse {} in {}", keyword, request.getFileUri(), e);
        x.problem(section, "Cannot parse " + keyword + ": " + e.getMessage(), ParsingProblem.Severity.ERROR);
      }
    }
    domain.setConstructs(x.constructs);
    return Optional.of(domain);
  }

  private static boolean isConstruct(String keyword) {
    for (ConstructKind kind : ConstructKind.values()) {
      if (kind.getKeyword().equals(keyword)) return true;
    }
    return false;
  }

  static final class Extraction {
    final DomainInfo domain;
    final PositionResolver resolver;
    final List<DomainConstruct> constructs = new ArrayList<>();

    Extraction(DomainInfo domain, PositionResolver resolver) {
      this.domain = domain;
      this.resolver = resolver;
    }

    void problem(SyntaxNode at, String message, ParsingProblem.Severity severity) {
      Position p = resolver.resolveToPosition(at.getStart());
      domain.addProblem(new ParsingProblem(message, p.line, p.column, severity));
    }
  }
}
