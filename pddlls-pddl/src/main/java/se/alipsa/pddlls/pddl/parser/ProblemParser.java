package se.alipsa.pddlls.pddl.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.pddlls.core.TextUtil;
import se.alipsa.pddlls.core.model.ParsingProblem;
import se.alipsa.pddlls.core.model.Position;
import se.alipsa.pddlls.core.model.PositionResolver;
import se.alipsa.pddlls.core.model.ProblemInfo;
import se.alipsa.pddlls.core.parser.Keywords;
import se.alipsa.pddlls.core.parser.SyntaxNode;
import se.alipsa.pddlls.core.parser.SyntaxTree;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a {@link ProblemInfo} from a file whose comment-stripped text starts with
 * {@code (define (problem NAME) (:domain DOMAIN)}. Both names are required.
 */
public final class ProblemParser {
  private static final Logger logger = LoggerFactory.getLogger(ProblemParser.class);

  static final Pattern PROBLEM_PATTERN = Pattern.compile(
      "^\\s*\\(define\\s*\\(problem\\s+(\\S+)\\s*\\)\\s*\\(:domain\\s+(\\S+)\\s*\\)", Pattern.CASE_INSENSITIVE);

  private static final Map<String, BiConsumer<ProblemInfo, SyntaxNode>> SECTIONS = new LinkedHashMap<>();

  static {
    SECTIONS.put(Keywords.REQUIREMENTS, (p, n) -> p.setRequirements(RequirementsParser.parse(n)));
    SECTIONS.put(Keywords.OBJECTS, (p, n) -> p.setObjects(
        InheritanceParser.toTypeObjects(InheritanceParser.parseInheritance(n.getNestedNonCommentText()))));
    SECTIONS.put(Keywords.INIT, (p, n) -> {
      InitSectionParser init = InitSectionParser.parse(n);
      p.setInits(init.getValues());
      p.setSupplyDemands(init.getSupplyDemands());
    });
    SECTIONS.put(Keywords.CONSTRAINTS, (p, n) -> {
      ConstraintsParser constraints = new ConstraintsParser(p.getPositionResolver());
      p.setConstraints(constraints.parseConstraints(n));
      p.addProblems(constraints.getProblems());
    });
    SECTIONS.put(Keywords.GOAL, ProblemInfo::setGoal);
    SECTIONS.put(Keywords.METRIC, ProblemInfo::setMetric);
  }

  /**
   * @param text the text to read; the pre-processed text when a pre-processor ran
   * @param tree syntax tree of {@code text}
   * @param sourceText the text as the user wrote it, stored on the model
   * @return empty when the text is not a problem
   */
  public Optional<ProblemInfo> parse(String fileUri, int version, String text, SyntaxTree tree,
                                     String sourceText, PositionResolver resolver) {
    Matcher m = PROBLEM_PATTERN.matcher(TextUtil.stripComments(text));
    if (!m.find()) return Optional.empty();

    ProblemInfo problem = new ProblemInfo(fileUri, version, m.group(1), m.group(2), sourceText, tree, resolver);
    Optional<SyntaxNode> define = tree.getDefineNode();
    if (define.isEmpty()) {
      problem.addProblem(new ParsingProblem("Missing (define ...) structure", 0, 0));
      return Optional.of(problem);
    }

    Set<String> seen = new HashSet<>();
    for (SyntaxNode section : define.get().getNonWhitespaceNonCommentChildren()) {
      String keyword = section.getKeyword();
      BiConsumer<ProblemInfo, SyntaxNode> handler = keyword == null ? null : SECTIONS.get(keyword);
      if (handler == null) continue;
      if (!seen.add(keyword)) {
        problem(problem, section, "Duplicate " + keyword + " section is ignored", ParsingProblem.Severity.WARNING);
        continue;
      }
      try {
        handler.accept(problem, section);
      } catch (RuntimeException e) {
        logger.debug("Failed to parse {} in {}", keyword, fileUri, e);
        problem(problem, section, "Cannot parse " + keyword + ": " + e.getMessage(), ParsingProblem.Severity.ERROR);
      }
    }
    return Optional.of(problem);
  }

  private static void problem(ProblemInfo problem, SyntaxNode at, String message, ParsingProblem.Severity severity) {
    Position p = problem.getPositionResolver().resolveToPosition(at.getStart());
    problem.addProblem(new ParsingProblem(message, p.line, p.column, severity));
  }
}
