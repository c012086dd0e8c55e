package se.alipsa.pddlls.plan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.pddlls.core.ParseRequest;
import se.alipsa.pddlls.core.model.ParsingProblem;
import se.alipsa.pddlls.core.model.PlanInfo;
import se.alipsa.pddlls.core.model.PlanStep;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads planner output:
 * <pre>
 * ;;!domain: logistics
 * ;;!problem: p01
 * 0.000: (drive truck1 depot market) [5.000]
 * (load truck1 crate1)
 * ; cost = 12.0 (general cost)
 * </pre>
 * A step without a time follows the previous step by the plan epsilon.
 */
public final class PlanParser {
  private static final Logger logger = LoggerFactory.getLogger(PlanParser.class);

  static final String NUMBER = "[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?";

  private static final Pattern STEP = Pattern.compile(
      "^\\s*(?:(" + NUMBER + ")\\s*:)?\\s*\\(\\s*([^\\s()]+)((?:\\s+[^\\s()]+)*)\\s*\\)"
          + "\\s*(?:\\[\\s*(" + NUMBER + ")\\s*\\])?\\s*(?:;.*)?$");
  private static final Pattern COST = Pattern.compile(
      "^\\s*;+\\s*(?:cost|metric)\\s*=\\s*(" + NUMBER + ")", Pattern.CASE_INSENSITIVE);

  private final double epsilon;

  public PlanParser(double epsilon) {
    this.epsilon = epsilon;
  }

  public PlanInfo parse(ParseRequest request) {
    MetaComments meta = new MetaComments();
    List<PlanStep> steps = new ArrayList<>();
    List<ParsingProblem> problems = new ArrayList<>();
    Double metric = null;

    String[] lines = MetaComments.lines(request.getText());
    for (int i = 0; i < lines.length; i++) {
      String line = lines[i];
      if (meta.accept(line)) continue;
      Matcher cost = COST.matcher(line);
      if (cost.find()) {
        metric = Double.valueOf(cost.group(1));
        continue;
      }
      if (MetaComments.isBlankOrComment(line)) continue;

      Matcher m = STEP.matcher(line);
      if (!m.matches()) {
        problems.add(new ParsingProblem("Unexpected plan line: " + line.trim(), i, firstNonBlank(line)));
        continue;
      }
      boolean timed = m.group(1) != null;
      double time = timed ? Double.parseDouble(m.group(1)) : nextUntimedStart(steps);
      Double duration = m.group(4) == null ? null : Double.valueOf(m.group(4));
      if (duration != null && duration < 0) {
        problems.add(new ParsingProblem("Negative duration " + duration, i, firstNonBlank(line),
            ParsingProblem.Severity.WARNING));
      }
      steps.add(new PlanStep(time, timed, m.group(2), objects(m.group(3)), duration, i));
    }

    PlanInfo plan = new PlanInfo(request.getFileUri(), request.getVersion(), meta.getProblemName(),
        meta.getDomainName(), request.getText(), request.getSyntaxTree(), request.getPositionResolver());
    plan.setSteps(steps);
    plan.setMetric(metric);
    plan.addProblems(problems);
    logger.debug("Plan {} has {} steps and {} problems", request.getFileUri(), steps.size(), problems.size());
    return plan;
  }

  private double nextUntimedStart(List<PlanStep> steps) {
    if (steps.isEmpty()) return 0;
    return steps.get(steps.size() - 1).getEndTime() + epsilon;
  }

  static List<String> objects(String group) {
    String trimmed = group == null ? "" : group.trim();
    return trimmed.isEmpty() ? List.of() : Arrays.asList(trimmed.split("\\s+"));
  }

  static int firstNonBlank(String line) {
    for (int i = 0; i < line.length(); i++) {
      if (!Character.isWhitespace(line.charAt(i))) return i;
    }
    return 0;
  }
}
