package se.alipsa.pddlls.plan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.pddlls.core.ParseRequest;
import se.alipsa.pddlls.core.model.Happening;
import se.alipsa.pddlls.core.model.HappeningType;
import se.alipsa.pddlls.core.model.HappeningsInfo;
import se.alipsa.pddlls.core.model.ParsingProblem;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads plan execution traces:
 * <pre>
 * ;;!domain: logistics
 * ;;!problem: p01
 * 0.001: start (drive truck1 depot market) #1
 * 5.001: end (drive truck1 depot market) #1
 * 5.002: (load truck1 crate1)
 * </pre>
 * The optional {@code #counter} tells apart overlapping executions of the same grounded action.
 */
public final class HappeningsParser {
  private static final Logger logger = LoggerFactory.getLogger(HappeningsParser.class);

  private static final Pattern HAPPENING = Pattern.compile(
      "^\\s*(?:(" + PlanParser.NUMBER + ")\\s*:)?\\s*(?:(start|end)\\s+)?\\(\\s*([^\\s()]+)((?:\\s+[^\\s()]+)*)\\s*\\)"
          + "\\s*(?:#\\s*(\\d+))?\\s*(?:;.*)?$", Pattern.CASE_INSENSITIVE);

  public HappeningsInfo parse(ParseRequest request) {
    MetaComments meta = new MetaComments();
    List<Happening> happenings = new ArrayList<>();
    List<ParsingProblem> problems = new ArrayList<>();
    Map<String, Happening> openStarts = new LinkedHashMap<>();
    double previousTime = 0;

    String[] lines = MetaComments.lines(request.getText());
    for (int i = 0; i < lines.length; i++) {
      String line = lines[i];
      if (meta.accept(line) || MetaComments.isBlankOrComment(line)) continue;

      Matcher m = HAPPENING.matcher(line);
      int column = PlanParser.firstNonBlank(line);
      if (!m.matches()) {
        problems.add(new ParsingProblem("Unexpected happening line: " + line.trim(), i, column));
        continue;
      }
      double time = m.group(1) == null ? previousTime : Double.parseDouble(m.group(1));
      if (time < previousTime) {
        problems.add(new ParsingProblem("Time " + time + " is before the previous happening at " + previousTime,
            i, column));
      }
      previousTime = Math.max(previousTime, time);

      HappeningType type = typeOf(m.group(2));
      int counter = 0;
      if (m.group(5) != null) {
        try {
          counter = Integer.parseInt(m.group(5));
        } catch (NumberFormatException e) {
          problems.add(new ParsingProblem("Happening counter #" + m.group(5) + " is out of range", i, column));
          continue;
        }
      }
      Happening happening = new Happening(time, type, m.group(3), PlanParser.objects(m.group(4)), counter, i);
      happenings.add(happening);

      if (type == HappeningType.START) {
        if (openStarts.put(happening.getMatchKey(), happening) != null) {
          problems.add(new ParsingProblem("(" + happening.getFullActionName() + ") #" + counter
              + " started again before it ended", i, column, ParsingProblem.Severity.WARNING));
        }
      } else if (type == HappeningType.END && openStarts.remove(happening.getMatchKey()) == null) {
        problems.add(new ParsingProblem("No matching start for (" + happening.getFullActionName() + ") #"
            + counter, i, column));
      }
    }

    for (Happening start : openStarts.values()) {
      problems.add(new ParsingProblem("(" + start.getFullActionName() + ") #" + start.getCounter()
          + " started but never ended", start.getLine(), 0, ParsingProblem.Severity.WARNING));
    }

    HappeningsInfo info = new HappeningsInfo(request.getFileUri(), request.getVersion(), meta.getProblemName(),
        meta.getDomainName(), request.getText(), request.getSyntaxTree(), request.getPositionResolver());
    info.setHappenings(happenings);
    info.addProblems(problems);
    logger.debug("Happenings {}: {} entries, {} problems", request.getFileUri(), happenings.size(), problems.size());
    return info;
  }

  private static HappeningType typeOf(String keyword) {
    if (keyword == null) return HappeningType.INSTANTANEOUS;
    return "start".equals(keyword.toLowerCase(Locale.ROOT)) ? HappeningType.START : HappeningType.END;
  }
}
