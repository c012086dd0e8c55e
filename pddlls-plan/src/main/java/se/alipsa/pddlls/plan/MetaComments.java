package se.alipsa.pddlls.plan;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** The {@code ;;!domain: NAME} and {@code ;;!problem: NAME} comments at the top of plans and traces. */
final class MetaComments {
  private static final Pattern META = Pattern.compile("^\\s*;;\\s*!(domain|problem)\\s*:\\s*(\\S+)\\s*$",
      Pattern.CASE_INSENSITIVE);

  private String domainName;
  private String problemName;

  /** @return {@code true} if the line was a meta comment */
  boolean accept(String line) {
    Matcher m = META.matcher(line);
    if (!m.matches()) return false;
    if ("domain".equals(m.group(1).toLowerCase(Locale.ROOT))) {
      domainName = m.group(2);
    } else {
      problemName = m.group(2);
    }
    return true;
  }

  String getDomainName() { return domainName; }

  String getProblemName() { return problemName; }

  static boolean isBlankOrComment(String line) {
    String trimmed = line.trim();
    return trimmed.isEmpty() || trimmed.startsWith(";");
  }

  static String[] lines(String text) {
    return text.split("\\r?\\n|\\r", -1);
  }
}
