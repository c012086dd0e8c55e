package se.alipsa.pddlls.core;

import java.util.Locale;
import java.util.regex.Pattern;

/** Small text helpers shared by the parsers that do not need a token stream. */
public final class TextUtil {
  private TextUtil() {}

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  public static int positionToOffset(String text, int line, int column) {
    int curLine = 0, idx = 0, n = text.length();
    while (curLine < line && idx < n) {
      int nl = text.indexOf('\n', idx);
      if (nl < 0) return n;
      idx = nl + 1;
      curLine++;
    }
    return Math.min(idx + column, n);
  }

  /** First 1 KiB of the text, enough for a plugin to recognise a header. */
  public static CharSequence preview(String text) {
    int n = Math.min(text == null ? 0 : text.length(), 1024);
    return text == null ? "" : text.subSequence(0, n);
  }

  /** Removes {@code ;} comments up to the end of each line. Line breaks stay, so line numbers do not move. */
  public static String stripComments(String text) {
    StringBuilder sb = new StringBuilder(text.length());
    boolean inComment = false;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '\n' || c == '\r') {
        inComment = false;
        sb.append(c);
      } else if (c == ';') {
        inComment = true;
      } else if (!inComment) {
        sb.append(c);
      }
    }
    return sb.toString();
  }

  /** Collapses whitespace runs to one space and trims. */
  public static String normalizeWhitespace(String text) {
    return WHITESPACE.matcher(text).replaceAll(" ").trim();
  }

  /** Case-insensitive equality where two {@code null}s are equal. */
  public static boolean lowerCaseEquals(String first, String second) {
    if (first == null) return second == null;
    if (second == null) return false;
    return first.toLowerCase(Locale.ROOT).equals(second.toLowerCase(Locale.ROOT));
  }
}
