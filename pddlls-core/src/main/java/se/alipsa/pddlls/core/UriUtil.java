package se.alipsa.pddlls.core;

import java.util.Locale;

/** String-level helpers for document URIs such as {@code file:///work/blocks/domain.pddl}. */
public final class UriUtil {
  private UriUtil() {}

  /** Everything before the last {@code /}; an empty string when there is none. */
  public static String folderOf(String uri) {
    int slash = uri.lastIndexOf('/');
    return slash < 0 ? "" : uri.substring(0, slash);
  }

  public static String fileName(String uri) {
    return uri.substring(uri.lastIndexOf('/') + 1);
  }

  /** Lower-cased scheme, or an empty string for scheme-less paths (including Windows drive letters). */
  public static String scheme(String uri) {
    int colon = uri.indexOf(':');
    if (colon < 2) return "";
    for (int i = 0; i < colon; i++) {
      char c = uri.charAt(i);
      if (!(Character.isLetterOrDigit(c) || c == '+' || c == '-' || c == '.')) return "";
    }
    return uri.substring(0, colon).toLowerCase(Locale.ROOT);
  }
}
