package se.alipsa.pddlls.core;

import se.alipsa.pddlls.core.model.FileInfo;
import se.alipsa.pddlls.core.model.PddlLanguage;

import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Turns the text of one file into a semantic model. Implementations are discovered through
 * {@link java.util.ServiceLoader}; the workspace tries them in descending order of their claim.
 */
public interface PddlFilePlugin {

  /** Unique, stable identifier, e.g. "pddl-domain". */
  String id();

  /** Human-friendly name. */
  default String displayName() { return id(); }

  /** Language tags this plugin can read. */
  Set<PddlLanguage> languages();

  /**
   * How confident the plugin is that it handles this file. 0.0 means not mine; the workspace never
   * asks a plugin that claims 0.0 to parse.
   */
  default double claim(String fileUri, PddlLanguage language, Supplier<CharSequence> contentPreview) {
    return languages().contains(language) ? 0.5 : 0.0;
  }

  /** Called once after registration. */
  default void configure(PluginEnvironment env) {}

  /**
   * Builds the model, or returns empty when the content is not the kind of file this plugin reads
   * (so that the next candidate gets a chance). Malformed sections are reported as problems on the
   * returned model rather than thrown.
   */
  Optional<FileInfo> parse(ParseRequest request);
}
