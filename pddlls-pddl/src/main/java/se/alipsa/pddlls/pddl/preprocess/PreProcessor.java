package se.alipsa.pddlls.pddl.preprocess;

import java.nio.file.Path;
import java.time.Duration;

/** Transforms problem text before it is parsed, e.g. by expanding a template with an external tool. */
public interface PreProcessor {

  /** Short description shown to the user, e.g. {@code python generate.py data.json}. */
  String getLabel();

  /** Zero-based line of the directive that configured this pre-processor. */
  int getMetaDataLine();

  /**
   * @param workingDirectory directory to resolve relative paths against, or {@code null} for the
   *     current directory
   */
  String transform(String input, Path workingDirectory, Duration timeout) throws PreProcessingException;
}
