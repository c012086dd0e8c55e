package se.alipsa.pddlls.pddl.preprocess;

/** A pre-processing failure, positioned at the line of the directive (or of the offending input). */
public class PreProcessingException extends Exception {
  private final int line;
  private final int column;

  public PreProcessingException(String message, int line, int column) {
    this(message, line, column, null);
  }

  public PreProcessingException(String message, int line, int column, Throwable cause) {
    super(message, cause);
    this.line = line;
    this.column = column;
  }

  /** Zero-based. */
  public int getLine() { return line; }

  /** Zero-based. */
  public int getColumn() { return column; }
}
