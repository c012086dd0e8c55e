package se.alipsa.pddlls.core.model;

import java.util.Objects;

/** A problem found while parsing a file, positioned for diagnostics rendering. */
public class ParsingProblem {
  public enum Severity {
    ERROR,
    WARNING,
    INFORMATION,
    HINT
  }

  private final String message;
  private final int line;    // zero-based
  private final int column;  // zero-based
  private final Severity severity;

  public ParsingProblem(String message, int line, int column) {
    this(message, line, column, Severity.ERROR);
  }

  public ParsingProblem(String message, int line, int column, Severity severity) {
    this.message = Objects.requireNonNull(message, "message cannot be null");
    this.line = line;
    this.column = column;
    this.severity = severity != null ? severity : Severity.ERROR;
  }

  public static ParsingProblem at(String message, Position position, Severity severity) {
    return new ParsingProblem(message, position.line, position.column, severity);
  }

  public String getMessage() {
    return message;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  public Severity getSeverity() {
    return severity;
  }

  public Position getPosition() {
    return new Position(line, column);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ParsingProblem that)) return false;
    return line == that.line && column == that.column && message.equals(that.message) && severity == that.severity;
  }

  @Override
  public int hashCode() {
    return Objects.hash(message, line, column, severity);
  }

  @Override
  public String toString() {
    return "ParsingProblem{" +
        "message='" + message + '\'' +
        ", line=" + line +
        ", column=" + column +
        ", severity=" + severity +
        '}';
  }
}
