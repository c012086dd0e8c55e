package se.alipsa.pddlls.core.model;

import se.alipsa.pddlls.core.parser.SyntaxTree;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Semantic unit for one file of the workspace. Identity is the file URI.
 * <p>
 * The kind (domain, problem, plan, happenings or unknown) is decided once per parse; a re-parse
 * produces a new instance rather than changing the kind of this one. Between parses only the text,
 * version, position resolver and status change, through
 * {@link #update(int, String, PositionResolver, boolean)}.
 */
public abstract sealed class FileInfo
    permits DomainInfo, ProblemInfo, PlanInfo, HappeningsInfo, UnknownFileInfo {

  private final String fileUri;
  private final PddlLanguage language;
  private final SyntaxTree syntaxTree;
  private PositionResolver positionResolver;
  private final List<ParsingProblem> problems = new ArrayList<>();
  private int version;
  private String text;
  private FileStatus status = FileStatus.PARSED;

  protected FileInfo(String fileUri, int version, PddlLanguage language, String text,
                     SyntaxTree syntaxTree, PositionResolver positionResolver) {
    this.fileUri = Objects.requireNonNull(fileUri, "fileUri");
    this.version = version;
    this.language = Objects.requireNonNull(language, "language");
    this.text = Objects.requireNonNull(text, "text");
    this.syntaxTree = Objects.requireNonNull(syntaxTree, "syntaxTree");
    this.positionResolver = Objects.requireNonNull(positionResolver, "positionResolver");
  }

  public abstract FileKind getKind();

  public String getFileUri() { return fileUri; }

  public int getVersion() { return version; }

  public PddlLanguage getLanguage() { return language; }

  public String getText() { return text; }

  public SyntaxTree getSyntaxTree() { return syntaxTree; }

  public PositionResolver getPositionResolver() { return positionResolver; }

  public FileStatus getStatus() { return status; }

  public void setStatus(FileStatus status) {
    this.status = Objects.requireNonNull(status, "status");
  }

  /**
   * Replaces the text when {@code version} is newer than the current one, or when forced.
   *
   * @param resolver resolver for the new text, or {@code null} to keep the current one
   * @return {@code true} if the text was replaced and the file is now dirty
   */
  public boolean update(int version, String text, PositionResolver resolver, boolean force) {
    if (version > this.version || force) {
      this.version = version;
      this.text = Objects.requireNonNull(text, "text");
      if (resolver != null) this.positionResolver = resolver;
      this.status = FileStatus.DIRTY;
      return true;
    }
    return false;
  }

  public List<ParsingProblem> getParsingProblems() {
    return Collections.unmodifiableList(problems);
  }

  public void addProblem(ParsingProblem problem) {
    problems.add(Objects.requireNonNull(problem, "problem"));
  }

  public void addProblems(Collection<ParsingProblem> newProblems) {
    newProblems.forEach(this::addProblem);
  }

  public boolean isDomain() { return getKind() == FileKind.DOMAIN; }

  public boolean isProblem() { return getKind() == FileKind.PROBLEM; }

  public boolean isPlan() { return getKind() == FileKind.PLAN; }

  public boolean isHappenings() { return getKind() == FileKind.HAPPENINGS; }

  public boolean isUnknown() { return getKind() == FileKind.UNKNOWN; }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{" + fileUri + " v" + version + " " + status + "}";
  }
}
