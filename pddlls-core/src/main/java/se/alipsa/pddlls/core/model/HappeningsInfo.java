package se.alipsa.pddlls.core.model;

import se.alipsa.pddlls.core.parser.SyntaxTree;

import java.util.List;

/** An execution trace of start/end happenings. */
public final class HappeningsInfo extends FileInfo {

  private final String problemName;
  private final String domainName;
  private List<Happening> happenings = List.of();

  public HappeningsInfo(String fileUri, int version, String problemName, String domainName, String text,
                        SyntaxTree syntaxTree, PositionResolver positionResolver) {
    super(fileUri, version, PddlLanguage.HAPPENINGS, text, syntaxTree, positionResolver);
    this.problemName = problemName;
    this.domainName = domainName;
  }

  @Override
  public FileKind getKind() { return FileKind.HAPPENINGS; }

  public String getProblemName() { return problemName; }

  public String getDomainName() { return domainName; }

  public List<Happening> getHappenings() { return happenings; }

  public void setHappenings(List<Happening> happenings) { this.happenings = List.copyOf(happenings); }
}
