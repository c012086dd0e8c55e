package se.alipsa.pddlls.core;

import se.alipsa.pddlls.core.model.PddlLanguage;
import se.alipsa.pddlls.core.model.PositionResolver;
import se.alipsa.pddlls.core.parser.SyntaxTree;

import java.util.Objects;

/** Everything a plugin needs to turn one file version into a model. */
public final class ParseRequest {
  private final String fileUri;
  private final PddlLanguage language;
  private final int version;
  private final String text;
  private final SyntaxTree syntaxTree;
  private final PositionResolver positionResolver;

  public ParseRequest(String fileUri, PddlLanguage language, int version, String text,
                      SyntaxTree syntaxTree, PositionResolver positionResolver) {
    this.fileUri = Objects.requireNonNull(fileUri, "fileUri");
    this.language = Objects.requireNonNull(language, "language");
    this.version = version;
    this.text = Objects.requireNonNull(text, "text");
    this.syntaxTree = Objects.requireNonNull(syntaxTree, "syntaxTree");
    this.positionResolver = Objects.requireNonNull(positionResolver, "positionResolver");
  }

  public String getFileUri() { return fileUri; }

  public PddlLanguage getLanguage() { return language; }

  public int getVersion() { return version; }

  public String getText() { return text; }

  public SyntaxTree getSyntaxTree() { return syntaxTree; }

  public PositionResolver getPositionResolver() { return positionResolver; }
}
