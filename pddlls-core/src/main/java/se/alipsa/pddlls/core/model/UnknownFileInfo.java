package se.alipsa.pddlls.core.model;

import se.alipsa.pddlls.core.parser.SyntaxTree;

/** A file no plugin could classify. The raw text is kept so that the file stays in the workspace. */
public final class UnknownFileInfo extends FileInfo {

  public UnknownFileInfo(String fileUri, int version, PddlLanguage language, String text,
                         SyntaxTree syntaxTree, PositionResolver positionResolver) {
    super(fileUri, version, language, text, syntaxTree, positionResolver);
  }

  @Override
  public FileKind getKind() { return FileKind.UNKNOWN; }
}
