package se.alipsa.pddlls.pddl.symbols;

/** Text to insert at an offset of a document. */
public final class TextInsertion {
  private final int offset;
  private final String text;

  public TextInsertion(int offset, String text) {
    this.offset = offset;
    this.text = text;
  }

  public int getOffset() { return offset; }

  public String getText() { return text; }

  /** The document with this insertion applied. */
  public String applyTo(String document) {
    return document.substring(0, offset) + text + document.substring(offset);
  }

  @Override
  public String toString() {
    return "@" + offset + ":" + text;
  }
}
