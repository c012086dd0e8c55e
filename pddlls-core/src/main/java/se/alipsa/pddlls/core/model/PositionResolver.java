package se.alipsa.pddlls.core.model;

/**
 * Translates character offsets to line/column positions and back. Supplied by the caller, since
 * it depends on the line-ending convention of the document.
 */
public interface PositionResolver {

  Position resolveToPosition(int offset);

  int resolveToOffset(Position position);

  default Range resolveToRange(int startOffset, int endOffset) {
    return new Range(resolveToPosition(startOffset), resolveToPosition(endOffset));
  }
}
