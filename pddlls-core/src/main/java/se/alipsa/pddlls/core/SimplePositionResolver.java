package se.alipsa.pddlls.core;

import se.alipsa.pddlls.core.model.Position;
import se.alipsa.pddlls.core.model.PositionResolver;

import java.util.ArrayList;
import java.util.List;

/** Resolver for text with {@code \n} or {@code \r\n} line endings. */
public final class SimplePositionResolver implements PositionResolver {

  private final int length;
  private final int[] lineStarts;

  public SimplePositionResolver(String text) {
    this.length = text.length();
    List<Integer> starts = new ArrayList<>();
    starts.add(0);
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == '\n') starts.add(i + 1);
    }
    this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
  }

  @Override
  public Position resolveToPosition(int offset) {
    int o = Math.max(0, Math.min(offset, length));
    int lo = 0, hi = lineStarts.length - 1;
    while (lo < hi) {
      int mid = (lo + hi + 1) >>> 1;
      if (lineStarts[mid] <= o) lo = mid; else hi = mid - 1;
    }
    return new Position(lo, o - lineStarts[lo]);
  }

  @Override
  public int resolveToOffset(Position position) {
    if (position.line >= lineStarts.length) return length;
    return Math.min(lineStarts[Math.max(0, position.line)] + position.column, length);
  }
}
