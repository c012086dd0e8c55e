package se.alipsa.pddlls.core.model;

import java.util.Objects;

public class Range {
  public final Position start;
  public final Position end;

  public Range(Position start, Position end) {
    this.start = Objects.requireNonNull(start, "start");
    this.end = Objects.requireNonNull(end, "end");
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Range that)) return false;
    return start.equals(that.start) && end.equals(that.end);
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, end);
  }

  @Override
  public String toString() {
    return start + "-" + end;
  }
}
