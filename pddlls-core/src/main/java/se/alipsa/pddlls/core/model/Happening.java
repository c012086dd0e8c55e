package se.alipsa.pddlls.core.model;

import java.util.List;
import java.util.Locale;

/** One line of a happenings trace: {@code [time:] [start|end] (action args) [#counter]}. */
public final class Happening {

  private final double time;
  private final HappeningType type;
  private final String actionName;
  private final List<String> objects;
  private final int counter;
  private final int line;

  public Happening(double time, HappeningType type, String actionName, List<String> objects, int counter, int line) {
    this.time = time;
    this.type = type;
    this.actionName = actionName;
    this.objects = List.copyOf(objects);
    this.counter = counter;
    this.line = line;
  }

  public double getTime() { return time; }

  public HappeningType getType() { return type; }

  public String getActionName() { return actionName; }

  public List<String> getObjects() { return objects; }

  /** Distinguishes overlapping instances of the same ground action; 0 when not given. */
  public int getCounter() { return counter; }

  public int getLine() { return line; }

  public String getFullActionName() {
    return objects.isEmpty() ? actionName : actionName + " " + String.join(" ", objects);
  }

  /** Key pairing a start with its end. */
  public String getMatchKey() {
    return getFullActionName().toLowerCase(Locale.ROOT) + "#" + counter;
  }

  @Override
  public String toString() {
    String prefix = type == HappeningType.INSTANTANEOUS ? "" : type.name().toLowerCase(Locale.ROOT) + " ";
    return time + ": " + prefix + "(" + getFullActionName() + ") #" + counter;
  }
}
