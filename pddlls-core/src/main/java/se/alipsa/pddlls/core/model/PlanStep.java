package se.alipsa.pddlls.core.model;

import java.util.List;
import java.util.OptionalDouble;

/** One line of a plan: {@code [time:] (action args) [[duration]]}. */
public final class PlanStep {

  private final double time;
  private final boolean timeSpecified;
  private final String actionName;
  private final List<String> objects;
  private final Double duration;
  private final int line;

  public PlanStep(double time, boolean timeSpecified, String actionName, List<String> objects,
                  Double duration, int line) {
    this.time = time;
    this.timeSpecified = timeSpecified;
    this.actionName = actionName;
    this.objects = List.copyOf(objects);
    this.duration = duration;
    this.line = line;
  }

  public double getStartTime() { return time; }

  /** {@code false} when the time was inferred from the previous step. */
  public boolean isTimeSpecified() { return timeSpecified; }

  public String getActionName() { return actionName; }

  public List<String> getObjects() { return objects; }

  public OptionalDouble getDuration() {
    return duration == null ? OptionalDouble.empty() : OptionalDouble.of(duration);
  }

  public boolean isDurative() { return duration != null; }

  public double getEndTime() {
    return duration == null ? time : time + duration;
  }

  /** Zero-based line in the plan file. */
  public int getLine() { return line; }

  public String getFullActionName() {
    return objects.isEmpty() ? actionName : actionName + " " + String.join(" ", objects);
  }

  @Override
  public String toString() {
    String s = time + ": (" + getFullActionName() + ")";
    return duration == null ? s : s + " [" + duration + "]";
  }
}
