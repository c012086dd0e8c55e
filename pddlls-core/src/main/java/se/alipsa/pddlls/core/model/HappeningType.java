package se.alipsa.pddlls.core.model;

public enum HappeningType {
  START, END, INSTANTANEOUS
}
