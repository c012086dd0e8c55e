package se.alipsa.pddlls.core;

/** What the workspace hands to each plugin when it is registered. */
public interface PluginEnvironment {
  WorkspaceOptions options();
}
