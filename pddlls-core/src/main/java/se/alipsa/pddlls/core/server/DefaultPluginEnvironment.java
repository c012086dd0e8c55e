package se.alipsa.pddlls.core.server;

import se.alipsa.pddlls.core.PluginEnvironment;
import se.alipsa.pddlls.core.WorkspaceOptions;

import java.util.Objects;

/** Minimal PluginEnvironment used by the in-proc server bootstrap. */
final class DefaultPluginEnvironment implements PluginEnvironment {

  private final WorkspaceOptions options;

  DefaultPluginEnvironment(WorkspaceOptions options) {
    this.options = Objects.requireNonNull(options);
  }

  @Override public WorkspaceOptions options() { return options; }
}
