package se.alipsa.pddlls.plan;

import se.alipsa.pddlls.core.ParseRequest;
import se.alipsa.pddlls.core.PddlFilePlugin;
import se.alipsa.pddlls.core.PluginEnvironment;
import se.alipsa.pddlls.core.WorkspaceOptions;
import se.alipsa.pddlls.core.model.FileInfo;
import se.alipsa.pddlls.core.model.PddlLanguage;

import java.util.Optional;
import java.util.Set;

/** Reads plans; every file tagged as a plan yields a {@link se.alipsa.pddlls.core.model.PlanInfo}. */
public final class PlanPlugin implements PddlFilePlugin {

  private PlanParser parser = new PlanParser(WorkspaceOptions.defaults().getPlanEpsilon());

  @Override public String id() { return "pddl-plan"; }

  @Override public String displayName() { return "PDDL plan"; }

  @Override public Set<PddlLanguage> languages() { return Set.of(PddlLanguage.PLAN); }

  @Override
  public void configure(PluginEnvironment env) {
    parser = new PlanParser(env.options().getPlanEpsilon());
  }

  @Override
  public Optional<FileInfo> parse(ParseRequest request) {
    return Optional.of(parser.parse(request));
  }
}
