package se.alipsa.pddlls.plan;

import se.alipsa.pddlls.core.ParseRequest;
import se.alipsa.pddlls.core.PddlFilePlugin;
import se.alipsa.pddlls.core.model.FileInfo;
import se.alipsa.pddlls.core.model.PddlLanguage;

import java.util.Optional;
import java.util.Set;

public final class HappeningsPlugin implements PddlFilePlugin {

  private final HappeningsParser parser = new HappeningsParser();

  @Override public String id() { return "pddl-happenings"; }

  @Override public String displayName() { return "PDDL plan happenings"; }

  @Override public Set<PddlLanguage> languages() { return Set.of(PddlLanguage.HAPPENINGS); }

  @Override
  public Optional<FileInfo> parse(ParseRequest request) {
    return Optional.of(parser.parse(request));
  }
}
