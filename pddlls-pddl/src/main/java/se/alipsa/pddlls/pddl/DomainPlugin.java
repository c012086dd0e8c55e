package se.alipsa.pddlls.pddl;

import se.alipsa.pddlls.core.ParseRequest;
import se.alipsa.pddlls.core.PddlFilePlugin;
import se.alipsa.pddlls.core.model.FileInfo;
import se.alipsa.pddlls.core.model.PddlLanguage;
import se.alipsa.pddlls.pddl.parser.DomainParser;

import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/** Reads PDDL domain files. */
public final class DomainPlugin implements PddlFilePlugin {

  private final DomainParser parser = new DomainParser();

  @Override public String id() { return "pddl-domain"; }

  @Override public String displayName() { return "PDDL domain"; }

  @Override public Set<PddlLanguage> languages() { return Set.of(PddlLanguage.PDDL); }

  @Override
  public double claim(String fileUri, PddlLanguage language, Supplier<CharSequence> contentPreview) {
    return language == PddlLanguage.PDDL ? 0.9 : 0.0;
  }

  @Override
  public Optional<FileInfo> parse(ParseRequest request) {
    return parser.parse(request).map(FileInfo.class::cast);
  }
}
