package se.alipsa.pddlls.pddl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.pddlls.core.ParseRequest;
import se.alipsa.pddlls.core.PddlFilePlugin;
import se.alipsa.pddlls.core.PluginEnvironment;
import se.alipsa.pddlls.core.SimplePositionResolver;
import se.alipsa.pddlls.core.UriUtil;
import se.alipsa.pddlls.core.WorkspaceOptions;
import se.alipsa.pddlls.core.model.FileInfo;
import se.alipsa.pddlls.core.model.ParsingProblem;
import se.alipsa.pddlls.core.model.PddlLanguage;
import se.alipsa.pddlls.core.model.PositionResolver;
import se.alipsa.pddlls.core.model.ProblemInfo;
import se.alipsa.pddlls.core.parser.SyntaxTree;
import se.alipsa.pddlls.core.parser.SyntaxTreeBuilder;
import se.alipsa.pddlls.pddl.parser.ProblemParser;
import se.alipsa.pddlls.pddl.preprocess.PreProcessingDirective;
import se.alipsa.pddlls.pddl.preprocess.PreProcessingException;
import se.alipsa.pddlls.pddl.preprocess.PreProcessor;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Reads PDDL problem files. A problem carrying a {@code ;;!pre-parsing:} directive is first piped
 * through the configured pre-processor (when pre-processing is enabled); the model then describes
 * the generated problem while keeping the text the user wrote.
 */
public final class ProblemPlugin implements PddlFilePlugin {
  private static final Logger logger = LoggerFactory.getLogger(ProblemPlugin.class);

  static final String UNKNOWN = "unknown";

  private final ProblemParser parser = new ProblemParser();
  private WorkspaceOptions options = WorkspaceOptions.defaults();

  @Override public String id() { return "pddl-problem"; }

  @Override public String displayName() { return "PDDL problem"; }

  @Override public Set<PddlLanguage> languages() { return Set.of(PddlLanguage.PDDL); }

  @Override
  public double claim(String fileUri, PddlLanguage language, Supplier<CharSequence> contentPreview) {
    return language == PddlLanguage.PDDL ? 0.8 : 0.0;
  }

  @Override
  public void configure(PluginEnvironment env) {
    this.options = env.options();
  }

  @Override
  public Optional<FileInfo> parse(ParseRequest request) {
    if (!options.isPreprocessingEnabled()) {
      return parseText(request, request.getText(), request.getSyntaxTree(), request.getPositionResolver());
    }
    try {
      Optional<PreProcessingDirective> directive = PreProcessingDirective.find(request.getText());
      if (directive.isEmpty()) {
        return parseText(request, request.getText(), request.getSyntaxTree(), request.getPositionResolver());
      }
      PreProcessor preProcessor = directive.get().createPreProcessor();
      String processed = preProcessor.transform(request.getText(), workingDirectory(request.getFileUri()),
          options.getPreprocessingTimeout());
      Optional<FileInfo> result = parseText(request, processed, SyntaxTreeBuilder.build(processed),
          new SimplePositionResolver(processed));
      result.ifPresent(f -> ((ProblemInfo) f).setPreProcessor(preProcessor.getLabel()));
      return result;
    } catch (PreProcessingException e) {
      logger.info("Pre-processing of {} failed: {}", request.getFileUri(), e.getMessage());
      ProblemInfo failed = new ProblemInfo(request.getFileUri(), request.getVersion(), UNKNOWN, UNKNOWN,
          request.getText(), SyntaxTree.EMPTY, request.getPositionResolver());
      failed.addProblem(new ParsingProblem(e.getMessage(), e.getLine(), e.getColumn()));
      return Optional.of(failed);
    }
  }

  // positions in a generated problem refer to the generated text
  private Optional<FileInfo> parseText(ParseRequest request, String text, SyntaxTree tree, PositionResolver resolver) {
    return parser.parse(request.getFileUri(), request.getVersion(), text, tree, request.getText(), resolver)
        .map(FileInfo.class::cast);
  }

  static Path workingDirectory(String fileUri) {
    if (!"file".equals(UriUtil.scheme(fileUri))) return null;
    try {
      return Paths.get(URI.create(UriUtil.folderOf(fileUri)));
    } catch (IllegalArgumentException e) {
      logger.debug("No working directory for {}", fileUri, e);
      return null;
    }
  }
}
