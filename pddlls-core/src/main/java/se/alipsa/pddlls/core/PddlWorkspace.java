package se.alipsa.pddlls.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.pddlls.core.model.DomainInfo;
import se.alipsa.pddlls.core.model.FileInfo;
import se.alipsa.pddlls.core.model.FileStatus;
import se.alipsa.pddlls.core.model.HappeningsInfo;
import se.alipsa.pddlls.core.model.ParsingProblem;
import se.alipsa.pddlls.core.model.PddlLanguage;
import se.alipsa.pddlls.core.model.PlanInfo;
import se.alipsa.pddlls.core.model.Position;
import se.alipsa.pddlls.core.model.PositionResolver;
import se.alipsa.pddlls.core.model.ProblemInfo;
import se.alipsa.pddlls.core.model.UnknownFileInfo;
import se.alipsa.pddlls.core.parser.SyntaxTree;
import se.alipsa.pddlls.core.parser.SyntaxTreeBuilder;
import se.alipsa.pddlls.core.parser.Token;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * Default implementation of {@link WorkspaceFacade}: files grouped by folder, explicit
 * associations, dirty tracking and a debounced batch re-parse.
 * <p>
 * All state is guarded by this object's monitor. The only deferred work is the batch re-parse,
 * scheduled on the supplied executor; scheduling again cancels the pending batch first.
 */
public final class PddlWorkspace implements WorkspaceFacade {
  private static final Logger logger = LoggerFactory.getLogger(PddlWorkspace.class);

  // domains (and files that might become one) before problems, problems before plans
  private static final List<Predicate<FileInfo>> PHASES = List.of(
      f -> f.getLanguage() == PddlLanguage.PDDL && !f.isProblem(),
      FileInfo::isProblem,
      f -> true);
  private static final int MAX_BATCH_PASSES = 3;

  private final PluginRegistry plugins;
  private final WorkspaceOptions options;
  private final ScheduledExecutorService scheduler;
  private final AssociationGraph associations = new AssociationGraph();
  private final Map<String, Folder> folders = new LinkedHashMap<>();
  private final Map<String, Integer> lastVersionUpdateEmitted = new HashMap<>();
  private final List<WorkspaceListener> listeners = new CopyOnWriteArrayList<>();

  private ScheduledFuture<?> pendingParse;
  private long scheduleGeneration;
  private boolean batchRunning;

  public PddlWorkspace(PluginRegistry plugins, WorkspaceOptions options, ScheduledExecutorService scheduler) {
    this.plugins = Objects.requireNonNull(plugins);
    this.options = Objects.requireNonNull(options);
    this.scheduler = Objects.requireNonNull(scheduler);
  }

  public WorkspaceOptions getOptions() { return options; }

  // --- upsert and parse -------------------------------------------------------------------------

  @Override
  public synchronized FileInfo upsertFile(String uri, PddlLanguage language, int version, String text,
                                          PositionResolver resolver, boolean force) {
    Objects.requireNonNull(uri, "uri");
    Folder folder = upsertFolder(UriUtil.folderOf(uri));
    FileInfo existing = folder.get(uri);
    if (existing != null) {
      if (existing.update(version, text, resolver, force)) {
        logger.debug("{} updated to version {}", uri, version);
        scheduleParsing();
      }
      return existing;
    }
    return insertFile(folder, uri, language, version, text, resolver);
  }

  @Override
  public synchronized FileInfo upsertAndParseFile(String uri, PddlLanguage language, int version, String text,
                                                  PositionResolver resolver) {
    FileInfo fileInfo = upsertFile(uri, language, version, text, resolver);
    if (fileInfo.getStatus() == FileStatus.DIRTY) {
      fileInfo = reParseFile(fileInfo);
    }
    return fileInfo;
  }

  private FileInfo insertFile(Folder folder, String uri, PddlLanguage language, int version, String text,
                              PositionResolver resolver) {
    FileInfo fileInfo = parseFile(uri, language, version, text, resolver);
    if (!folder.add(fileInfo)) {
      logger.debug("Not storing {}: excluded URI scheme", uri);
      if (folder.isEmpty()) folders.remove(folder.getFolderUri());
      return fileInfo;
    }
    invalidateDependents(fileInfo);
    emitIfNew(FileEvent.UPDATED, fileInfo);
    emitIfNew(FileEvent.INSERTED, fileInfo);
    return fileInfo;
  }

  /**
   * Parses the current text of the file again and replaces its model in the folder. A domain marks
   * its problems (and their plans) dirty; a problem marks its plans and happenings dirty.
   */
  public synchronized FileInfo reParseFile(FileInfo fileInfo) {
    String uri = fileInfo.getFileUri();
    Folder folder = upsertFolder(UriUtil.folderOf(uri));
    FileInfo parsed = parseFile(uri, fileInfo.getLanguage(), fileInfo.getVersion(), fileInfo.getText(),
        fileInfo.getPositionResolver());
    folder.remove(uri);
    if (!folder.add(parsed)) return parsed;
    invalidateDependents(parsed);
    emitIfNew(FileEvent.UPDATED, parsed);
    return parsed;
  }

  /** (Re)arms the batch timer. A pending batch is cancelled first, so bursts of edits coalesce. */
  public synchronized void scheduleParsing() {
    cancelScheduledParsing();
    long generation = ++scheduleGeneration;
    long delayMs = options.getParsingDelay().toMillis();
    pendingParse = scheduler.schedule(() -> runScheduledBatch(generation), delayMs, TimeUnit.MILLISECONDS);
  }

  public synchronized void cancelScheduledParsing() {
    if (pendingParse != null) {
      pendingParse.cancel(false);
      pendingParse = null;
    }
  }

  public synchronized boolean isParsingScheduled() {
    return pendingParse != null;
  }

  private synchronized void runScheduledBatch(long generation) {
    // a timer that was replaced while waiting for the monitor does nothing
    if (generation != scheduleGeneration) return;
    pendingParse = null;
    try {
      parseAllDirty();
    } catch (RuntimeException e) {
      logger.error("Batch re-parse failed", e);
    }
  }

  /**
   * Re-parses every dirty file: domains and unclassified PDDL files first, then problems, then
   * plans and happenings. Each phase sees the invalidations of the phases before it. A file that
   * changes kind can invalidate files an earlier phase already handled, so the phases repeat until
   * nothing is dirty.
   */
  public synchronized void parseAllDirty() {
    batchRunning = true;
    try {
      for (int pass = 0; pass < MAX_BATCH_PASSES && hasDirtyFiles(); pass++) {
        for (Predicate<FileInfo> phase : PHASES) {
          List<FileInfo> dirty = getAllFilesIf(f -> f.getStatus() == FileStatus.DIRTY && phase.test(f));
          if (!dirty.isEmpty()) logger.debug("Re-parsing {} dirty files", dirty.size());
          for (FileInfo f : dirty) reParseFile(f);
        }
      }
    } finally {
      batchRunning = false;
    }
    if (hasDirtyFiles()) {
      logger.warn("Files still dirty after {} passes, scheduling another batch", MAX_BATCH_PASSES);
      scheduleParsing();
    }
  }

  private boolean hasDirtyFiles() {
    return !getAllFilesIf(f -> f.getStatus() == FileStatus.DIRTY).isEmpty();
  }

  private FileInfo parseFile(String uri, PddlLanguage language, int version, String text, PositionResolver resolver) {
    SyntaxTree tree = SyntaxTreeBuilder.build(text);
    ParseRequest request = new ParseRequest(uri, language, version, text, tree, resolver);

    FileInfo parsed = null;
    RuntimeException failure = null;
    for (PddlFilePlugin plugin : plugins.candidates(uri, language, () -> TextUtil.preview(text))) {
      try {
        Optional<FileInfo> result = plugin.parse(request);
        if (result.isPresent()) {
          parsed = result.get();
          logger.debug("{} v{} parsed by {} as {}", uri, version, plugin.id(), parsed.getKind());
          break;
        }
      } catch (RuntimeException e) {
        logger.warn("Plugin {} failed to parse {}", plugin.id(), uri, e);
        failure = e;
      }
    }

    if (parsed == null) {
      parsed = new UnknownFileInfo(uri, version, language, text, tree, resolver);
      parsed.addProblem(failure != null
          ? new ParsingProblem("Parser failure: " + failure.getMessage(), 0, 0, ParsingProblem.Severity.ERROR)
          : new ParsingProblem("Not recognized as a " + language + " file", 0, 0, ParsingProblem.Severity.INFORMATION));
    }
    if (language == PddlLanguage.PDDL) {
      appendOffendingTokens(parsed, tree, resolver);
    }
    return parsed;
  }

  private static void appendOffendingTokens(FileInfo fileInfo, SyntaxTree tree, PositionResolver resolver) {
    for (Token token : tree.getOffendingTokens()) {
      Position p = resolver.resolveToPosition(token.getStart());
      fileInfo.addProblem(new ParsingProblem("Unexpected token: " + token, p.line, p.column));
    }
  }

  // --- invalidation -----------------------------------------------------------------------------

  private void invalidateDependents(FileInfo fileInfo) {
    if (fileInfo instanceof DomainInfo domain) {
      markProblemsAsDirty(domain);
    } else if (fileInfo instanceof ProblemInfo problem) {
      markPlansAsDirty(problem);
    }
  }

  private void markProblemsAsDirty(DomainInfo domain) {
    for (ProblemInfo problem : getProblemFiles(domain)) {
      invalidate(problem);
      markPlansAsDirty(problem);
    }
  }

  private void markPlansAsDirty(ProblemInfo problem) {
    getPlanFiles(problem).forEach(this::invalidate);
    getHappeningsFiles(problem).forEach(this::invalidate);
  }

  // marks dirty without touching the content; a running batch picks it up in a later phase
  private void invalidate(FileInfo fileInfo) {
    if (fileInfo.getStatus() == FileStatus.DIRTY) return;
    fileInfo.setStatus(FileStatus.DIRTY);
    logger.debug("{} invalidated", fileInfo.getFileUri());
    if (!batchRunning) scheduleParsing();
  }

  // --- events -----------------------------------------------------------------------------------

  @Override
  public void addListener(WorkspaceListener listener) {
    listeners.add(Objects.requireNonNull(listener));
  }

  @Override
  public void removeListener(WorkspaceListener listener) {
    listeners.remove(listener);
  }

  /** UPDATED is only emitted for a version newer than the last UPDATED of the same URI. */
  private void emitIfNew(FileEvent event, FileInfo fileInfo) {
    if (event == FileEvent.UPDATED) {
      Integer last = lastVersionUpdateEmitted.get(fileInfo.getFileUri());
      if (last != null && fileInfo.getVersion() <= last) return;
      lastVersionUpdateEmitted.put(fileInfo.getFileUri(), fileInfo.getVersion());
    }
    for (WorkspaceListener l : listeners) {
      try {
        l.onFileEvent(event, fileInfo);
      } catch (RuntimeException e) {
        logger.warn("Listener failed on {} of {}", event, fileInfo.getFileUri(), e);
      }
    }
  }

  // --- removal ----------------------------------------------------------------------------------

  @Override
  public synchronized boolean removeFile(String uri, FileRemovalOptions options) {
    String folderUri = UriUtil.folderOf(uri);
    Folder folder = folders.get(folderUri);
    if (folder == null || !folder.hasFile(uri)) return false;
    if (associations.hasExplicitAssociations(uri)) {
      if (!options.isRemoveAllReferences()) {
        logger.warn("Not removing {}: it has explicit associations", uri);
        return false;
      }
      associations.removeFile(uri);
    }

    emitIfNew(FileEvent.REMOVING, folder.get(uri));
    if (!folder.remove(uri)) {
      throw new IllegalStateException("File " + uri + " disappeared from its folder during removal");
    }
    lastVersionUpdateEmitted.remove(uri);
    if (folder.isEmpty()) folders.remove(folderUri);
    return true;
  }

  // --- lookups ----------------------------------------------------------------------------------

  @Override
  public synchronized Optional<FileInfo> getFileInfo(String uri) {
    Folder folder = folders.get(UriUtil.folderOf(uri));
    return folder == null ? Optional.empty() : Optional.ofNullable(folder.get(uri));
  }

  @Override
  public synchronized List<FileInfo> getAllFiles() {
    return getAllFilesIf(f -> true);
  }

  public synchronized List<FileInfo> getAllFilesIf(Predicate<FileInfo> predicate) {
    List<FileInfo> out = new ArrayList<>();
    for (Folder folder : folders.values()) {
      for (FileInfo f : folder.getFiles()) {
        if (predicate.test(f)) out.add(f);
      }
    }
    return out;
  }

  public synchronized Optional<Folder> getFolderOf(FileInfo fileInfo) {
    return Optional.ofNullable(folders.get(UriUtil.folderOf(fileInfo.getFileUri())));
  }

  @Override
  public synchronized void associateProblemToDomain(ProblemInfo problem, DomainInfo domain) {
    associations.associateProblemToDomain(problem.getFileUri(), domain.getFileUri());
  }

  @Override
  public synchronized void associatePlanToProblem(String planUri, ProblemInfo problem) {
    associations.associatePlanToProblem(planUri, problem.getFileUri());
  }

  public synchronized boolean hasExplicitAssociations(String uri) {
    return associations.hasExplicitAssociations(uri);
  }

  @Override
  public synchronized List<DomainInfo> getDomainFilesFor(ProblemInfo problem) {
    Optional<String> explicit = associations.domainOf(problem.getFileUri());
    if (explicit.isPresent()) {
      return getFileInfo(explicit.get())
          .filter(DomainInfo.class::isInstance)
          .map(DomainInfo.class::cast)
          .map(List::of)
          .orElse(List.of());
    }
    return getFolderOf(problem).map(f -> f.getDomainFilesFor(problem)).orElse(List.of());
  }

  @Override
  public synchronized Optional<DomainInfo> getDomainFileFor(ProblemInfo problem) {
    List<DomainInfo> domains = getDomainFilesFor(problem);
    if (domains.size() > 1) {
      logger.warn("{} matches {} domains named '{}'; none chosen", problem.getFileUri(), domains.size(),
          problem.getDomainName());
    }
    return domains.size() == 1 ? Optional.of(domains.get(0)) : Optional.empty();
  }

  /**
   * Problems that belong to the domain: those explicitly associated with it, plus same-folder
   * problems naming it that are not explicitly associated elsewhere.
   */
  @Override
  public synchronized List<ProblemInfo> getProblemFiles(DomainInfo domain) {
    Set<ProblemInfo> out = new LinkedHashSet<>();
    getFolderOf(domain).ifPresent(folder -> {
      for (ProblemInfo p : folder.getProblemFilesFor(domain)) {
        if (associations.domainOf(p.getFileUri()).map(domain.getFileUri()::equals).orElse(true)) out.add(p);
      }
    });
    for (FileInfo f : getAllFilesIf(FileInfo::isProblem)) {
      if (associations.domainOf(f.getFileUri()).map(domain.getFileUri()::equals).orElse(false)) {
        out.add((ProblemInfo) f);
      }
    }
    return new ArrayList<>(out);
  }

  public synchronized List<PlanInfo> getPlanFiles(ProblemInfo problem) {
    Set<PlanInfo> out = new LinkedHashSet<>();
    getFolderOf(problem).ifPresent(folder -> out.addAll(folder.getPlanFilesFor(problem)));
    for (FileInfo f : getAllFilesIf(FileInfo::isPlan)) {
      if (isExplicitlyAssociatedWith(f, problem)) out.add((PlanInfo) f);
    }
    return new ArrayList<>(out);
  }

  public synchronized List<HappeningsInfo> getHappeningsFiles(ProblemInfo problem) {
    Set<HappeningsInfo> out = new LinkedHashSet<>();
    getFolderOf(problem).ifPresent(folder -> out.addAll(folder.getHappeningsFilesFor(problem)));
    for (FileInfo f : getAllFilesIf(FileInfo::isHappenings)) {
      if (isExplicitlyAssociatedWith(f, problem)) out.add((HappeningsInfo) f);
    }
    return new ArrayList<>(out);
  }

  private boolean isExplicitlyAssociatedWith(FileInfo trace, ProblemInfo problem) {
    return associations.problemOf(trace.getFileUri()).map(problem.getFileUri()::equals).orElse(false);
  }

  @Override
  public synchronized Optional<ProblemInfo> getProblemFileForPlan(PlanInfo plan) {
    return problemFor(plan, plan.getProblemName());
  }

  @Override
  public synchronized Optional<ProblemInfo> getProblemFileForHappenings(HappeningsInfo happenings) {
    return problemFor(happenings, happenings.getProblemName());
  }

  private Optional<ProblemInfo> problemFor(FileInfo trace, String problemName) {
    Optional<String> explicit = associations.problemOf(trace.getFileUri());
    if (explicit.isPresent()) {
      return getFileInfo(explicit.get()).filter(ProblemInfo.class::isInstance).map(ProblemInfo.class::cast);
    }
    return getFolderOf(trace).flatMap(folder -> folder.getProblemFileWithName(problemName));
  }

  @Override
  public synchronized Optional<DomainInfo> asDomain(FileInfo fileInfo) {
    if (fileInfo instanceof DomainInfo domain) return Optional.of(domain);
    if (fileInfo instanceof ProblemInfo problem) return getDomainFileFor(problem);
    if (fileInfo instanceof PlanInfo plan) return getProblemFileForPlan(plan).flatMap(this::getDomainFileFor);
    if (fileInfo instanceof HappeningsInfo h) return getProblemFileForHappenings(h).flatMap(this::getDomainFileFor);
    return Optional.empty();
  }

  private Folder upsertFolder(String folderUri) {
    return folders.computeIfAbsent(folderUri, k -> new Folder(k, options.getExcludedSchemes()));
  }
}
