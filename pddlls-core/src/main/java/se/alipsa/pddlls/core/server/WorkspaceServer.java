package se.alipsa.pddlls.core.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.pddlls.core.FileEvent;
import se.alipsa.pddlls.core.FileRemovalOptions;
import se.alipsa.pddlls.core.PddlWorkspace;
import se.alipsa.pddlls.core.PluginEnvironment;
import se.alipsa.pddlls.core.PluginRegistry;
import se.alipsa.pddlls.core.WorkspaceFacade;
import se.alipsa.pddlls.core.WorkspaceListener;
import se.alipsa.pddlls.core.WorkspaceOptions;
import se.alipsa.pddlls.core.model.DomainInfo;
import se.alipsa.pddlls.core.model.FileInfo;
import se.alipsa.pddlls.core.model.HappeningsInfo;
import se.alipsa.pddlls.core.model.PddlLanguage;
import se.alipsa.pddlls.core.model.PlanInfo;
import se.alipsa.pddlls.core.model.PositionResolver;
import se.alipsa.pddlls.core.model.ProblemInfo;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * In-process server façade.
 * - Delegates to PddlWorkspace
 * - Publishes parsing problems via DiagnosticsPublisher on UPDATED, clears them on REMOVING
 */
public final class WorkspaceServer implements WorkspaceFacade, AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(WorkspaceServer.class);

  private final PddlWorkspace workspace;
  private final DiagnosticsPublisher publisher;

  // for lifecycle management if we created the scheduler
  private final ScheduledExecutorService scheduler;
  private final boolean ownsScheduler;

  private WorkspaceServer(PddlWorkspace workspace, DiagnosticsPublisher publisher,
                          ScheduledExecutorService scheduler, boolean ownsScheduler) {
    this.workspace = Objects.requireNonNull(workspace);
    this.publisher = Objects.requireNonNullElse(publisher, DiagnosticsPublisher.NO_OP);
    this.scheduler = scheduler;
    this.ownsScheduler = ownsScheduler;
    workspace.addListener(this::publish);
  }

  /** Server with options from {@link WorkspaceOptions#load()} and plugins discovered via ServiceLoader. */
  public static WorkspaceServer createDefault(DiagnosticsPublisher publisher) {
    return createDefault(WorkspaceOptions.load(), publisher);
  }

  public static WorkspaceServer createDefault(WorkspaceOptions options, DiagnosticsPublisher publisher) {
    ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "pddlls-parser");
      t.setDaemon(true);
      return t;
    });
    PluginEnvironment env = new DefaultPluginEnvironment(options);
    PluginRegistry registry = PluginRegistry.discover(env);
    PddlWorkspace workspace = new PddlWorkspace(registry, options, scheduler);
    logger.debug("Created workspace server with {}", options);
    return new WorkspaceServer(workspace, publisher, scheduler, true);
  }

  /** Advanced factory in case you want to supply your own pieces (tests, custom scheduling, etc.). */
  public static WorkspaceServer create(PluginRegistry registry,
                                       WorkspaceOptions options,
                                       ScheduledExecutorService scheduler,
                                       DiagnosticsPublisher publisher) {
    PddlWorkspace workspace = new PddlWorkspace(registry, options, scheduler);
    return new WorkspaceServer(workspace, publisher, scheduler, false);
  }

  /** Plugin environment for callers that assemble their own {@link PluginRegistry}. */
  public static PluginEnvironment environment(WorkspaceOptions options) {
    return new DefaultPluginEnvironment(options);
  }

  public PddlWorkspace getWorkspace() {
    return workspace;
  }

  private void publish(FileEvent event, FileInfo fileInfo) {
    switch (event) {
      case UPDATED -> publisher.publish(fileInfo.getFileUri(), fileInfo.getParsingProblems());
      case REMOVING -> publisher.publish(fileInfo.getFileUri(), List.of()); // clear diagnostics
      default -> { }
    }
  }

  // --- WorkspaceFacade (delegates) --------------------------------------------------------------

  @Override
  public FileInfo upsertFile(String uri, PddlLanguage language, int version, String text,
                             PositionResolver resolver, boolean force) {
    return workspace.upsertFile(uri, language, version, text, resolver, force);
  }

  @Override
  public FileInfo upsertAndParseFile(String uri, PddlLanguage language, int version, String text,
                                     PositionResolver resolver) {
    return workspace.upsertAndParseFile(uri, language, version, text, resolver);
  }

  @Override
  public boolean removeFile(String uri, FileRemovalOptions options) {
    return workspace.removeFile(uri, options);
  }

  @Override
  public Optional<FileInfo> getFileInfo(String uri) {
    return workspace.getFileInfo(uri);
  }

  @Override
  public List<FileInfo> getAllFiles() {
    return workspace.getAllFiles();
  }

  @Override
  public void associateProblemToDomain(ProblemInfo problem, DomainInfo domain) {
    workspace.associateProblemToDomain(problem, domain);
  }

  @Override
  public void associatePlanToProblem(String planUri, ProblemInfo problem) {
    workspace.associatePlanToProblem(planUri, problem);
  }

  @Override
  public List<DomainInfo> getDomainFilesFor(ProblemInfo problem) {
    return workspace.getDomainFilesFor(problem);
  }

  @Override
  public Optional<DomainInfo> getDomainFileFor(ProblemInfo problem) {
    return workspace.getDomainFileFor(problem);
  }

  @Override
  public List<ProblemInfo> getProblemFiles(DomainInfo domain) {
    return workspace.getProblemFiles(domain);
  }

  @Override
  public Optional<ProblemInfo> getProblemFileForPlan(PlanInfo plan) {
    return workspace.getProblemFileForPlan(plan);
  }

  @Override
  public Optional<ProblemInfo> getProblemFileForHappenings(HappeningsInfo happenings) {
    return workspace.getProblemFileForHappenings(happenings);
  }

  @Override
  public Optional<DomainInfo> asDomain(FileInfo fileInfo) {
    return workspace.asDomain(fileInfo);
  }

  @Override
  public void addListener(WorkspaceListener listener) {
    workspace.addListener(listener);
  }

  @Override
  public void removeListener(WorkspaceListener listener) {
    workspace.removeListener(listener);
  }

  // --- Lifecycle --------------------------------------------------------------------------------

  @Override
  public void close() {
    workspace.cancelScheduledParsing();
    if (ownsScheduler) {
      scheduler.shutdown();
    }
  }
}
