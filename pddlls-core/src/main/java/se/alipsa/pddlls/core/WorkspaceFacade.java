package se.alipsa.pddlls.core;

import se.alipsa.pddlls.core.model.DomainInfo;
import se.alipsa.pddlls.core.model.FileInfo;
import se.alipsa.pddlls.core.model.HappeningsInfo;
import se.alipsa.pddlls.core.model.PddlLanguage;
import se.alipsa.pddlls.core.model.PlanInfo;
import se.alipsa.pddlls.core.model.PositionResolver;
import se.alipsa.pddlls.core.model.ProblemInfo;

import java.util.List;
import java.util.Optional;

/** Transport-agnostic API over the multi-file workspace. */
public interface WorkspaceFacade {

  /**
   * Inserts and parses a new file, or updates the text of a known one. An update only applies to a
   * strictly newer version (or when forced); it marks the file dirty and schedules a batch re-parse.
   */
  FileInfo upsertFile(String uri, PddlLanguage language, int version, String text,
                      PositionResolver resolver, boolean force);

  default FileInfo upsertFile(String uri, PddlLanguage language, int version, String text,
                              PositionResolver resolver) {
    return upsertFile(uri, language, version, text, resolver, false);
  }

  /** Like {@link #upsertFile} but re-parses right away when the update made the file dirty. */
  FileInfo upsertAndParseFile(String uri, PddlLanguage language, int version, String text,
                              PositionResolver resolver);

  /**
   * Removes a file.
   *
   * @return {@code false} when the file is unknown, or when explicit associations exist and the
   *     options do not allow dropping them
   */
  boolean removeFile(String uri, FileRemovalOptions options);

  Optional<FileInfo> getFileInfo(String uri);

  List<FileInfo> getAllFiles();

  void associateProblemToDomain(ProblemInfo problem, DomainInfo domain);

  void associatePlanToProblem(String planUri, ProblemInfo problem);

  /** All matching domains: the explicit association if there is one, else same-folder name matches. */
  List<DomainInfo> getDomainFilesFor(ProblemInfo problem);

  /** The matching domain, only if exactly one candidate exists. */
  Optional<DomainInfo> getDomainFileFor(ProblemInfo problem);

  List<ProblemInfo> getProblemFiles(DomainInfo domain);

  Optional<ProblemInfo> getProblemFileForPlan(PlanInfo plan);

  Optional<ProblemInfo> getProblemFileForHappenings(HappeningsInfo happenings);

  /** The domain behind a domain, problem, plan or happenings file. */
  Optional<DomainInfo> asDomain(FileInfo fileInfo);

  void addListener(WorkspaceListener listener);

  void removeListener(WorkspaceListener listener);
}
