package se.alipsa.pddlls.core;

import se.alipsa.pddlls.core.model.DomainInfo;
import se.alipsa.pddlls.core.model.FileInfo;
import se.alipsa.pddlls.core.model.HappeningsInfo;
import se.alipsa.pddlls.core.model.PlanInfo;
import se.alipsa.pddlls.core.model.ProblemInfo;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static se.alipsa.pddlls.core.TextUtil.lowerCaseEquals;

/**
 * Files sharing one directory, keyed by URI. Files whose URI scheme is excluded (virtual
 * documents such as diff views) are never stored.
 */
public final class Folder {
  private final String folderUri;
  private final Set<String> excludedSchemes;
  private final Map<String, FileInfo> files = new LinkedHashMap<>();

  public Folder(String folderUri, Set<String> excludedSchemes) {
    this.folderUri = Objects.requireNonNull(folderUri);
    this.excludedSchemes = Set.copyOf(excludedSchemes);
  }

  public String getFolderUri() { return folderUri; }

  public boolean hasFile(String fileUri) {
    return files.containsKey(fileUri);
  }

  public FileInfo get(String fileUri) {
    return files.get(fileUri);
  }

  /**
   * Stores the file, replacing any previous model of the same URI.
   *
   * @return {@code false} if the URI scheme is excluded and nothing was stored
   */
  public boolean add(FileInfo fileInfo) {
    if (excludedSchemes.contains(UriUtil.scheme(fileInfo.getFileUri()))) return false;
    files.put(fileInfo.getFileUri(), fileInfo);
    return true;
  }

  public boolean remove(String fileUri) {
    return files.remove(fileUri) != null;
  }

  public List<FileInfo> getFiles() {
    return List.copyOf(files.values());
  }

  public boolean isEmpty() {
    return files.isEmpty();
  }

  public Optional<ProblemInfo> getProblemFileWithName(String problemName) {
    for (FileInfo f : files.values()) {
      if (f instanceof ProblemInfo p && lowerCaseEquals(p.getName(), problemName)) return Optional.of(p);
    }
    return Optional.empty();
  }

  public List<ProblemInfo> getProblemFilesFor(DomainInfo domain) {
    List<ProblemInfo> out = new ArrayList<>();
    for (FileInfo f : files.values()) {
      if (f instanceof ProblemInfo p && lowerCaseEquals(p.getDomainName(), domain.getName())) out.add(p);
    }
    return out;
  }

  public List<DomainInfo> getDomainFilesFor(ProblemInfo problem) {
    List<DomainInfo> out = new ArrayList<>();
    for (FileInfo f : files.values()) {
      if (f instanceof DomainInfo d && lowerCaseEquals(d.getName(), problem.getDomainName())) out.add(d);
    }
    return out;
  }

  /** Plans whose meta comments name this problem and its domain. */
  public List<PlanInfo> getPlanFilesFor(ProblemInfo problem) {
    List<PlanInfo> out = new ArrayList<>();
    for (FileInfo f : files.values()) {
      if (f instanceof PlanInfo p && lowerCaseEquals(p.getProblemName(), problem.getName())
          && lowerCaseEquals(p.getDomainName(), problem.getDomainName())) {
        out.add(p);
      }
    }
    return out;
  }

  public List<HappeningsInfo> getHappeningsFilesFor(ProblemInfo problem) {
    List<HappeningsInfo> out = new ArrayList<>();
    for (FileInfo f : files.values()) {
      if (f instanceof HappeningsInfo h && lowerCaseEquals(h.getProblemName(), problem.getName())
          && lowerCaseEquals(h.getDomainName(), problem.getDomainName())) {
        out.add(h);
      }
    }
    return out;
  }

  @Override
  public String toString() {
    return "Folder{" + folderUri + ", " + files.size() + " files}";
  }
}
