package se.alipsa.pddlls.core;

public final class FileRemovalOptions {
  public static final FileRemovalOptions DEFAULT = new FileRemovalOptions(false);
  public static final FileRemovalOptions REMOVE_ALL_REFERENCES = new FileRemovalOptions(true);

  private final boolean removeAllReferences;

  public FileRemovalOptions(boolean removeAllReferences) {
    this.removeAllReferences = removeAllReferences;
  }

  /** Also drop explicit associations instead of refusing the removal. */
  public boolean isRemoveAllReferences() {
    return removeAllReferences;
  }
}
