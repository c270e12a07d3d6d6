package com.scholary.codeindex.worker;

/**
 * Outcome of indexing one file.
 *
 * @param skipped true if the worker decided not to index the file (unchanged, unsupported, empty)
 * @param unitsIndexed number of semantic units (functions, classes, ...) stored for the file
 */
public record FileIndexResult(boolean skipped, int unitsIndexed) {

  public FileIndexResult {
    if (unitsIndexed < 0) {
      throw new IllegalArgumentException("unitsIndexed cannot be negative");
    }
  }

  public static FileIndexResult indexed(int unitsIndexed) {
    return new FileIndexResult(false, unitsIndexed);
  }

  public static FileIndexResult skippedFile() {
    return new FileIndexResult(true, 0);
  }
}
