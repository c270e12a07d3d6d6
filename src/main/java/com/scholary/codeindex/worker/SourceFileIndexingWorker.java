package com.scholary.codeindex.worker;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal worker used when no semantic extractor is wired in.
 *
 * <p>It reads each file as UTF-8 and reports one unit per non-blank file, skipping blank ones. It
 * lets the job machinery run end to end (resumption, progress, failure counting on unreadable
 * files) without a parser or vector store.
 */
public class SourceFileIndexingWorker implements IndexingWorker {

  private static final Logger LOGGER = LoggerFactory.getLogger(SourceFileIndexingWorker.class);

  private final String projectName;
  private final Set<String> supportedExtensions;
  private boolean initialized;

  public SourceFileIndexingWorker(String projectName, Set<String> supportedExtensions) {
    this.projectName = projectName;
    this.supportedExtensions = Set.copyOf(supportedExtensions);
  }

  @Override
  public void initialize() {
    if (!initialized) {
      initialized = true;
      LOGGER.debug("Worker initialized for project {}", projectName);
    }
  }

  @Override
  public FileIndexResult indexFile(Path file) throws IOException {
    if (!initialized) {
      throw new IndexingWorkerException("Worker not initialized");
    }
    String content = Files.readString(file, StandardCharsets.UTF_8);
    if (content.isBlank()) {
      return FileIndexResult.skippedFile();
    }
    return FileIndexResult.indexed(1);
  }

  @Override
  public Set<String> supportedExtensions() {
    return supportedExtensions;
  }

  @Override
  public void close() {
    initialized = false;
  }
}
