package com.scholary.codeindex.service;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.FileVisitOption;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Finds the files an indexing job still has to process. */
final class CandidateFiles {

  private static final Logger LOGGER = LoggerFactory.getLogger(CandidateFiles.class);

  private CandidateFiles() {}

  /**
   * List regular files under {@code directory} that end with one of {@code extensions}, skipping
   * hidden files, hidden directories below {@code directory} (never descended into) and paths in
   * {@code alreadyIndexed}. Subdirectories and files that cannot be read are logged and skipped.
   *
   * @return absolute paths, sorted for a stable processing order
   * @throws IOException if {@code directory} itself cannot be read
   */
  static List<Path> collect(
      Path directory, boolean recursive, Collection<String> extensions, Set<String> alreadyIndexed)
      throws IOException {
    Collector collector = new Collector(directory, extensions, alreadyIndexed);
    Files.walkFileTree(
        directory,
        EnumSet.noneOf(FileVisitOption.class),
        recursive ? Integer.MAX_VALUE : 1,
        collector);
    List<Path> files = collector.files();
    files.sort(null);
    return files;
  }

  /** Tree visitor that gathers candidates and tolerates unreadable entries below the root. */
  static final class Collector extends SimpleFileVisitor<Path> {

    private final Path root;
    private final Collection<String> extensions;
    private final Set<String> alreadyIndexed;
    private final List<Path> files = new ArrayList<>();

    Collector(Path root, Collection<String> extensions, Set<String> alreadyIndexed) {
      this.root = root;
      this.extensions = extensions;
      this.alreadyIndexed = alreadyIndexed;
    }

    List<Path> files() {
      return files;
    }

    @Override
    public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
      if (!dir.equals(root) && isHidden(dir)) {
        return FileVisitResult.SKIP_SUBTREE;
      }
      return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
      boolean regular =
          attrs.isRegularFile() || (attrs.isSymbolicLink() && Files.isRegularFile(file));
      if (regular && !isHidden(file) && hasExtension(file)) {
        Path absolute = file.toAbsolutePath().normalize();
        if (!alreadyIndexed.contains(absolute.toString())) {
          files.add(absolute);
        }
      }
      return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
      if (file.equals(root)) {
        throw exc;
      }
      LOGGER.warn("Skipping unreadable path {}: {}", file, exc.toString());
      return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
      if (exc != null) {
        if (dir.equals(root)) {
          throw exc;
        }
        LOGGER.warn("Skipping unreadable directory {}: {}", dir, exc.toString());
      }
      return FileVisitResult.CONTINUE;
    }

    private boolean hasExtension(Path file) {
      String name = file.getFileName().toString();
      for (String extension : extensions) {
        if (name.endsWith(extension)) {
          return true;
        }
      }
      return false;
    }

    private static boolean isHidden(Path path) {
      Path name = path.getFileName();
      return name != null && name.toString().startsWith(".");
    }
  }
}
