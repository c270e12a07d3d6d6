package com.scholary.codeindex.api;

import jakarta.validation.constraints.NotBlank;

/**
 * Request to start indexing a directory.
 *
 * @param projectName optional, defaults to the directory name
 * @param recursive optional, defaults to true
 */
public record StartIndexingRequest(@NotBlank String directory, String projectName, Boolean recursive) {

  public boolean recursiveOrDefault() {
    return recursive == null || recursive;
  }
}
