package com.flamingo.ai.hybridrag.service.rag.model;

/** Provenance of a retrieved passage. Page and section are optional. */
public record SourceMetadata(String documentId, String sourcePath, Integer page, String section) {

  /** File name part of the source path. */
  public String fileName() {
    if (sourcePath == null) {
      return "";
    }
    int slash = Math.max(sourcePath.lastIndexOf('/'), sourcePath.lastIndexOf('\\'));
    return slash >= 0 ? sourcePath.substring(slash + 1) : sourcePath;
  }
}
