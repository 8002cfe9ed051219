package com.scholary.pdf.handler.service;

/** Naming rules for artifacts derived from a source filename or object key. */
final class ArtifactNames {

  private ArtifactNames() {}

  /** "reports/q3.pdf" with "txt" becomes "q3.txt". */
  static String artifactFilename(String source, String extension) {
    String name = source == null || source.isBlank() ? "document" : source;
    int slash = name.lastIndexOf('/');
    if (slash >= 0) {
      name = name.substring(slash + 1);
    }
    int dot = name.lastIndexOf('.');
    if (dot > 0) {
      name = name.substring(0, dot);
    }
    if (name.isBlank()) {
      name = "document";
    }
    return name + "." + extension;
  }

  /** Output key for a batch artifact: the prefix followed by the artifact filename. */
  static String outputKey(String outputPrefix, String sourceKey, String extension) {
    return outputPrefix + artifactFilename(sourceKey, extension);
  }
}
