package com.scholary.pdf.handler.processor;

import java.util.Map;

/**
 * A document-processing collaborator.
 *
 * <p>Implementations are registered as Spring beans and selected by {@link #name()}. The worker
 * pool calls {@link #process} on a worker thread and may interrupt it when the request deadline
 * passes, so long-running implementations should check {@link Thread#isInterrupted()} between
 * units of work.
 *
 * <p>Implementations are not assumed to be reentrant. Only raise the worker count if the processor
 * is safe for concurrent invocation.
 */
public interface DocumentProcessor {

  /** Unique name used to select this processor in requests. */
  String name();

  /** Short human-readable description for the processor listing. */
  String description();

  /**
   * Process one document.
   *
   * @param document the raw document bytes
   * @param options processor-specific options, never null
   * @return the produced artifact
   * @throws DocumentProcessingException if the input is rejected or cannot be processed
   */
  ProcessedArtifact process(byte[] document, Map<String, String> options);
}
