package com.scholary.pdf.handler.processor;

import com.scholary.pdf.handler.config.ProcessingProperties;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Registry of available document processors, keyed by name.
 *
 * <p>Built once at startup from every {@link DocumentProcessor} bean. Duplicate names and a missing
 * default processor fail startup.
 */
@Component
public class DocumentProcessorRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(DocumentProcessorRegistry.class);

  private final Map<String, DocumentProcessor> processors;
  private final String defaultProcessor;

  public DocumentProcessorRegistry(
      List<DocumentProcessor> processors, ProcessingProperties properties) {
    Map<String, DocumentProcessor> byName = new LinkedHashMap<>();
    for (DocumentProcessor processor : processors) {
      DocumentProcessor previous = byName.put(processor.name(), processor);
      if (previous != null) {
        throw new IllegalStateException(
            String.format(
                "Duplicate processor name '%s': %s and %s",
                processor.name(),
                previous.getClass().getName(),
                processor.getClass().getName()));
      }
    }
    if (!byName.containsKey(properties.defaultProcessor())) {
      throw new IllegalStateException(
          String.format(
              "Default processor '%s' is not registered, available: %s",
              properties.defaultProcessor(), byName.keySet()));
    }
    this.processors = Collections.unmodifiableMap(byName);
    this.defaultProcessor = properties.defaultProcessor();

    LOGGER.info("Registered processors: {} (default={})", byName.keySet(), defaultProcessor);
  }

  /**
   * Resolve a processor by name.
   *
   * @param name the requested name, or null/blank for the default processor
   * @throws UnknownProcessorException if no processor has that name
   */
  public DocumentProcessor resolve(String name) {
    String key = name == null || name.isBlank() ? defaultProcessor : name.trim();
    DocumentProcessor processor = processors.get(key);
    if (processor == null) {
      throw new UnknownProcessorException(key, processors.keySet());
    }
    return processor;
  }

  public List<ProcessorInfo> list() {
    return processors.values().stream()
        .map(p -> new ProcessorInfo(p.name(), p.description(), p.name().equals(defaultProcessor)))
        .toList();
  }

  public int size() {
    return processors.size();
  }
}
