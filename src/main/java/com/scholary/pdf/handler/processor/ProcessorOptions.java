package com.scholary.pdf.handler.processor;

import java.util.Map;

/** Typed access to the string options passed with a request. */
public final class ProcessorOptions {

  private ProcessorOptions() {}

  public static int intOption(Map<String, String> options, String name, int defaultValue) {
    String raw = options.get(name);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      throw new DocumentProcessingException(
          String.format("Option '%s' must be an integer, got '%s'", name, raw));
    }
  }

  public static boolean booleanOption(
      Map<String, String> options, String name, boolean defaultValue) {
    String raw = options.get(name);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    String value = raw.trim();
    if ("true".equalsIgnoreCase(value)) {
      return true;
    }
    if ("false".equalsIgnoreCase(value)) {
      return false;
    }
    throw new DocumentProcessingException(
        String.format("Option '%s' must be true or false, got '%s'", name, raw));
  }
}
