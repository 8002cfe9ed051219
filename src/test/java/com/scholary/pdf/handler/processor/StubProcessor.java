package com.scholary.pdf.handler.processor;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.function.BiFunction;

/** Processor whose behaviour is supplied by the test. */
public class StubProcessor implements DocumentProcessor {

  private final String name;
  private final BiFunction<byte[], Map<String, String>, ProcessedArtifact> body;

  public StubProcessor(
      String name, BiFunction<byte[], Map<String, String>, ProcessedArtifact> body) {
    this.name = name;
    this.body = body;
  }

  /** Returns the input unchanged as text/plain. */
  public static StubProcessor echo(String name) {
    return new StubProcessor(name, (document, options) -> text(document));
  }

  public static ProcessedArtifact text(byte[] content) {
    return new ProcessedArtifact(content, "text/plain", "txt");
  }

  public static ProcessedArtifact text(String content) {
    return text(content.getBytes(StandardCharsets.UTF_8));
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public String description() {
    return "Stub processor " + name;
  }

  @Override
  public ProcessedArtifact process(byte[] document, Map<String, String> options) {
    return body.apply(document, options);
  }
}
