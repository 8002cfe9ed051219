package com.scholary.pdf.handler.job;

import java.util.Map;
import java.util.UUID;

/**
 * One inbound processing request.
 *
 * <p>Lives for a single request/response exchange and is processed at most once. Nothing about a
 * job is kept after the response except its entry in the processing log.
 *
 * @param jobId unique id, echoed to the client
 * @param source upload filename or object key
 * @param processor name of the processor to run
 * @param options processor options
 */
public record ProcessingJob(
    String jobId, String source, String processor, Map<String, String> options) {

  public ProcessingJob {
    if (options == null) {
      options = Map.of();
    } else {
      options.forEach(
          (name, value) -> {
            if (name == null || value == null) {
              throw new IllegalArgumentException(
                  String.format("Option '%s' must have a non-null value", name));
            }
          });
      options = Map.copyOf(options);
    }
  }

  public static ProcessingJob create(
      String source, String processor, Map<String, String> options) {
    return new ProcessingJob(UUID.randomUUID().toString(), source, processor, options);
  }
}
