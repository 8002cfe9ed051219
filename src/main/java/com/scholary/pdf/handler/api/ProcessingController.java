package com.scholary.pdf.handler.api;

import com.scholary.pdf.handler.service.DocumentProcessingService;
import com.scholary.pdf.handler.service.ProcessingResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST API for document processing.
 *
 * <p>Every call is synchronous: the request thread waits while the job runs on a worker and gets
 * the artifact, or an error, before the processing deadline.
 *
 * <p>Endpoints:
 *
 * <ul>
 *   <li>{@code POST /api/process}: multipart upload, returns the artifact
 *   <li>{@code POST /api/process-object}: document read from the object store, returns the artifact
 *   <li>{@code POST /api/process-folder}: every PDF under a prefix, returns a summary
 * </ul>
 */
@RestController
@Tag(name = "Processing", description = "Synchronous document processing")
public class ProcessingController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessingController.class);

  static final String JOB_ID_HEADER = "X-Job-Id";
  static final String PROCESSOR_HEADER = "X-Processor";
  static final String PROCESSING_TIME_HEADER = "X-Processing-Time-Ms";

  private static final String PROCESSOR_PARAM = "processor";

  private final DocumentProcessingService processingService;

  public ProcessingController(DocumentProcessingService processingService) {
    this.processingService = processingService;
  }

  /**
   * Process an uploaded document.
   *
   * <p>Form fields other than {@code file} and {@code processor} are passed to the processor as
   * options.
   */
  @PostMapping(value = "/api/process", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Process an uploaded document",
      description = "Run the selected processor on the uploaded file and return the artifact")
  public ResponseEntity<byte[]> process(
      @RequestPart("file") MultipartFile file,
      @RequestParam(name = PROCESSOR_PARAM, required = false) String processor,
      @RequestParam Map<String, String> params)
      throws IOException {
    LOGGER.info(
        "Process request: filename={}, size={}, processor={}",
        file.getOriginalFilename(),
        file.getSize(),
        processor);

    Map<String, String> options = new LinkedHashMap<>(params);
    options.remove(PROCESSOR_PARAM);

    ProcessingResult result =
        processingService.process(file.getOriginalFilename(), file.getBytes(), processor, options);
    return artifactResponse(result);
  }

  @PostMapping("/api/process-object")
  @Operation(
      summary = "Process a stored document",
      description = "Read the document from the object store and return the artifact")
  public ResponseEntity<byte[]> processObject(@Valid @RequestBody ProcessObjectRequest request) {
    LOGGER.info(
        "Process-object request: bucket={}, key={}, processor={}",
        request.bucket(),
        request.key(),
        request.processor());

    ProcessingResult result =
        processingService.processObject(
            request.bucket(), request.key(), request.processor(), request.options());
    return artifactResponse(result);
  }

  @PostMapping("/api/process-folder")
  @Operation(
      summary = "Process a folder",
      description = "Process every PDF under an object-store prefix as one job")
  public ResponseEntity<FolderProcessingResponse> processFolder(
      @Valid @RequestBody ProcessFolderRequest request) {
    LOGGER.info(
        "Process-folder request: bucket={}, prefix={}, processor={}, outputPrefix={}",
        request.bucket(),
        request.prefix(),
        request.processor(),
        request.outputPrefix());

    return ResponseEntity.ok(
        processingService.processFolder(
            request.bucket(),
            request.prefix(),
            request.processor(),
            request.options(),
            request.outputPrefix()));
  }

  private static ResponseEntity<byte[]> artifactResponse(ProcessingResult result) {
    ContentDisposition disposition =
        ContentDisposition.attachment().filename(result.artifactFilename()).build();

    return ResponseEntity.ok()
        .contentType(MediaType.parseMediaType(result.artifact().contentType()))
        .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
        .header(JOB_ID_HEADER, result.jobId())
        .header(PROCESSOR_HEADER, result.processor())
        .header(PROCESSING_TIME_HEADER, String.valueOf(result.processingTimeMillis()))
        .body(result.artifact().content());
  }
}
