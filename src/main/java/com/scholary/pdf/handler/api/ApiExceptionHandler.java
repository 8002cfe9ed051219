package com.scholary.pdf.handler.api;

import com.scholary.pdf.handler.objectstore.ObjectStoreException;
import com.scholary.pdf.handler.objectstore.ObjectStoreUnavailableException;
import com.scholary.pdf.handler.processor.DocumentProcessingException;
import com.scholary.pdf.handler.processor.UnknownProcessorException;
import com.scholary.pdf.handler.service.JobFailedException;
import com.scholary.pdf.handler.service.RequestAbortedException;
import com.scholary.pdf.handler.worker.ProcessingTimeoutException;
import com.scholary.pdf.handler.worker.WorkerUnavailableException;
import java.io.IOException;
import java.time.Instant;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps every failure to an {@link ErrorResponse} with its {@link ErrorCategory}.
 *
 * <ul>
 *   <li>timeout: 504
 *   <li>processing failure: 422
 *   <li>transport failure: 400, 413, 502 or 503 depending on which side failed
 *   <li>rejected (no free worker): 503 with Retry-After
 *   <li>invalid request: 400
 * </ul>
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  private static final String RETRY_AFTER_SECONDS = "10";

  @ExceptionHandler(ProcessingTimeoutException.class)
  public ResponseEntity<ErrorResponse> handleTimeout(ProcessingTimeoutException ex) {
    return respond(HttpStatus.GATEWAY_TIMEOUT, ex.getJobId(), ErrorCategory.TIMEOUT, ex);
  }

  @ExceptionHandler(WorkerUnavailableException.class)
  public ResponseEntity<ErrorResponse> handleUnavailable(WorkerUnavailableException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
        .contentType(MediaType.APPLICATION_JSON)
        .body(body(ex.getJobId(), ErrorCategory.REJECTED, ex.getMessage()));
  }

  @ExceptionHandler(JobFailedException.class)
  public ResponseEntity<ErrorResponse> handleJobFailed(JobFailedException ex) {
    RuntimeException failure = ex.getFailure();
    if (failure instanceof ObjectStoreUnavailableException) {
      return respond(
          HttpStatus.SERVICE_UNAVAILABLE, ex.getJobId(), ErrorCategory.TRANSPORT_FAILURE, failure);
    }
    if (failure instanceof ObjectStoreException) {
      return respond(HttpStatus.BAD_GATEWAY, ex.getJobId(), ErrorCategory.TRANSPORT_FAILURE, failure);
    }
    return respond(
        HttpStatus.UNPROCESSABLE_ENTITY, ex.getJobId(), ErrorCategory.PROCESSING_FAILURE, failure);
  }

  @ExceptionHandler(DocumentProcessingException.class)
  public ResponseEntity<ErrorResponse> handleProcessing(DocumentProcessingException ex) {
    return respond(HttpStatus.UNPROCESSABLE_ENTITY, null, ErrorCategory.PROCESSING_FAILURE, ex);
  }

  @ExceptionHandler(ObjectStoreUnavailableException.class)
  public ResponseEntity<ErrorResponse> handleObjectStoreUnavailable(
      ObjectStoreUnavailableException ex) {
    return respond(HttpStatus.SERVICE_UNAVAILABLE, null, ErrorCategory.TRANSPORT_FAILURE, ex);
  }

  @ExceptionHandler(ObjectStoreException.class)
  public ResponseEntity<ErrorResponse> handleObjectStore(ObjectStoreException ex) {
    return respond(HttpStatus.BAD_GATEWAY, null, ErrorCategory.TRANSPORT_FAILURE, ex);
  }

  @ExceptionHandler(RequestAbortedException.class)
  public ResponseEntity<ErrorResponse> handleAborted(RequestAbortedException ex) {
    return respond(HttpStatus.SERVICE_UNAVAILABLE, null, ErrorCategory.TRANSPORT_FAILURE, ex);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ErrorResponse> handleTooLarge(MaxUploadSizeExceededException ex) {
    return respond(HttpStatus.PAYLOAD_TOO_LARGE, null, ErrorCategory.TRANSPORT_FAILURE, ex);
  }

  @ExceptionHandler(MissingServletRequestPartException.class)
  public ResponseEntity<ErrorResponse> handleMissingPart(MissingServletRequestPartException ex) {
    return respond(HttpStatus.BAD_REQUEST, null, ErrorCategory.INVALID_REQUEST, ex);
  }

  @ExceptionHandler({MultipartException.class, HttpMessageNotReadableException.class})
  public ResponseEntity<ErrorResponse> handleUnreadable(Exception ex) {
    return respond(HttpStatus.BAD_REQUEST, null, ErrorCategory.TRANSPORT_FAILURE, ex);
  }

  @ExceptionHandler(IOException.class)
  public ResponseEntity<ErrorResponse> handleIo(IOException ex) {
    // the response may already be committed, in which case this body is dropped
    LOGGER.warn("I/O failure while handling request: {}", ex.getMessage());
    return respond(HttpStatus.BAD_REQUEST, null, ErrorCategory.TRANSPORT_FAILURE, ex);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(ApiExceptionHandler::describe)
            .collect(Collectors.joining(", ", "Validation failed: ", ""));
    return ResponseEntity.badRequest()
        .contentType(MediaType.APPLICATION_JSON)
        .body(body(null, ErrorCategory.INVALID_REQUEST, message));
  }

  @ExceptionHandler({
    UnknownProcessorException.class,
    MissingServletRequestParameterException.class,
    MethodArgumentTypeMismatchException.class,
    IllegalArgumentException.class
  })
  public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
    return respond(HttpStatus.BAD_REQUEST, null, ErrorCategory.INVALID_REQUEST, ex);
  }

  @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
  public ResponseEntity<ErrorResponse> handleMediaType(HttpMediaTypeNotSupportedException ex) {
    return respond(HttpStatus.UNSUPPORTED_MEDIA_TYPE, null, ErrorCategory.INVALID_REQUEST, ex);
  }

  @ExceptionHandler(HttpMediaTypeNotAcceptableException.class)
  public ResponseEntity<Void> handleNotAcceptable(HttpMediaTypeNotAcceptableException ex) {
    // no representation the client accepts, so no body
    return ResponseEntity.status(HttpStatus.NOT_ACCEPTABLE).build();
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ErrorResponse> handleMethod(HttpRequestMethodNotSupportedException ex) {
    return respond(HttpStatus.METHOD_NOT_ALLOWED, null, ErrorCategory.INVALID_REQUEST, ex);
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<ErrorResponse> handleNotFound(NoResourceFoundException ex) {
    return respond(HttpStatus.NOT_FOUND, null, ErrorCategory.INVALID_REQUEST, ex);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
    LOGGER.error("Unhandled exception", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .contentType(MediaType.APPLICATION_JSON)
        .body(
            body(
                null,
                ErrorCategory.PROCESSING_FAILURE,
                "An unexpected error occurred: " + ex.getMessage()));
  }

  private static ResponseEntity<ErrorResponse> respond(
      HttpStatus status, String jobId, ErrorCategory category, Exception ex) {
    return ResponseEntity.status(status)
        .contentType(MediaType.APPLICATION_JSON)
        .body(body(jobId, category, ex.getMessage()));
  }

  private static ErrorResponse body(String jobId, ErrorCategory category, String message) {
    return new ErrorResponse(jobId, category, message, Instant.now());
  }

  private static String describe(FieldError error) {
    return error.getField() + " " + error.getDefaultMessage();
  }
}
