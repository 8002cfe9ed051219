package com.scholary.pdf.handler.processor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;

/**
 * Loading and pre-validation shared by the PDF processors.
 *
 * <p>The caller owns the returned document and must close it.
 */
final class PdfDocuments {

  private static final byte[] PDF_MAGIC = "%PDF-".getBytes(StandardCharsets.US_ASCII);

  // Readers tolerate leading garbage before the header, within the first kilobyte
  private static final int HEADER_SEARCH_WINDOW = 1024;

  private PdfDocuments() {}

  static PDDocument load(byte[] document) {
    if (document == null || document.length == 0) {
      throw new DocumentProcessingException("Document is empty");
    }
    if (!hasPdfHeader(document)) {
      throw new DocumentProcessingException("Document is not a PDF: missing %PDF- header");
    }
    try {
      return Loader.loadPDF(document);
    } catch (InvalidPasswordException e) {
      throw new DocumentProcessingException("Document is password protected", e);
    } catch (IOException e) {
      throw new DocumentProcessingException("Malformed PDF: " + e.getMessage(), e);
    }
  }

  static boolean hasPdfHeader(byte[] document) {
    int limit = Math.min(document.length, HEADER_SEARCH_WINDOW) - PDF_MAGIC.length;
    for (int i = 0; i <= limit; i++) {
      boolean match = true;
      for (int j = 0; j < PDF_MAGIC.length; j++) {
        if (document[i + j] != PDF_MAGIC[j]) {
          match = false;
          break;
        }
      }
      if (match) {
        return true;
      }
    }
    return false;
  }

  static void checkInterrupted(String stage) {
    if (Thread.currentThread().isInterrupted()) {
      throw new DocumentProcessingException("Processing interrupted during " + stage);
    }
  }
}
