package com.scholary.pdf.handler.processor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Extracts plain text from a PDF.
 *
 * <p>Options:
 *
 * <ul>
 *   <li>{@code startPage}, {@code endPage}: 1-based inclusive page range, defaults to all pages
 *   <li>{@code sortByPosition}: order text by position on the page instead of content stream order
 * </ul>
 *
 * <p>Pages are extracted one at a time so an interrupt from the worker pool stops the job between
 * pages.
 */
@Component
public class PdfTextProcessor implements DocumentProcessor {

  public static final String NAME = "pdf-text";

  private static final Logger LOGGER = LoggerFactory.getLogger(PdfTextProcessor.class);

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public String description() {
    return "Extract plain text from a PDF (options: startPage, endPage, sortByPosition)";
  }

  @Override
  public ProcessedArtifact process(byte[] document, Map<String, String> options) {
    try (PDDocument pdf = PdfDocuments.load(document)) {
      int pageCount = pdf.getNumberOfPages();
      int startPage = ProcessorOptions.intOption(options, "startPage", 1);
      int endPage = Math.min(ProcessorOptions.intOption(options, "endPage", pageCount), pageCount);
      boolean sortByPosition = ProcessorOptions.booleanOption(options, "sortByPosition", false);

      if (startPage < 1) {
        throw new DocumentProcessingException("startPage must be >= 1, got " + startPage);
      }
      if (pageCount > 0 && startPage > pageCount) {
        throw new DocumentProcessingException(
            String.format("startPage %d is beyond the last page (%d)", startPage, pageCount));
      }
      if (endPage < startPage && pageCount > 0) {
        throw new DocumentProcessingException(
            String.format("endPage %d is before startPage %d", endPage, startPage));
      }

      PDFTextStripper stripper = new PDFTextStripper();
      stripper.setSortByPosition(sortByPosition);

      StringBuilder text = new StringBuilder();
      for (int page = startPage; page <= endPage; page++) {
        PdfDocuments.checkInterrupted("text extraction of page " + page);
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        text.append(stripper.getText(pdf));
      }

      LOGGER.debug(
          "Extracted {} chars from pages {}-{} of {}",
          text.length(),
          startPage,
          endPage,
          pageCount);

      return new ProcessedArtifact(
          text.toString().getBytes(StandardCharsets.UTF_8), "text/plain; charset=UTF-8", "txt");

    } catch (IOException e) {
      throw new DocumentProcessingException("Text extraction failed: " + e.getMessage(), e);
    }
  }
}
