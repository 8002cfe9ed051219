package com.scholary.pdf.handler.processor;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.springframework.stereotype.Component;

/**
 * Describes a PDF as JSON: document information, version, encryption flag and page geometry.
 *
 * <p>Format:
 *
 * <pre>
 * {
 *   "pageCount": 2,
 *   "version": 1.7,
 *   "encrypted": false,
 *   "title": "Quarterly report",
 *   ...
 *   "pages": [{"number": 1, "width": 612.0, "height": 792.0, "rotation": 0}]
 * }
 * </pre>
 */
@Component
public class PdfInfoProcessor implements DocumentProcessor {

  public static final String NAME = "pdf-info";

  private final ObjectMapper objectMapper;

  public PdfInfoProcessor(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public String description() {
    return "Describe a PDF as JSON: metadata, version, encryption and page sizes";
  }

  @Override
  public ProcessedArtifact process(byte[] document, Map<String, String> options) {
    try (PDDocument pdf = PdfDocuments.load(document)) {
      PDDocumentInformation info = pdf.getDocumentInformation();

      Map<String, Object> description = new LinkedHashMap<>();
      description.put("pageCount", pdf.getNumberOfPages());
      description.put("version", pdf.getVersion());
      description.put("encrypted", pdf.isEncrypted());
      description.put("title", info.getTitle());
      description.put("author", info.getAuthor());
      description.put("subject", info.getSubject());
      description.put("creator", info.getCreator());
      description.put("producer", info.getProducer());
      description.put("creationDate", toIso(info.getCreationDate()));
      description.put("modificationDate", toIso(info.getModificationDate()));

      List<Map<String, Object>> pages = new ArrayList<>();
      int number = 1;
      for (PDPage page : pdf.getPages()) {
        PdfDocuments.checkInterrupted("page inspection");
        PDRectangle mediaBox = page.getMediaBox();
        Map<String, Object> pageInfo = new LinkedHashMap<>();
        pageInfo.put("number", number++);
        pageInfo.put("width", mediaBox.getWidth());
        pageInfo.put("height", mediaBox.getHeight());
        pageInfo.put("rotation", page.getRotation());
        pages.add(pageInfo);
      }
      description.put("pages", pages);

      byte[] json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(description);
      return new ProcessedArtifact(json, "application/json", "json");

    } catch (IOException e) {
      throw new DocumentProcessingException("Reading document info failed: " + e.getMessage(), e);
    }
  }

  private static String toIso(Calendar calendar) {
    return calendar == null ? null : calendar.toInstant().toString();
  }
}
