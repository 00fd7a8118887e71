package com.flamingo.ai.policyanalysis.service.analysis.preprocess;

import com.flamingo.ai.policyanalysis.config.AnalysisConfig;
import com.flamingo.ai.policyanalysis.exception.ContentProcessingException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.stereotype.Component;

/**
 * Validates PDF bytes with Apache PDFBox before they are attached to a model call.
 *
 * <p>Rejects anything that is not a readable, unencrypted PDF within the configured page and size
 * limits, so a bad upload fails fast instead of burning a vision call.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PdfContentInspector {

  private static final byte[] PDF_SIGNATURE = "%PDF-".getBytes(StandardCharsets.US_ASCII);

  private final AnalysisConfig analysisConfig;

  public static boolean hasPdfSignature(byte[] bytes) {
    if (bytes == null || bytes.length < PDF_SIGNATURE.length) {
      return false;
    }
    for (int i = 0; i < PDF_SIGNATURE.length; i++) {
      if (bytes[i] != PDF_SIGNATURE[i]) {
        return false;
      }
    }
    return true;
  }

  /**
   * Inspects {@code bytes}.
   *
   * @param documentId document the bytes belong to, for error reporting
   * @param bytes the PDF file
   * @return page count and size
   * @throws ContentProcessingException if the bytes are not an acceptable PDF
   */
  public PdfInfo inspect(String documentId, byte[] bytes) {
    AnalysisConfig.Pdf limits = analysisConfig.getPdf();

    if (!hasPdfSignature(bytes)) {
      throw new ContentProcessingException(
          documentId, "Content is not a PDF (missing %PDF- header)");
    }
    if (bytes.length > limits.getMaxBytes()) {
      throw new ContentProcessingException(
          documentId,
          String.format(
              "PDF is %d bytes, exceeding the limit of %d", bytes.length, limits.getMaxBytes()));
    }

    try (PDDocument pdfDoc = Loader.loadPDF(bytes)) {
      if (pdfDoc.isEncrypted()) {
        throw new ContentProcessingException(documentId, "PDF is encrypted");
      }
      int pages = pdfDoc.getNumberOfPages();
      if (pages > limits.getMaxPages()) {
        throw new ContentProcessingException(
            documentId,
            String.format(
                "PDF has %d pages, exceeding the limit of %d", pages, limits.getMaxPages()));
      }
      log.debug("PDF for document {}: {} pages, {} bytes", documentId, pages, bytes.length);
      return new PdfInfo(pages, bytes.length);
    } catch (IOException e) {
      log.error("PDFBox could not read document {}: {}", documentId, e.getMessage());
      throw new ContentProcessingException(documentId, "Failed to read PDF: " + e.getMessage(), e);
    }
  }
}
