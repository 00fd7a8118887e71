package com.flamingo.ai.policyanalysis.service.analysis.model;

import com.flamingo.ai.policyanalysis.domain.enums.ContentKind;

/**
 * Content handed to the pipeline: either text or raw PDF bytes.
 *
 * @param kind which of the two this is
 * @param text the text, for {@link ContentKind#TEXT}
 * @param bytes the PDF bytes, for {@link ContentKind#PDF}
 */
public record AnalysisContent(ContentKind kind, String text, byte[] bytes) {

  public AnalysisContent {
    if (kind == null) {
      throw new IllegalArgumentException("kind is required");
    }
    if (kind == ContentKind.TEXT && text == null) {
      text = "";
    }
    if (kind == ContentKind.PDF && (bytes == null || bytes.length == 0)) {
      throw new IllegalArgumentException("PDF content requires bytes");
    }
  }

  public static AnalysisContent ofText(String text) {
    return new AnalysisContent(ContentKind.TEXT, text, null);
  }

  public static AnalysisContent ofPdf(byte[] bytes) {
    return new AnalysisContent(ContentKind.PDF, null, bytes);
  }

  public boolean isPdf() {
    return kind == ContentKind.PDF;
  }
}
