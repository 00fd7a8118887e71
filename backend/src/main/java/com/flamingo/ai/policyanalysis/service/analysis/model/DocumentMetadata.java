package com.flamingo.ai.policyanalysis.service.analysis.model;

/**
 * Descriptive metadata about the bill being analysed, injected into prompts for context.
 *
 * @param documentId stable identifier of the document in the caller's system
 * @param billNumber bill number, e.g. {@code HB 1234}
 * @param title bill title
 * @param description short description from the legislative source
 * @param governmentType e.g. {@code state} or {@code federal}
 * @param governmentSource e.g. {@code Texas Legislature}
 * @param status current bill status
 */
public record DocumentMetadata(
    String documentId,
    String billNumber,
    String title,
    String description,
    String governmentType,
    String governmentSource,
    String status) {

  public DocumentMetadata {
    if (documentId == null || documentId.isBlank()) {
      throw new IllegalArgumentException("documentId is required");
    }
  }

  public static DocumentMetadata of(String documentId, String billNumber, String title) {
    return new DocumentMetadata(documentId, billNumber, title, null, null, null, null);
  }
}
