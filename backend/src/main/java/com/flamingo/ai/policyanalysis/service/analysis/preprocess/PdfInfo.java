package com.flamingo.ai.policyanalysis.service.analysis.preprocess;

/**
 * Facts about a PDF established before it is sent to a vision model.
 *
 * @param pageCount number of pages
 * @param sizeBytes size of the file
 */
public record PdfInfo(int pageCount, long sizeBytes) {}
