package com.flamingo.ai.policyanalysis.service.analysis.prompt;

import com.flamingo.ai.policyanalysis.service.analysis.model.DocumentMetadata;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Builds the prompts for every kind of analysis call. Pure; performs no I/O.
 *
 * <p>Chunk prompts tell the model which part of the bill it is looking at ("PART 2 OF 5", "THE
 * FINAL PART (5 OF 5)") and whether the split followed the bill's own sections, and repeat the
 * bill's metadata so each chunk is analysed in context.
 */
@Component
public class PromptBuilder {

  static final String SYSTEM_PROMPT =
      """
      You are a legislative analysis AI specializing in Texas public health and local government \
      impacts. Provide a comprehensive, objective analysis of the bill text following the \
      structured format exactly. Focus especially on impacts to Texas public health agencies and \
      local governments. If information is insufficient for any field, provide reasonable, \
      conservative assessments. If the bill text is too short or lacks substantive content to \
      perform meaningful analysis, return 'INSUFFICIENT_TEXT_FOR_ANALYSIS' in the summary field \
      and populate minimal required fields. Use only facts present in the text - do not add \
      external information or assumptions. Rate your confidence in the analysis from 0.0 to 1.0 \
      in confidence_score.""";

  static final String CHUNK_CLAUSE =
      " You are analyzing a portion of a larger document, so focus on extracting key information"
          + " from this specific section while considering how it fits into a broader bill"
          + " context.";

  private static final String SYNTHESIS_SYSTEM_PROMPT =
      """
      You are a legislative analyst. You combine summaries of consecutive parts of one bill into \
      a single coherent summary. Use only facts present in the part summaries.""";

  /** Prompt for analysing a whole document in one call. */
  public PromptBundle forDocument(String text, DocumentMetadata metadata) {
    String user =
        """
        Analyze the following legislative text and provide a comprehensive analysis. Focus on \
        identifying key provisions, potential impacts (especially on public health, local \
        government, and the economy), affected stakeholders, and implementation considerations. \
        Provide your analysis as a JSON object conforming to the required schema.

        %s
        Legislative Text:
        ```
        %s
        ```

        Respond with JSON."""
            .formatted(contextBlock(metadata), text);
    return structured(SYSTEM_PROMPT, user);
  }

  /** Prompt for analysing one chunk of a document that was too long for a single call. */
  public PromptBundle forChunk(
      String chunkText, DocumentMetadata metadata, ChunkPosition position) {
    String instructions = positionInstructions(position) + structureGuidance(position.structured());
    String user =
        instructions
            + "\n\n"
            + contextBlock(metadata)
            + "\nCURRENT SECTION TEXT TO ANALYZE:\n"
            + chunkText;
    return structured(SYSTEM_PROMPT + CHUNK_CLAUSE, user);
  }

  /** Prompt accompanying a PDF attachment on a vision-capable model. */
  public PromptBundle forPdf(DocumentMetadata metadata) {
    String user =
        """
        Analyze the attached PDF of a legislative bill and provide a comprehensive analysis. Read \
        every page, including tables. Focus on key provisions and on impacts to public health, \
        local government, and the economy. Provide your analysis as a JSON object conforming to \
        the required schema.

        %s
        Respond with JSON."""
            .formatted(contextBlock(metadata));
    return structured(SYSTEM_PROMPT, user);
  }

  /**
   * Plain-text prompt that rewrites the concatenated chunk summaries into one summary.
   *
   * @param summaries chunk summaries in document order
   * @param metadata the bill
   */
  public PromptBundle summarySynthesis(List<String> summaries, DocumentMetadata metadata) {
    StringBuilder parts = new StringBuilder();
    for (int i = 0; i < summaries.size(); i++) {
      parts.append("PART ").append(i + 1).append(":\n").append(summaries.get(i)).append("\n\n");
    }
    String user =
        """
        The following are summaries of consecutive parts of one legislative bill. Write a single \
        concise summary of the whole bill in one or two paragraphs. Do not mention the parts.

        %s
        %s"""
            .formatted(contextBlock(metadata), parts.toString().strip());
    return new PromptBundle(SYNTHESIS_SYSTEM_PROMPT, user, null, null);
  }

  // ---- private helpers ----

  private PromptBundle structured(String system, String user) {
    return new PromptBundle(
        system, user, AnalysisSchema.jsonSchema(), AnalysisSchema.SCHEMA_VERSION);
  }

  private String positionInstructions(ChunkPosition position) {
    int part = position.index() + 1;
    int total = position.total();
    if (position.isFirst()) {
      return ("You are analyzing PART 1 OF %d of a large legislative bill. Focus on the sections"
              + " provided while considering the bill's overall context.")
          .formatted(total);
    }
    if (position.isLast()) {
      return ("You are analyzing THE FINAL PART (%d OF %d) of a large legislative bill. Provide a"
              + " comprehensive conclusion for the provisions in this part.")
          .formatted(part, total);
    }
    return ("You are analyzing PART %d OF %d of a large legislative bill. Focus on the new content"
            + " in this section while keeping the whole bill in mind.")
        .formatted(part, total);
  }

  private String structureGuidance(boolean structured) {
    return structured
        ? " This document has structured sections. Pay attention to section headers and how they"
            + " relate to other parts of the bill."
        : " This document was split by content size rather than by natural sections. Be aware"
            + " that some concepts might span across chunks.";
  }

  private String contextBlock(DocumentMetadata metadata) {
    List<String> lines = new ArrayList<>();
    addLine(lines, "Bill Number", metadata.billNumber());
    addLine(lines, "Title", metadata.title());
    addLine(lines, "Description", metadata.description());
    addLine(lines, "Government Type", metadata.governmentType());
    addLine(lines, "Source", metadata.governmentSource());
    addLine(lines, "Status", metadata.status());
    if (lines.isEmpty()) {
      return "";
    }
    return "BILL CONTEXT:\n" + String.join("\n", lines) + "\n";
  }

  private void addLine(List<String> lines, String label, String value) {
    if (value != null && !value.isBlank()) {
      lines.add(label + ": " + value.strip());
    }
  }
}
