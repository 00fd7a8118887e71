package com.flamingo.ai.policyanalysis.domain.entity;

import com.flamingo.ai.policyanalysis.domain.enums.AnalysisRoute;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

/**
 * One recorded analysis of a document. Rows are append-only: a re-analysis adds a new version
 * linked to its predecessor and never touches older rows.
 */
@Entity
@Immutable
@Table(
    name = "analysis_versions",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uk_analysis_versions_document_version",
            columnNames = {"document_id", "version_number"}),
    indexes = @Index(name = "idx_analysis_versions_fingerprint", columnList = "fingerprint"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class AnalysisVersion {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "document_id", nullable = false, updatable = false)
  private String documentId;

  /** Starts at 1 and increases by one per document. */
  @Column(name = "version_number", nullable = false, updatable = false)
  private Integer versionNumber;

  @Column(nullable = false, updatable = false, length = 64)
  private String fingerprint;

  /** Id of the version this one supersedes; {@code null} for the first version. */
  @Column(name = "predecessor_id", updatable = false)
  private Long predecessorId;

  @Column(nullable = false, updatable = false)
  private String modelId;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, updatable = false)
  private AnalysisRoute route;

  @Column(nullable = false, updatable = false)
  private Double confidenceScore;

  @Column(nullable = false, updatable = false)
  private Long processingTimeMs;

  @Column(nullable = false, updatable = false)
  private Boolean insufficientText;

  @Column(nullable = false, updatable = false)
  private Boolean partialCoverage;

  /** The StructuredAnalysis, serialized as snake_case JSON. */
  @Column(columnDefinition = "TEXT", nullable = false, updatable = false)
  private String analysisJson;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
  }
}
