package com.flamingo.ai.policyanalysis.service.version;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.policyanalysis.config.AnalysisConfig;
import com.flamingo.ai.policyanalysis.domain.entity.AnalysisVersion;
import com.flamingo.ai.policyanalysis.domain.repository.AnalysisVersionRepository;
import com.flamingo.ai.policyanalysis.exception.ContentProcessingException;
import com.flamingo.ai.policyanalysis.exception.StaleVersionException;
import com.flamingo.ai.policyanalysis.service.analysis.AnalysisOutcome;
import com.flamingo.ai.policyanalysis.service.analysis.model.StructuredAnalysis;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link AnalysisVersionStore} on Spring Data JPA.
 *
 * <p>The next version number is the current maximum plus one. Two writers racing for the same
 * number collide on the {@code (document_id, version_number)} unique constraint; the loser retries
 * in a fresh transaction, where it either sees the winner as its predecessor or, if it named an
 * expected predecessor, fails with {@link StaleVersionException}.
 */
@Service
@Slf4j
public class JpaAnalysisVersionStore implements AnalysisVersionStore {

  private static final int MAX_RETRIES = 3;
  private static final long RETRY_DELAY_MS = 100;

  private final AnalysisVersionRepository repository;
  private final ObjectMapper objectMapper;
  private final AnalysisConfig analysisConfig;
  private final TransactionTemplate transactionTemplate;

  public JpaAnalysisVersionStore(
      AnalysisVersionRepository repository,
      ObjectMapper objectMapper,
      AnalysisConfig analysisConfig,
      PlatformTransactionManager transactionManager) {
    this.repository = repository;
    this.objectMapper = objectMapper;
    this.analysisConfig = analysisConfig;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  @Override
  public AnalysisVersion append(
      String documentId, AnalysisOutcome outcome, Long expectedPredecessorId) {
    for (int attempt = 1; attempt <= MAX_RETRIES; attempt++) {
      try {
        return transactionTemplate.execute(
            status -> appendOnce(documentId, outcome, expectedPredecessorId));
      } catch (DataIntegrityViolationException e) {
        if (attempt == MAX_RETRIES) {
          log.error(
              "Failed to append version for document {} after {} retries", documentId, MAX_RETRIES);
          throw e;
        }
        log.warn(
            "Version number collision on document {}, retry {}/{}",
            documentId,
            attempt,
            MAX_RETRIES);
        try {
          Thread.sleep(RETRY_DELAY_MS * attempt);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException("Interrupted during retry", ie);
        }
      }
    }
    throw new IllegalStateException("unreachable");
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<AnalysisVersion> findCurrent(String documentId) {
    return repository.findTopByDocumentIdOrderByVersionNumberDesc(documentId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<AnalysisVersion> findHistory(String documentId) {
    return repository.findByDocumentIdOrderByVersionNumberDesc(documentId);
  }

  /** Same content, and not a complete result replacing a head that had dropped chunks. */
  private boolean isUnchanged(AnalysisVersion head, String fingerprint, AnalysisOutcome outcome) {
    return fingerprint.equals(head.getFingerprint())
        && (!Boolean.TRUE.equals(head.getPartialCoverage()) || outcome.isPartial());
  }

  private AnalysisVersion appendOnce(
      String documentId, AnalysisOutcome outcome, Long expectedPredecessorId) {
    Optional<AnalysisVersion> head =
        repository.findTopByDocumentIdOrderByVersionNumberDesc(documentId);
    Long headId = head.map(AnalysisVersion::getId).orElse(null);

    if (expectedPredecessorId != null && !Objects.equals(expectedPredecessorId, headId)) {
      throw new StaleVersionException(documentId, expectedPredecessorId, headId);
    }

    String fingerprint = outcome.provenance().fingerprint().value();
    if (head.isPresent()
        && analysisConfig.getVersioning().isSkipUnchanged()
        && isUnchanged(head.get(), fingerprint, outcome)) {
      log.info(
          "Document {} unchanged since version {}, not appending",
          documentId,
          head.get().getVersionNumber());
      return head.get();
    }

    StructuredAnalysis analysis = outcome.analysis();
    AnalysisVersion version =
        AnalysisVersion.builder()
            .documentId(documentId)
            .versionNumber(head.map(h -> h.getVersionNumber() + 1).orElse(1))
            .fingerprint(fingerprint)
            .predecessorId(headId)
            .modelId(analysis.modelId())
            .route(outcome.provenance().route())
            .confidenceScore(analysis.confidenceScore())
            .processingTimeMs(analysis.processingTimeMs())
            .insufficientText(analysis.insufficientText())
            .partialCoverage(outcome.isPartial())
            .analysisJson(serialize(documentId, analysis))
            .build();

    AnalysisVersion saved = repository.saveAndFlush(version);
    log.info(
        "Recorded version {} of document {} (fingerprint {})",
        saved.getVersionNumber(),
        documentId,
        outcome.provenance().fingerprint().shortValue());
    return saved;
  }

  private String serialize(String documentId, StructuredAnalysis analysis) {
    try {
      return objectMapper.writeValueAsString(analysis);
    } catch (JsonProcessingException e) {
      throw new ContentProcessingException(
          documentId, "Failed to serialize analysis: " + e.getMessage(), e);
    }
  }
}
