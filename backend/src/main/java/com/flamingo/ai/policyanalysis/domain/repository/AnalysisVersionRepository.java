package com.flamingo.ai.policyanalysis.domain.repository;

import com.flamingo.ai.policyanalysis.domain.entity.AnalysisVersion;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for AnalysisVersion entities. */
@Repository
public interface AnalysisVersionRepository extends JpaRepository<AnalysisVersion, Long> {

  /** Finds the current (highest) version of a document. */
  Optional<AnalysisVersion> findTopByDocumentIdOrderByVersionNumberDesc(String documentId);

  /** Finds every version of a document, newest first. */
  List<AnalysisVersion> findByDocumentIdOrderByVersionNumberDesc(String documentId);
}
