package com.flamingo.ai.policyanalysis.service.analysis.orchestration;

import com.flamingo.ai.policyanalysis.domain.enums.DropReason;

/**
 * A chunk that did not contribute to the merged analysis.
 *
 * @param index the chunk index
 * @param reason why it was dropped
 * @param errorType error type of the failure, e.g. {@code chunk_failed}
 * @param message failure message for logs and reports
 */
public record DroppedChunk(int index, DropReason reason, String errorType, String message) {}
