package com.realestate.spatial.application.port.in;

import com.realestate.spatial.api.dto.EnrichmentSubmissionResponseDto;

/**
 * Input port for queueing a bulk geocoding batch.
 */
public interface SubmitEnrichmentUseCase {

  EnrichmentSubmissionResponseDto submitBatch(int batchSize);
}
