package com.strategylab.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.strategylab.api.dto.request.CreateBatchJobRequest;

/**
 * Remote batch API as seen by a client. Responses are raw JSON snapshots with any
 * response envelope already removed; reading them is left to {@link BatchJobReconciler}.
 *
 * <p>Every method throws {@link BatchClientException} on HTTP or network failure.
 */
public interface BatchJobApiClient {

    JsonNode create(CreateBatchJobRequest request);

    JsonNode fetch(String jobId);

    JsonNode cancel(String jobId);
}
