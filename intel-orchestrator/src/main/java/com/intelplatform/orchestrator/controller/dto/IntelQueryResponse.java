package com.intelplatform.orchestrator.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.intelplatform.common.model.NormalizedResult;
import com.intelplatform.common.model.StreamChunk;

import java.util.List;

/**
 * Body of a non-streaming query and of the SSE {@code complete} event. The SSE variant
 * carries no {@code chunks}, those were already streamed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IntelQueryResponse(
    @JsonProperty("requestId") String requestId,
    @JsonProperty("result") NormalizedResult result,
    @JsonProperty("chunks") List<StreamChunk> chunks,
    @JsonProperty("metadata") QueryMetadata metadata
) {}
