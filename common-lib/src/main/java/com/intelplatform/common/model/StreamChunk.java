package com.intelplatform.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One progress update streamed to the caller while a request executes.
 *
 * <p>A request emits, in order: one {@code progress} chunk (or a single cached {@code result}),
 * one {@code result}/{@code error} chunk per provider as each settles, and exactly one terminal
 * {@code complete} or {@code error} chunk.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamChunk(
    @JsonProperty("type") ChunkType type,
    @JsonProperty("providerId") String providerId,
    @JsonProperty("data") Object data,
    @JsonProperty("progress") Progress progress,
    @JsonProperty("error") ChunkError error
) {
    public static final String CODE_PROVIDER_ERROR  = "PROVIDER_ERROR";
    public static final String CODE_RATE_LIMITED    = "RATE_LIMITED";
    public static final String CODE_QUERY_FAILED    = "QUERY_EXECUTION_FAILED";
    public static final String CODE_CANCELLED       = "REQUEST_CANCELLED";

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Progress(
        @JsonProperty("completed") int completed,
        @JsonProperty("total") int total,
        @JsonProperty("message") String message
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ChunkError(
        @JsonProperty("message") String message,
        @JsonProperty("code") String code,
        @JsonProperty("providerId") String providerId
    ) {}

    public static StreamChunk progress(int completed, int total, String message) {
        return new StreamChunk(ChunkType.PROGRESS, null, null, new Progress(completed, total, message), null);
    }

    public static StreamChunk result(String providerId, Object data, Progress progress) {
        return new StreamChunk(ChunkType.RESULT, providerId, data, progress, null);
    }

    public static StreamChunk complete(NormalizedResult result, int total) {
        return new StreamChunk(ChunkType.COMPLETE, null, result,
            new Progress(total, total, "Query complete"), null);
    }

    public static StreamChunk providerError(String providerId, String message, String code, Progress progress) {
        return new StreamChunk(ChunkType.ERROR, providerId, null, progress,
            new ChunkError(message, code, providerId));
    }

    public static StreamChunk failure(String message, String code) {
        return new StreamChunk(ChunkType.ERROR, null, null, null, new ChunkError(message, code, null));
    }

    public boolean isTerminal() {
        return type == ChunkType.COMPLETE || (type == ChunkType.ERROR && providerId == null);
    }
}
