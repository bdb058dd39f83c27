package com.intelplatform.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Immutable intelligence request as submitted by the caller.
 *
 * <p>{@code providers} is treated as a set: duplicates are dropped on construction while the
 * first-seen order is kept. Required fields are left as-is (possibly {@code null}) so
 * validation can report them; see {@link IntelRequests#validate(IntelRequest)}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IntelRequest(
    @JsonProperty("type") RequestType type,
    @JsonProperty("target") String target,
    @JsonProperty("keywords") List<String> keywords,
    @JsonProperty("location") String location,
    @JsonProperty("providers") List<ProviderType> providers,
    @JsonProperty("options") RequestOptions options
) {
    public IntelRequest {
        keywords  = keywords == null ? List.of()
            : keywords.stream().filter(Objects::nonNull).toList();
        providers = providers == null ? null
            : providers.stream().filter(Objects::nonNull).distinct().toList();
        options   = options == null ? RequestOptions.none() : options;
    }

    public static IntelRequest of(RequestType type, String target, List<ProviderType> providers) {
        return new IntelRequest(type, target, null, null, providers, null);
    }

    public IntelRequest withOptions(RequestOptions newOptions) {
        return new IntelRequest(type, target, keywords, location, providers, newOptions);
    }
}
