package com.intelplatform.common.model;

import com.intelplatform.common.exception.InvalidIntelRequestException;

import java.util.ArrayList;
import java.util.List;

/**
 * Request validation and fingerprinting.
 */
public final class IntelRequests {

    static final String DEFAULT_COUNTRY  = "global";
    static final String DEFAULT_LANGUAGE = "en";

    private IntelRequests() {}

    /**
     * Rejects a request that lacks type, target or provider types.
     *
     * @throws InvalidIntelRequestException listing every missing field
     */
    public static IntelRequest validate(IntelRequest request) {
        if (request == null) {
            throw new InvalidIntelRequestException("Request body is required");
        }
        List<String> missing = new ArrayList<>();
        if (request.type() == null) missing.add("type");
        if (request.target() == null || request.target().isBlank()) missing.add("target");
        if (request.providers() == null || request.providers().isEmpty()) missing.add("providers");
        if (!missing.isEmpty()) {
            throw new InvalidIntelRequestException("Missing required fields: " + String.join(", ", missing));
        }
        return request;
    }

    /**
     * Stable cache key: {@code type:target:sorted(providers):country:language}.
     *
     * <p>Provider order never changes the key. The country falls back to the request
     * location, then to {@value DEFAULT_COUNTRY}; language defaults to {@value DEFAULT_LANGUAGE}.
     */
    public static String fingerprint(IntelRequest request) {
        String providers = request.providers() == null || request.providers().isEmpty()
            ? "all"
            : String.join(",", request.providers().stream()
                .map(ProviderType::wireName)
                .sorted()
                .toList());

        RequestOptions options = request.options();
        String country = firstNonBlank(options.country(), request.location(), DEFAULT_COUNTRY);
        String language = firstNonBlank(options.language(), null, DEFAULT_LANGUAGE);

        return String.join(":",
            request.type().wireName(),
            request.target(),
            providers,
            country,
            language);
    }

    private static String firstNonBlank(String first, String second, String fallback) {
        if (first != null && !first.isBlank()) return first;
        if (second != null && !second.isBlank()) return second;
        return fallback;
    }
}
