package com.intelplatform.orchestrator.cache;

import com.intelplatform.common.model.NormalizedResult;
import com.intelplatform.common.model.ProviderType;
import com.intelplatform.common.model.RequestType;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

/**
 * One cached result. {@code expiresAt} is fixed at write time; only {@code lastAccessed}
 * moves, and only on a hit.
 */
@Getter
@AllArgsConstructor
public class CacheEntry {

    private final NormalizedResult result;
    private final Instant createdAt;
    private final Instant expiresAt;
    private volatile Instant lastAccessed;
    private final RequestType requestType;
    private final String target;
    private final List<ProviderType> providers;

    boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }

    void touch(Instant now) {
        lastAccessed = now;
    }
}
