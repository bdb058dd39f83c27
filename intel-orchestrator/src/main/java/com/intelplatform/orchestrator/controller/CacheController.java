package com.intelplatform.orchestrator.controller;

import com.intelplatform.common.exception.InvalidIntelRequestException;
import com.intelplatform.common.model.RequestType;
import com.intelplatform.orchestrator.cache.CacheStats;
import com.intelplatform.orchestrator.cache.IntelCache;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/intel/cache")
public class CacheController {

    private final IntelCache cache;

    public CacheController(IntelCache cache) {
        this.cache = cache;
    }

    @GetMapping("/stats")
    public Mono<CacheStats> stats() {
        return Mono.just(cache.getStats());
    }

    /** Invalidates one target's entries, optionally for a single request type, or everything when no target is given. */
    @DeleteMapping
    public Mono<Map<String, Object>> invalidate(@RequestParam(required = false) String target,
                                                @RequestParam(required = false) String type) {
        if (target == null || target.isBlank()) {
            int size = cache.getStats().size();
            cache.clear();
            return Mono.just(Map.<String, Object>of("removed", size));
        }
        RequestType requestType;
        try {
            requestType = type == null || type.isBlank() ? null : RequestType.fromWire(type);
        } catch (IllegalArgumentException e) {
            throw new InvalidIntelRequestException(e.getMessage());
        }
        return Mono.just(Map.<String, Object>of("removed", cache.invalidate(target, requestType)));
    }
}
