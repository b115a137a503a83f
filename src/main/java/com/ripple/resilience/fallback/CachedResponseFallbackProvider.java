package com.ripple.resilience.fallback;

import com.ripple.resilience.model.DependencyRequest;
import com.ripple.resilience.model.DependencyResponse;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Serves the last successful response seen for the same read request.
 *
 * <p>Only 2xx responses to GET/HEAD requests are remembered. Entries expire after
 * {@code ttl}. Each write that takes the cache past {@code maxEntries} drops expired
 * entries, then the oldest ones, so the bound holds once concurrent writers finish.
 */
@Slf4j
public class CachedResponseFallbackProvider implements FallbackProvider {

    public static final String NAME = "cache";
    public static final Duration DEFAULT_TTL = Duration.ofHours(1);
    public static final int DEFAULT_MAX_ENTRIES = 1000;

    private final Duration ttl;
    private final int maxEntries;
    private final Clock clock;
    private final Map<String, CachedResponse> entries = new ConcurrentHashMap<>();

    public CachedResponseFallbackProvider(Duration ttl, int maxEntries, Clock clock) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be at least 1");
        }
        this.ttl = ttl;
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<DependencyResponse> attempt(FallbackContext context) {
        DependencyRequest request = context.getRequest();
        if (request == null || !request.isIdempotentRead()) {
            return Optional.empty();
        }
        String key = keyOf(request);
        CachedResponse cached = entries.get(key);
        if (cached == null) {
            return Optional.empty();
        }
        if (isExpired(cached, clock.instant())) {
            entries.remove(key, cached);
            return Optional.empty();
        }
        log.info("Using cached response for {} {}", context.getDependency(), key);
        return Optional.of(cached.response);
    }

    @Override
    public void onSuccess(DependencyRequest request, DependencyResponse response) {
        if (!request.isIdempotentRead() || !response.isSuccessful()) {
            return;
        }
        String key = keyOf(request);
        Instant now = clock.instant();
        entries.put(key, new CachedResponse(response, now));
        if (entries.size() > maxEntries) {
            evict(key, now);
        }
    }

    public int size() {
        return entries.size();
    }

    private void evict(String justWritten, Instant now) {
        entries.entrySet().removeIf(e -> isExpired(e.getValue(), now));
        while (entries.size() > maxEntries) {
            Optional<Map.Entry<String, CachedResponse>> oldest = entries.entrySet().stream()
                .filter(e -> !e.getKey().equals(justWritten))
                .min(Comparator.comparing(e -> e.getValue().storedAt));
            if (oldest.isEmpty()) {
                return;
            }
            entries.remove(oldest.get().getKey(), oldest.get().getValue());
        }
    }

    private boolean isExpired(CachedResponse cached, Instant now) {
        return !cached.storedAt.plus(ttl).isAfter(now);
    }

    static String keyOf(DependencyRequest request) {
        StringBuilder key = new StringBuilder(request.getMethod().toUpperCase(Locale.ROOT)).append(' ').append(request.getPath());
        // sorted so that parameter order does not split the cache
        Map<String, String> params = new TreeMap<>(request.getQueryParams());
        if (!params.isEmpty()) {
            key.append('?');
            params.forEach((name, value) -> key.append(name).append('=').append(value).append('&'));
            key.setLength(key.length() - 1);
        }
        return key.toString();
    }

    private static final class CachedResponse {
        private final DependencyResponse response;
        private final Instant storedAt;

        private CachedResponse(DependencyResponse response, Instant storedAt) {
            this.response = response;
            this.storedAt = storedAt;
        }
    }
}
