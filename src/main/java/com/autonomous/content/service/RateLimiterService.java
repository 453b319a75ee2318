package com.autonomous.content.service;

import com.autonomous.content.model.RateLimitWindow;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Fixed-window request counter. Windows are aligned to multiples of their length and roll over
 * lazily: the first request after {@code periodEnd} opens a fresh window.
 */
@Service
public class RateLimiterService {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterService.class);

    private final int defaultMaxRequests;
    private final Duration defaultWindow;
    private final Clock clock;
    private final AuditLogService auditLog;
    private final Cache<String, RateLimitWindow> windows;

    @Autowired
    public RateLimiterService(
            @Value("${rate-limit.max-requests:100}") int defaultMaxRequests,
            @Value("${rate-limit.window:PT1H}") Duration defaultWindow,
            Clock clock,
            AuditLogService auditLog) {
        this.defaultMaxRequests = defaultMaxRequests;
        this.defaultWindow = defaultWindow;
        this.clock = clock;
        this.auditLog = auditLog;
        // Expiry only bounds memory; rollover is decided from the window bounds.
        this.windows = Caffeine.newBuilder()
            .expireAfterAccess(Duration.ofDays(2))
            .maximumSize(100_000)
            .build();
    }

    public RateLimitDecision checkAndIncrement(String organizationId, String endpoint, String method) {
        return checkAndIncrement(organizationId, endpoint, method, defaultMaxRequests, defaultWindow);
    }

    public RateLimitDecision checkAndIncrement(String organizationId, String endpoint, String method,
                                               int maxRequests, Duration window) {
        RateLimitDecision result = increment(organizationId, endpoint, method, maxRequests, window, clock.instant());
        if (!result.allowed()) {
            recordRejection(organizationId, endpoint, method, result);
        }
        return result;
    }

    /**
     * Checks several windows for the same key and counts the request in all of them only when
     * every window has room. A rejected request leaves every window unchanged.
     *
     * @return the first rejecting window's decision, or the first window's decision when allowed
     */
    public synchronized RateLimitDecision checkAndIncrementAll(String organizationId, String endpoint, String method,
                                                               List<WindowLimit> limits) {
        if (limits.isEmpty()) {
            throw new IllegalArgumentException("At least one window limit is required");
        }
        Instant now = clock.instant();
        for (WindowLimit limit : limits) {
            RateLimitWindow active = windows.getIfPresent(key(organizationId, endpoint, method, limit.window()));
            int count = active == null || active.isExpired(now) ? 0 : active.getRequestsCount();
            if (count >= limit.maxRequests()) {
                Instant start = active == null || active.isExpired(now)
                    ? alignedStart(now, limit.window())
                    : active.getPeriodStart();
                RateLimitDecision rejected = new RateLimitDecision(false, count + 1, limit.maxRequests(),
                    start, start.plus(limit.window()));
                recordRejection(organizationId, endpoint, method, rejected);
                return rejected;
            }
        }
        RateLimitDecision first = null;
        for (WindowLimit limit : limits) {
            RateLimitDecision decision = increment(organizationId, endpoint, method,
                limit.maxRequests(), limit.window(), now);
            if (first == null) {
                first = decision;
            }
        }
        return first;
    }

    private RateLimitDecision increment(String organizationId, String endpoint, String method,
                                        int maxRequests, Duration window, Instant now) {
        String key = key(organizationId, endpoint, method, window);
        RateLimitDecision[] decision = new RateLimitDecision[1];

        windows.asMap().compute(key, (k, current) -> {
            RateLimitWindow active = current;
            if (active == null || active.isExpired(now)) {
                Instant start = alignedStart(now, window);
                active = new RateLimitWindow(organizationId, endpoint, method, 0, maxRequests, start, start.plus(window));
            }
            active.setMaxRequests(maxRequests);
            active.setRequestsCount(active.getRequestsCount() + 1);
            decision[0] = new RateLimitDecision(
                active.getRequestsCount() <= maxRequests,
                active.getRequestsCount(),
                maxRequests,
                active.getPeriodStart(),
                active.getPeriodEnd());
            return active;
        });
        return decision[0];
    }

    private void recordRejection(String organizationId, String endpoint, String method, RateLimitDecision result) {
        log.warn("Rate limit exceeded: org={}, {} {}, {}/{}",
            organizationId, method, endpoint, result.requestCount(), result.maxRequests());
        auditLog.recordFailure(organizationId, null, "rate_limit.exceeded", "api_endpoint", endpoint,
            String.format("Rate limit exceeded for %s %s: %d/%d",
                method, endpoint, result.requestCount(), result.maxRequests()));
    }

    public Optional<RateLimitWindow> currentWindow(String organizationId, String endpoint, String method) {
        return Optional.ofNullable(windows.getIfPresent(key(organizationId, endpoint, method, defaultWindow)))
            .filter(window -> !window.isExpired(clock.instant()));
    }

    private static Instant alignedStart(Instant now, Duration window) {
        long windowSeconds = Math.max(1, window.getSeconds());
        long epochSecond = now.getEpochSecond();
        return Instant.ofEpochSecond(epochSecond - Math.floorMod(epochSecond, windowSeconds));
    }

    private static String key(String organizationId, String endpoint, String method, Duration window) {
        return organizationId + "|" + endpoint + "|" + method + "|" + window.getSeconds();
    }
}
