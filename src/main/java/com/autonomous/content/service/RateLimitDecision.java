package com.autonomous.content.service;

import java.time.Instant;

public record RateLimitDecision(boolean allowed, int requestCount, int maxRequests, Instant windowStart, Instant windowEnd) {}
