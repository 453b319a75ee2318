package com.autonomous.content.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitWindow {
    private String organizationId;
    private String endpoint;
    private String method;
    private int requestsCount;
    private int maxRequests;
    private Instant periodStart;
    private Instant periodEnd;

    public boolean isExpired(Instant now) {
        return !now.isBefore(periodEnd);
    }
}
