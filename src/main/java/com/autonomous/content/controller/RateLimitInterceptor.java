package com.autonomous.content.controller;

import com.autonomous.content.exception.RateLimitExceededException;
import com.autonomous.content.model.PipelineSnapshot;
import com.autonomous.content.pipeline.PipelineStore;
import com.autonomous.content.service.RateLimitDecision;
import com.autonomous.content.service.RateLimiterService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

import java.util.Map;

/**
 * Counts every API request against the organization it targets and rejects it with 429 once the
 * organization's window is full. The organization comes from the {@code {orgId}} path variable,
 * or from the owning organization of a {@code /api/pipelines/{id}} route. Routes that name no
 * organization fall back to the {@code X-Organization-Id} header.
 */
@Component
public class RateLimitInterceptor implements HandlerInterceptor {

    static final String ORGANIZATION_HEADER = "X-Organization-Id";

    private static final String PIPELINE_ROUTE_PREFIX = "/api/pipelines/";

    private final RateLimiterService rateLimiter;
    private final PipelineStore pipelines;

    public RateLimitInterceptor(RateLimiterService rateLimiter, PipelineStore pipelines) {
        this.rateLimiter = rateLimiter;
        this.pipelines = pipelines;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        // Count per route, not per concrete URI.
        Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        String endpoint = pattern != null ? pattern.toString() : request.getRequestURI();
        String organizationId = resolveOrganization(request, endpoint);
        if (organizationId == null || organizationId.isBlank()) {
            return true;
        }
        RateLimitDecision decision = rateLimiter.checkAndIncrement(organizationId, endpoint, request.getMethod());
        response.setHeader("X-RateLimit-Limit", String.valueOf(decision.maxRequests()));
        response.setHeader("X-RateLimit-Remaining",
            String.valueOf(Math.max(0, decision.maxRequests() - decision.requestCount())));
        if (!decision.allowed()) {
            throw new RateLimitExceededException(decision);
        }
        return true;
    }

    private String resolveOrganization(HttpServletRequest request, String endpoint) {
        Map<String, String> variables = uriVariables(request);
        String organizationId = variables.get("orgId");
        if (organizationId != null) {
            return organizationId;
        }
        String pipelineId = variables.get("id");
        if (pipelineId != null && endpoint.startsWith(PIPELINE_ROUTE_PREFIX)) {
            // Unknown pipelines are left to the controller's 404.
            return pipelines.find(pipelineId).map(PipelineSnapshot::organizationId).orElse(null);
        }
        return request.getHeader(ORGANIZATION_HEADER);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, String> uriVariables(HttpServletRequest request) {
        Object variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        return variables instanceof Map ? (Map<String, String>) variables : Map.of();
    }
}
