package com.autonomous.content.exception;

import com.autonomous.content.service.RateLimitDecision;
import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

@Getter
public class RateLimitExceededException extends ErrorResponseException {

    private final RateLimitDecision decision;

    public RateLimitExceededException(RateLimitDecision decision) {
        super(HttpStatus.TOO_MANY_REQUESTS, createProblem(decision), null);
        this.decision = decision;
    }

    private static ProblemDetail createProblem(RateLimitDecision decision) {
        var problem = ProblemDetail.forStatus(HttpStatus.TOO_MANY_REQUESTS);
        problem.setTitle("Rate limit exceeded");
        problem.setDetail(String.format("%d/%d requests in the current window",
            decision.requestCount(), decision.maxRequests()));
        problem.setProperty("reason", "rate_limited");
        problem.setProperty("windowEnd", decision.windowEnd().toString());
        return problem;
    }
}
