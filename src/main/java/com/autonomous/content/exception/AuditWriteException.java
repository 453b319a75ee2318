package com.autonomous.content.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * An audit entry could not be persisted. The triggering operation has already taken effect, so
 * this is a consistency violation to surface, never to retry silently.
 */
public class AuditWriteException extends ErrorResponseException {

    public AuditWriteException(String action, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, createProblem(action), cause);
    }

    private static ProblemDetail createProblem(String action) {
        var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
        problem.setTitle("Audit write failed");
        problem.setDetail("Failed to record audit entry for " + action);
        return problem;
    }
}
