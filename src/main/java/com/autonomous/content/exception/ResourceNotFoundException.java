package com.autonomous.content.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class ResourceNotFoundException extends ErrorResponseException {

    public ResourceNotFoundException(String resourceType, Object id) {
        super(HttpStatus.NOT_FOUND, createProblem(
            resourceType + " not found",
            "No " + resourceType.toLowerCase() + " found with id " + id), null);
    }

    private static ProblemDetail createProblem(String title, String detail) {
        var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
        problem.setTitle(title);
        problem.setDetail(detail);
        return problem;
    }
}
