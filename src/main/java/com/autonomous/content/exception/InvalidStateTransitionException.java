package com.autonomous.content.exception;

import com.autonomous.content.model.PipelineStatus;
import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a pipeline is asked to move along an edge its state machine does not have, e.g.
 * resuming a pipeline that already completed.
 */
@Getter
public class InvalidStateTransitionException extends ErrorResponseException {

    private final PipelineStatus from;
    private final PipelineStatus to;

    public InvalidStateTransitionException(String pipelineId, PipelineStatus from, PipelineStatus to) {
        super(HttpStatus.CONFLICT, createProblem(pipelineId, from, to), null);
        this.from = from;
        this.to = to;
    }

    private static ProblemDetail createProblem(String pipelineId, PipelineStatus from, PipelineStatus to) {
        var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
        problem.setTitle("Invalid pipeline state transition");
        problem.setDetail(String.format("Pipeline %s cannot move from %s to %s",
            pipelineId, from.toValue(), to.toValue()));
        problem.setProperty("from", from.toValue());
        problem.setProperty("to", to.toValue());
        return problem;
    }
}
