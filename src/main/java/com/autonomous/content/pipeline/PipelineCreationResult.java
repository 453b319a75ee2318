package com.autonomous.content.pipeline;

import com.autonomous.content.model.PipelineSnapshot;
import com.autonomous.content.model.RejectionReason;

/**
 * Answer to a pipeline request. Rejected pipelines still exist, in {@code failed} status.
 */
public record PipelineCreationResult(
    PipelineSnapshot pipeline,
    boolean accepted,
    RejectionReason reason,
    String message,
    boolean budgetAlert) {

    static PipelineCreationResult accepted(PipelineSnapshot pipeline, boolean budgetAlert) {
        return new PipelineCreationResult(pipeline, true, null, null, budgetAlert);
    }

    static PipelineCreationResult rejected(PipelineSnapshot pipeline, RejectionReason reason, String message) {
        return new PipelineCreationResult(pipeline, false, reason, message, false);
    }
}
