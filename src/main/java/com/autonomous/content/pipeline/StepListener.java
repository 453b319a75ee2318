package com.autonomous.content.pipeline;

import com.autonomous.content.model.AgentKind;
import com.autonomous.content.model.AgentResult;

/**
 * Callbacks from {@link AgentStepExecutor} into the pipeline that owns the step.
 */
interface StepListener {

    /** Called once per finished attempt with a billable usage, including attempts that completed after their timeout. */
    void onBilled(AgentKind agentKind, AgentResult result);

    boolean isCancelled();
}
