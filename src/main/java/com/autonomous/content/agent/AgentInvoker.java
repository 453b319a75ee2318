package com.autonomous.content.agent;

import com.autonomous.content.model.AgentInvocation;
import com.autonomous.content.model.AgentResult;

/**
 * Calls one agent. Implementations report failures through {@link AgentResult#failure} and
 * always return a usage, even a zero one.
 */
public interface AgentInvoker {

    AgentResult invoke(AgentInvocation invocation);
}
