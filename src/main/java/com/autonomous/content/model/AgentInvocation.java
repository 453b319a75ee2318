package com.autonomous.content.model;

import java.time.Duration;
import java.util.Map;

public record AgentInvocation(
    AgentKind agentKind,
    String organizationId,
    String pipelineId,
    int attempt,
    String model,
    Map<String, Object> payload,
    Duration timeout,
    CredentialHandle credential) {}
