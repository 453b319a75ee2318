package com.autonomous.content.model;

/**
 * Result of one agent call. Always carries a usage, even when the call failed part way.
 *
 * @param articleId set by the article generation agent once the article exists
 */
public record AgentResult(boolean success, String output, String articleId, AgentUsage usage, String error) {

    public static AgentResult success(String output, AgentUsage usage) {
        return new AgentResult(true, output, null, usage, null);
    }

    public static AgentResult article(String output, String articleId, AgentUsage usage) {
        return new AgentResult(true, output, articleId, usage, null);
    }

    public static AgentResult failure(String error, AgentUsage usage) {
        return new AgentResult(false, null, null, usage, error);
    }
}
