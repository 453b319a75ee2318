package com.autonomous.content.pipeline;

/**
 * Queue entry for the worker pool. Higher priority runs first; equal priorities run in
 * submission order.
 */
final class PipelineTask implements Runnable, Comparable<PipelineTask> {

    private final String pipelineId;
    private final int priority;
    private final long sequence;
    private final PipelineOrchestrator orchestrator;

    PipelineTask(String pipelineId, int priority, long sequence, PipelineOrchestrator orchestrator) {
        this.pipelineId = pipelineId;
        this.priority = priority;
        this.sequence = sequence;
        this.orchestrator = orchestrator;
    }

    String getPipelineId() {
        return pipelineId;
    }

    @Override
    public void run() {
        orchestrator.runPipeline(pipelineId);
    }

    @Override
    public int compareTo(PipelineTask other) {
        int byPriority = Integer.compare(other.priority, priority);
        return byPriority != 0 ? byPriority : Long.compare(sequence, other.sequence);
    }
}
