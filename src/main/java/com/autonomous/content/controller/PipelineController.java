package com.autonomous.content.controller;

import com.autonomous.content.model.ArticleRequest;
import com.autonomous.content.model.PipelineLogEntry;
import com.autonomous.content.model.PipelineSnapshot;
import com.autonomous.content.pipeline.PipelineCreationResult;
import com.autonomous.content.pipeline.PipelineOrchestrator;
import com.autonomous.content.pipeline.PipelineStats;
import com.autonomous.content.service.AuditLogService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class PipelineController {

    private static final String USER_HEADER = OrganizationController.USER_HEADER;

    private final PipelineOrchestrator orchestrator;
    private final AuditLogService auditLog;

    public PipelineController(PipelineOrchestrator orchestrator, AuditLogService auditLog) {
        this.orchestrator = orchestrator;
        this.auditLog = auditLog;
    }

    /**
     * 202 when the pipeline was queued, 422 when admission rejected it. Both carry the pipeline.
     */
    @PostMapping("/organizations/{orgId}/pipelines")
    public ResponseEntity<PipelineCreationResult> create(@RequestHeader(USER_HEADER) String userId,
                                                         @PathVariable String orgId,
                                                         @RequestBody ArticleRequest request) {
        PipelineCreationResult result = orchestrator.createPipeline(orgId, userId, request);
        HttpStatus status = result.accepted() ? HttpStatus.ACCEPTED : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(result);
    }

    @GetMapping("/organizations/{orgId}/pipelines")
    public List<PipelineSnapshot> list(@RequestHeader(USER_HEADER) String userId, @PathVariable String orgId) {
        return orchestrator.listPipelines(orgId, userId);
    }

    @GetMapping("/organizations/{orgId}/pipelines/stats")
    public PipelineStats stats(@RequestHeader(USER_HEADER) String userId, @PathVariable String orgId) {
        return orchestrator.stats(orgId, userId);
    }

    @GetMapping("/pipelines/{id}")
    public PipelineSnapshot get(@RequestHeader(USER_HEADER) String userId, @PathVariable String id) {
        return orchestrator.getPipeline(id, userId);
    }

    @GetMapping("/pipelines/{id}/logs")
    public List<PipelineLogEntry> logs(@RequestHeader(USER_HEADER) String userId, @PathVariable String id,
                                       @RequestParam(defaultValue = "0") int limit) {
        return orchestrator.getLogs(id, userId, limit);
    }

    @PostMapping("/pipelines/{id}/cancel")
    public PipelineSnapshot cancel(@RequestHeader(USER_HEADER) String userId, @PathVariable String id) {
        return orchestrator.cancel(id, userId);
    }

    @PostMapping("/pipelines/{id}/pause")
    public PipelineSnapshot pause(@RequestHeader(USER_HEADER) String userId, @PathVariable String id) {
        return orchestrator.pause(id, userId);
    }

    @PostMapping("/pipelines/{id}/resume")
    public PipelineSnapshot resume(@RequestHeader(USER_HEADER) String userId, @PathVariable String id) {
        return orchestrator.resume(id, userId);
    }

    @DeleteMapping("/pipelines/{id}")
    public ResponseEntity<Void> delete(@RequestHeader(USER_HEADER) String userId, @PathVariable String id) {
        orchestrator.deletePipeline(id, userId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        long auditFailures = auditLog.getFailedWriteCount();
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", auditFailures == 0 ? "healthy" : "degraded");
        health.put("auditWriteFailures", auditFailures);
        health.put("queueDepth", orchestrator.queueDepth());
        health.put("activeWorkers", orchestrator.activeWorkers());
        return ResponseEntity.ok(health);
    }
}
