package com.autonomous.content.pipeline;

import com.autonomous.content.model.AgentKind;
import com.autonomous.content.model.PipelineLogEntry;
import com.autonomous.content.model.PipelineLogLevel;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded, in-memory execution log per pipeline. Each pipeline keeps its most recent
 * {@code maxEntries} lines; older lines are dropped first.
 */
@Component
public class PipelineLogService {

    private static final Logger log = LoggerFactory.getLogger(PipelineLogService.class);

    private final Clock clock;
    private final int maxEntries;
    private final Cache<String, Deque<PipelineLogEntry>> logs;

    @Autowired
    public PipelineLogService(Clock clock, @Value("${pipeline.logs.max-entries:1000}") int maxEntries) {
        this.clock = clock;
        this.maxEntries = maxEntries;
        this.logs = Caffeine.newBuilder()
            .expireAfterAccess(Duration.ofDays(7))
            .maximumSize(10_000)
            .build();
    }

    public void append(String pipelineId, PipelineLogLevel level, AgentKind agent, String message) {
        append(pipelineId, level, agent, message, Map.of());
    }

    public void append(String pipelineId, PipelineLogLevel level, AgentKind agent, String message,
                       Map<String, Object> data) {
        PipelineLogEntry entry = new PipelineLogEntry(clock.instant(), level, agent, message,
            data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data)));
        Deque<PipelineLogEntry> entries = logs.get(pipelineId, id -> new ArrayDeque<>());
        synchronized (entries) {
            entries.addLast(entry);
            while (entries.size() > maxEntries) {
                entries.removeFirst();
            }
        }
        log.debug("[{}] {} {}", pipelineId, agent == null ? "pipeline" : agent.getWireName(), message);
    }

    /**
     * @param limit how many of the most recent lines to return; zero or less returns all
     */
    public List<PipelineLogEntry> entries(String pipelineId, int limit) {
        Deque<PipelineLogEntry> entries = logs.getIfPresent(pipelineId);
        if (entries == null) {
            return List.of();
        }
        List<PipelineLogEntry> copy;
        synchronized (entries) {
            copy = new ArrayList<>(entries);
        }
        if (limit > 0 && copy.size() > limit) {
            copy = copy.subList(copy.size() - limit, copy.size());
        }
        return List.copyOf(copy);
    }

    public void clear(String pipelineId) {
        logs.invalidate(pipelineId);
    }
}
