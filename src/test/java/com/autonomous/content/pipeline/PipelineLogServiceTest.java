package com.autonomous.content.pipeline;

import com.autonomous.content.model.AgentKind;
import com.autonomous.content.model.PipelineLogEntry;
import com.autonomous.content.model.PipelineLogLevel;
import com.autonomous.content.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PipelineLogServiceTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-10-15T10:00:00Z"));
    private final PipelineLogService logs = new PipelineLogService(clock, 3);

    @Test
    void shouldKeepOnlyMostRecentEntries() {
        for (int i = 1; i <= 5; i++) {
            logs.append("p-1", PipelineLogLevel.INFO, null, "line " + i);
            clock.advance(Duration.ofSeconds(1));
        }

        List<PipelineLogEntry> entries = logs.entries("p-1", 0);

        assertEquals(List.of("line 3", "line 4", "line 5"), entries.stream().map(PipelineLogEntry::message).toList());
        assertEquals(Instant.parse("2026-10-15T10:00:02Z"), entries.get(0).timestamp());
    }

    @Test
    void shouldReturnTailWhenLimited() {
        logs.append("p-1", PipelineLogLevel.INFO, AgentKind.PUBLISH, "starting");
        logs.append("p-1", PipelineLogLevel.METRIC, AgentKind.PUBLISH, "billed", Map.of("amount", "0.10"));

        List<PipelineLogEntry> tail = logs.entries("p-1", 1);

        assertEquals(1, tail.size());
        assertEquals(PipelineLogLevel.METRIC, tail.get(0).level());
        assertEquals("0.10", tail.get(0).data().get("amount"));
    }

    @Test
    void shouldSeparatePipelinesAndClear() {
        logs.append("p-1", PipelineLogLevel.INFO, null, "one");
        logs.append("p-2", PipelineLogLevel.ERROR, null, "two");

        logs.clear("p-1");

        assertTrue(logs.entries("p-1", 0).isEmpty());
        assertEquals("two", logs.entries("p-2", 0).get(0).message());
        assertTrue(logs.entries("unknown", 0).isEmpty());
    }

    @Test
    void shouldAcceptMissingDetailValues() {
        Map<String, Object> data = new HashMap<>();
        data.put("articleId", null);

        logs.append("p-1", PipelineLogLevel.WARNING, null, "no article yet", data);

        assertTrue(logs.entries("p-1", 0).get(0).data().containsKey("articleId"));
    }
}
