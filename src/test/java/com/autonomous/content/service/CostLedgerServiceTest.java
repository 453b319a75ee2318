package com.autonomous.content.service;

import com.autonomous.content.model.AgentKind;
import com.autonomous.content.model.AgentUsage;
import com.autonomous.content.model.CostEntry;
import com.autonomous.content.model.ServiceCostSummary;
import com.autonomous.content.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CostLedgerServiceTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-10-30T12:00:00Z"));
    private final List<Object> events = new ArrayList<>();
    private CostLedgerService ledger;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        ledger = new CostLedgerService(clock, events::add);
        ledger.setDataPath(tempDir.toString());
        ledger.init();
    }

    @Test
    void shouldCalculateCostForSonnet() {
        // Sonnet: $3/M input, $15/M output
        assertEquals(new BigDecimal("0.1050"), ledger.calculateCost("claude-3-5-sonnet-20241022", 10000, 5000));
    }

    @Test
    void shouldCalculateCostForOpus() {
        assertEquals(new BigDecimal("0.5250"), ledger.calculateCost("claude-3-opus", 10000, 5000));
    }

    @Test
    void shouldCalculateCostForHaiku() {
        assertEquals(new BigDecimal("0.0088"), ledger.calculateCost("claude-3-haiku", 10000, 5000));
    }

    @Test
    void shouldPriceUnknownModelsAsSonnet() {
        assertEquals(ledger.calculateCost("sonnet", 1000, 1000), ledger.calculateCost("mystery-model", 1000, 1000));
    }

    @Test
    void shouldRejectNegativeAmounts() {
        CostEntry entry = CostEntry.builder().organizationId("org-1").amount(new BigDecimal("-0.01")).build();
        assertThrows(IllegalArgumentException.class, () -> ledger.record(entry));
        assertTrue(ledger.entries("org-1", ledger.currentMonth()).isEmpty());
    }

    @Test
    void shouldAssignBillingMonthAndScale() {
        CostEntry entry = record("org-1", "anthropic", "1.5");

        assertNotNull(entry.getId());
        assertEquals(YearMonth.of(2026, 10), entry.getBillingMonth());
        assertEquals(new BigDecimal("1.5000"), entry.getAmount());
        assertEquals(1, events.size());
        CostRecordedEvent event = (CostRecordedEvent) events.get(0);
        assertEquals("org-1", event.organizationId());
        assertEquals(new BigDecimal("1.5000"), event.amount());
    }

    @Test
    void shouldTrackMonthlyTotalPerOrganization() {
        record("org-1", "anthropic", "2.00");
        record("org-1", "openai", "3.25");
        record("org-2", "openai", "7.00");

        assertEquals(new BigDecimal("5.2500"), ledger.currentMonthTotal("org-1"));
        assertEquals(new BigDecimal("7.0000"), ledger.currentMonthTotal("org-2"));
        assertEquals(new BigDecimal("0.0000"), ledger.currentMonthTotal("org-3"));
    }

    @Test
    void shouldStartNewBillingMonthFromTheClock() {
        record("org-1", "anthropic", "4.00");
        clock.advance(Duration.ofDays(3));
        record("org-1", "anthropic", "1.00");

        assertEquals(YearMonth.of(2026, 11), ledger.currentMonth());
        assertEquals(new BigDecimal("1.0000"), ledger.currentMonthTotal("org-1"));
        assertEquals(new BigDecimal("4.0000"), ledger.monthlyTotal("org-1", YearMonth.of(2026, 10)));
    }

    @Test
    void shouldPriceTokenOnlyUsage() {
        CostEntry entry = ledger.recordUsage("org-1", "p-1", null, AgentKind.ARTICLE_GENERATION,
            new AgentUsage("anthropic", "claude-3-5-sonnet", 10000, 5000, null));

        assertEquals(new BigDecimal("0.1050"), entry.getAmount());
        assertEquals(AgentKind.ARTICLE_GENERATION, entry.getAgentKind());
        assertEquals(1, ledger.entriesForPipeline("org-1", "p-1").size());
    }

    @Test
    void shouldSummarizeByService() {
        record("org-1", "anthropic", "1.00");
        record("org-1", "anthropic", "3.00");
        record("org-1", "openai", "0.50");

        List<ServiceCostSummary> summary = ledger.summaryByService("org-1", ledger.currentMonth());

        assertEquals(2, summary.size());
        ServiceCostSummary anthropic = summary.get(0);
        assertEquals("anthropic", anthropic.service());
        assertEquals(2, anthropic.entryCount());
        assertEquals(new BigDecimal("4.0000"), anthropic.totalCost());
        assertEquals(new BigDecimal("3.0000"), anthropic.maxCost());
        assertEquals(new BigDecimal("1.0000"), anthropic.minCost());
        assertEquals("openai", summary.get(1).service());
    }

    @Test
    void shouldReloadEntriesFromDisk() {
        record("org-1", "anthropic", "2.00");
        record("org-1", "openai", "1.00");

        CostLedgerService reloaded = new CostLedgerService(clock, events::add);
        reloaded.setDataPath(tempDir.toString());
        reloaded.init();

        assertEquals(new BigDecimal("3.0000"), reloaded.currentMonthTotal("org-1"));
        assertEquals(2, reloaded.entries("org-1", YearMonth.of(2026, 10)).size());
    }

    private CostEntry record(String organizationId, String service, String amount) {
        return ledger.record(CostEntry.builder()
            .organizationId(organizationId)
            .service(service)
            .amount(new BigDecimal(amount))
            .build());
    }
}
