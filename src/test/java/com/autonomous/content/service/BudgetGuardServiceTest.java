package com.autonomous.content.service;

import com.autonomous.content.model.AdmissionDecision;
import com.autonomous.content.model.AuditEntry;
import com.autonomous.content.model.AuditFilter;
import com.autonomous.content.model.NotificationEvent;
import com.autonomous.content.model.RejectionReason;
import com.autonomous.content.model.SpendSummary;
import com.autonomous.content.support.RecordingNotifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Instant;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BudgetGuardServiceTest {

    @TempDir
    Path tempDir;

    private ServiceFixture fixture;
    private BudgetGuardService budgetGuard;

    @BeforeEach
    void setUp() {
        fixture = new ServiceFixture(tempDir);
        budgetGuard = fixture.budgetGuard;
    }

    @Test
    void shouldAdmitAndConsumeQuota() {
        fixture.createOrganization("acme", "100.00", 10, "alice");

        AdmissionDecision decision = budgetGuard.admit("acme", "alice");

        assertTrue(decision.allowed());
        assertFalse(decision.alert());
        assertEquals(1, fixture.organizations.get("acme").getArticlesUsed());
        assertEquals(1, fixture.auditLog.query("acme", AuditFilter.forAction("budget.article_admitted")).size());
    }

    @Test
    void shouldAlertButAdmitAboveThreshold() {
        fixture.createOrganization("acme", "100.00", 10, "alice");
        fixture.spend("acme", "95.00");

        AdmissionDecision decision = budgetGuard.admit("acme", "alice");

        assertTrue(decision.allowed());
        assertTrue(decision.alert());
        List<AuditEntry> alerts = fixture.auditLog.query("acme", AuditFilter.forAction("budget.threshold_alert"));
        assertEquals(1, alerts.size());
        assertEquals(0, new BigDecimal("95.00").compareTo(new BigDecimal(alerts.get(0).getNewValues().get("percentage").toString())));
        List<RecordingNotifier.Sent> sent = fixture.notifier.sent(NotificationEvent.BUDGET_ALERT);
        assertEquals(1, sent.size());
        assertEquals("acme", sent.get(0).organizationId());
        assertEquals(80, sent.get(0).payload().get("threshold"));
    }

    @Test
    void shouldRejectWhenArticleQuotaUsedUp() {
        fixture.createOrganization("acme", "100.00", 2, "alice");
        budgetGuard.admit("acme", "alice");
        budgetGuard.admit("acme", "alice");

        AdmissionDecision decision = budgetGuard.admit("acme", "alice");

        assertFalse(decision.allowed());
        assertEquals(RejectionReason.ARTICLE_LIMIT_EXCEEDED, decision.reason());
        assertEquals(2, fixture.organizations.get("acme").getArticlesUsed());
        AuditEntry failure = fixture.auditLog.query("acme", AuditFilter.forAction("budget.article_limit_exceeded")).get(0);
        assertFalse(failure.isSuccess());
        assertEquals("alice", failure.getUserId());
        assertTrue(fixture.costLedger.entries("acme", YearMonth.of(2026, 10)).isEmpty());
    }

    @Test
    void shouldCheckQuotaBeforeBudget() {
        fixture.createOrganization("acme", "10.00", 1, "alice");
        budgetGuard.admit("acme", "alice");
        fixture.spend("acme", "12.00");

        assertEquals(RejectionReason.ARTICLE_LIMIT_EXCEEDED, budgetGuard.admit("acme", "alice").reason());
    }

    @Test
    void shouldRejectWhenBudgetExhausted() {
        fixture.createOrganization("acme", "100.00", 10, "alice");
        fixture.spend("acme", "100.00");

        AdmissionDecision decision = budgetGuard.admit("acme", "alice");

        assertFalse(decision.allowed());
        assertEquals(RejectionReason.BUDGET_EXCEEDED, decision.reason());
        assertEquals(0, fixture.organizations.get("acme").getArticlesUsed());
        assertEquals(1, fixture.auditLog.query("acme", AuditFilter.forAction("budget.monthly_limit_exceeded")).size());
    }

    @Test
    void shouldResetQuotaAndSpendForNewMonth() {
        fixture.createOrganization("acme", "100.00", 1, "alice");
        budgetGuard.admit("acme", "alice");
        fixture.spend("acme", "100.00");
        assertFalse(budgetGuard.admit("acme", "alice").allowed());

        fixture.clock.set(Instant.parse("2026-11-01T00:00:00Z"));
        AdmissionDecision decision = budgetGuard.admit("acme", "alice");

        assertTrue(decision.allowed());
        assertEquals(0, decision.monthlySpend().signum());
        assertEquals(YearMonth.of(2026, 11), fixture.organizations.get("acme").getQuotaPeriod());
        assertEquals(1, fixture.organizations.get("acme").getArticlesUsed());
    }

    @Test
    void shouldNeverOveradmitUnderConcurrency() throws Exception {
        fixture.createOrganization("acme", "100.00", 5, "alice");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<AdmissionDecision>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 20; i++) {
                Callable<AdmissionDecision> call = () -> {
                    start.await();
                    return budgetGuard.admit("acme", "alice");
                };
                futures.add(pool.submit(call));
            }
            start.countDown();
            int allowed = 0;
            for (Future<AdmissionDecision> future : futures) {
                if (future.get(10, TimeUnit.SECONDS).allowed()) {
                    allowed++;
                }
            }
            assertEquals(5, allowed);
            assertEquals(5, fixture.organizations.get("acme").getArticlesUsed());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shouldStopRunWhenBudgetReachedMidRun() {
        fixture.createOrganization("acme", "100.00", 10, "alice");
        fixture.spend("acme", "100.00");

        AdmissionDecision decision = budgetGuard.checkContinuation("acme", new BigDecimal("1.00"));

        assertEquals(RejectionReason.BUDGET_EXCEEDED_MID_RUN, decision.reason());
        assertEquals(0, fixture.organizations.get("acme").getArticlesUsed());
    }

    @Test
    void shouldStopRunAtPerArticleLimit() {
        fixture.createOrganization("acme", "100.00", 10, "alice");

        assertTrue(budgetGuard.checkContinuation("acme", new BigDecimal("4.99")).allowed());
        AdmissionDecision decision = budgetGuard.checkContinuation("acme", new BigDecimal("5.00"));

        assertEquals(RejectionReason.ARTICLE_COST_LIMIT_EXCEEDED, decision.reason());
    }

    @Test
    void shouldKeepCachedSpendEqualToLedger() {
        fixture.createOrganization("acme", "100.00", 10, "alice");
        fixture.spend("acme", "1.25");
        fixture.spend("acme", "2.50");

        BigDecimal cached = fixture.organizations.get("acme").getCurrentMonthSpend();
        assertEquals(0, fixture.costLedger.currentMonthTotal("acme").compareTo(cached));
        assertEquals(0, new BigDecimal("3.75").compareTo(cached));
    }

    @Test
    void shouldSummarizeMonthlySpend() {
        fixture.createOrganization("acme", "200.00", 10, "alice");
        fixture.spend("acme", "50.00");

        SpendSummary summary = budgetGuard.monthlySpend("acme");

        assertEquals(YearMonth.of(2026, 10), summary.month());
        assertEquals(new BigDecimal("25.00"), summary.percentageOfBudget());
        assertFalse(summary.isOverAlertThreshold());
    }

    @Test
    void shouldTreatZeroBudgetAsExhausted() {
        assertEquals(new BigDecimal("0.00"), BudgetGuardService.percentage(BigDecimal.ZERO, BigDecimal.ZERO));
        assertEquals(new BigDecimal("100.00"), BudgetGuardService.percentage(BigDecimal.ONE, BigDecimal.ZERO));
    }
}
