package com.autonomous.content.service;

import com.autonomous.content.model.AdmissionDecision;
import com.autonomous.content.model.NotificationEvent;
import com.autonomous.content.model.Organization;
import com.autonomous.content.model.RejectionReason;
import com.autonomous.content.model.SpendSummary;
import com.autonomous.content.notification.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.YearMonth;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Admission control for new articles. Spend always comes from the cost ledger; the organization's
 * {@code currentMonthSpend} is only a cached copy kept fresh for display.
 */
@Service
public class BudgetGuardService {

    private static final Logger log = LoggerFactory.getLogger(BudgetGuardService.class);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final OrganizationService organizations;
    private final CostLedgerService costLedger;
    private final AuditLogService auditLog;
    private final Notifier notifier;

    public BudgetGuardService(OrganizationService organizations, CostLedgerService costLedger,
                              AuditLogService auditLog, Notifier notifier) {
        this.organizations = organizations;
        this.costLedger = costLedger;
        this.auditLog = auditLog;
        this.notifier = notifier;
    }

    /**
     * Checks the article quota, then the monthly budget, then the alert threshold. An admitted
     * request consumes one article from the quota. Check and increment happen under the
     * organization's lock.
     */
    public AdmissionDecision admit(String organizationId, String userId) {
        AdmissionDecision decision = organizations.mutate(organizationId, org -> {
            YearMonth month = costLedger.currentMonth();
            if (!month.equals(org.getQuotaPeriod())) {
                log.info("Rolling article quota for organization {} to {}", organizationId, month);
                org.setQuotaPeriod(month);
                org.setArticlesUsed(0);
            }
            BigDecimal spend = costLedger.monthlyTotal(organizationId, month);
            org.setCurrentMonthSpend(spend);
            BigDecimal budget = org.getMonthlyBudget();

            if (org.getArticlesUsed() >= org.getArticlesLimit()) {
                String message = String.format("Monthly article limit reached (%d/%d)",
                    org.getArticlesUsed(), org.getArticlesLimit());
                auditLog.recordFailure(organizationId, userId, "budget.article_limit_exceeded",
                    "organization", organizationId, message);
                log.info("Rejected article for organization {}: {}", organizationId, message);
                return AdmissionDecision.reject(RejectionReason.ARTICLE_LIMIT_EXCEEDED, message, spend, budget);
            }

            if (spend.compareTo(budget) >= 0) {
                String message = String.format("Monthly budget exhausted (%s of %s)", spend, budget);
                auditLog.recordFailure(organizationId, userId, "budget.monthly_limit_exceeded",
                    "organization", organizationId, message);
                log.info("Rejected article for organization {}: {}", organizationId, message);
                return AdmissionDecision.reject(RejectionReason.BUDGET_EXCEEDED, message, spend, budget);
            }

            BigDecimal percentage = percentage(spend, budget);
            boolean alert = percentage.compareTo(BigDecimal.valueOf(org.getAlertThreshold())) >= 0;
            if (alert) {
                auditLog.recordEvent(organizationId, userId, "budget.threshold_alert",
                    "organization", organizationId, alertDetails(org, spend, percentage));
                log.warn("Organization {} at {}% of monthly budget (threshold {}%)",
                    organizationId, percentage, org.getAlertThreshold());
            }

            int usedBefore = org.getArticlesUsed();
            org.setArticlesUsed(usedBefore + 1);
            Map<String, Object> quota = new LinkedHashMap<>();
            quota.put("articlesUsed", org.getArticlesUsed());
            quota.put("articlesLimit", org.getArticlesLimit());
            quota.put("quotaPeriod", month.toString());
            auditLog.recordEvent(organizationId, userId, "budget.article_admitted",
                "organization", organizationId, quota);
            return AdmissionDecision.allow(alert, spend, budget);
        });

        if (decision.alert()) {
            Organization org = organizations.get(organizationId);
            notifier.notify(organizationId, NotificationEvent.BUDGET_ALERT,
                alertDetails(org, decision.monthlySpend(), percentage(decision.monthlySpend(), decision.monthlyBudget())));
        }
        return decision;
    }

    /**
     * Mid-run re-check before each step. Never consumes quota.
     *
     * @param pipelineTotal what the running pipeline has billed so far
     */
    public AdmissionDecision checkContinuation(String organizationId, BigDecimal pipelineTotal) {
        Organization org = organizations.get(organizationId);
        BigDecimal spend = costLedger.currentMonthTotal(organizationId);
        BigDecimal budget = org.getMonthlyBudget();

        if (spend.compareTo(budget) >= 0) {
            return AdmissionDecision.reject(RejectionReason.BUDGET_EXCEEDED_MID_RUN,
                String.format("Monthly budget exhausted during run (%s of %s)", spend, budget), spend, budget);
        }
        BigDecimal articleLimit = org.getPerArticleCostLimit();
        if (articleLimit != null && pipelineTotal != null && pipelineTotal.compareTo(articleLimit) >= 0) {
            return AdmissionDecision.reject(RejectionReason.ARTICLE_COST_LIMIT_EXCEEDED,
                String.format("Article cost %s reached the per-article limit of %s", pipelineTotal, articleLimit),
                spend, budget);
        }
        return AdmissionDecision.allow(false, spend, budget);
    }

    public SpendSummary monthlySpend(String organizationId) {
        Organization org = organizations.get(organizationId);
        YearMonth month = costLedger.currentMonth();
        BigDecimal spend = costLedger.monthlyTotal(organizationId, month);
        return new SpendSummary(organizationId, month, spend, org.getMonthlyBudget(),
            percentage(spend, org.getMonthlyBudget()), org.getAlertThreshold());
    }

    @EventListener
    public void onCostRecorded(CostRecordedEvent event) {
        if (!organizations.exists(event.organizationId())
                || !event.billingMonth().equals(costLedger.currentMonth())) {
            return;
        }
        BigDecimal spend = organizations.mutate(event.organizationId(), org -> {
            org.setCurrentMonthSpend(costLedger.monthlyTotal(event.organizationId(), event.billingMonth()));
            return org.getCurrentMonthSpend();
        });
        log.debug("Refreshed cached spend for organization {}: {}", event.organizationId(), spend);
    }

    static BigDecimal percentage(BigDecimal spend, BigDecimal budget) {
        if (budget == null || budget.signum() == 0) {
            return spend.signum() > 0 ? HUNDRED.setScale(2) : BigDecimal.ZERO.setScale(2);
        }
        return spend.multiply(HUNDRED).divide(budget, 2, RoundingMode.HALF_UP);
    }

    private static Map<String, Object> alertDetails(Organization org, BigDecimal spend, BigDecimal percentage) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("currentSpend", spend);
        details.put("monthlyBudget", org.getMonthlyBudget());
        details.put("percentage", percentage);
        details.put("threshold", org.getAlertThreshold());
        return details;
    }
}
