package com.autonomous.content.service;

import com.autonomous.content.model.AgentKind;
import com.autonomous.content.model.AgentUsage;
import com.autonomous.content.model.CostEntry;
import com.autonomous.content.model.ServiceCostSummary;
import com.autonomous.content.storage.JsonLinesLog;
import com.autonomous.content.storage.JsonMappers;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Service
public class CostLedgerService {

    private static final Logger log = LoggerFactory.getLogger(CostLedgerService.class);

    public static final int AMOUNT_SCALE = 4;
    private static final BigDecimal PER_MILLION = BigDecimal.valueOf(1_000_000);

    // USD per million input / output tokens
    private static final Map<String, BigDecimal[]> MODEL_PRICING = new LinkedHashMap<>();

    static {
        MODEL_PRICING.put("haiku", new BigDecimal[]{new BigDecimal("0.25"), new BigDecimal("1.25")});
        MODEL_PRICING.put("sonnet", new BigDecimal[]{new BigDecimal("3.00"), new BigDecimal("15.00")});
        MODEL_PRICING.put("opus", new BigDecimal[]{new BigDecimal("15.00"), new BigDecimal("75.00")});
        MODEL_PRICING.put("gpt-4", new BigDecimal[]{new BigDecimal("10.00"), new BigDecimal("30.00")});
    }

    @Value("${pipeline.data.path:data}")
    private String dataPath;

    private final Clock clock;
    private final ApplicationEventPublisher eventPublisher;
    private final Map<String, List<CostEntry>> entriesByOrganization = new ConcurrentHashMap<>();
    private JsonLinesLog<CostEntry> costsFile = JsonLinesLog.inMemory(CostEntry.class);

    public CostLedgerService(Clock clock, ApplicationEventPublisher eventPublisher) {
        this.clock = clock;
        this.eventPublisher = eventPublisher;
    }

    public void setDataPath(String path) {
        this.dataPath = path;
    }

    @PostConstruct
    public void init() {
        if (dataPath == null || dataPath.isBlank()) {
            return;
        }
        costsFile = new JsonLinesLog<>(Paths.get(dataPath, "costs.jsonl"), CostEntry.class, JsonMappers.json());
        try {
            List<CostEntry> loaded = costsFile.readAll();
            loaded.forEach(entry -> entries(entry.getOrganizationId()).add(entry));
            log.info("Loaded {} cost entries from {}", loaded.size(), dataPath);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load cost ledger from " + dataPath, e);
        }
    }

    public BigDecimal calculateCost(String model, long inputTokens, long outputTokens) {
        BigDecimal[] pricing = pricingFor(model);
        BigDecimal inputCost = pricing[0].multiply(BigDecimal.valueOf(inputTokens));
        BigDecimal outputCost = pricing[1].multiply(BigDecimal.valueOf(outputTokens));
        return inputCost.add(outputCost).divide(PER_MILLION, AMOUNT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Appends one billing record. The entry's id, timestamp and billing month are assigned here.
     */
    public CostEntry record(CostEntry entry) {
        if (entry.getOrganizationId() == null) {
            throw new IllegalArgumentException("Cost entry requires an organization");
        }
        if (entry.getAmount() == null || entry.getAmount().signum() < 0) {
            throw new IllegalArgumentException("Cost amount must be >= 0, got " + entry.getAmount());
        }
        entry.setId(UUID.randomUUID().toString());
        entry.setTimestamp(clock.instant());
        entry.setBillingMonth(YearMonth.from(entry.getTimestamp().atZone(ZoneOffset.UTC)));
        entry.setAmount(entry.getAmount().setScale(AMOUNT_SCALE, RoundingMode.HALF_UP));

        synchronized (this) {
            entries(entry.getOrganizationId()).add(entry);
            persistEntry(entry);
        }
        log.debug("Recorded cost: org={}, pipeline={}, service={}, amount={}",
            entry.getOrganizationId(), entry.getPipelineId(), entry.getService(), entry.getAmount());

        eventPublisher.publishEvent(new CostRecordedEvent(
            entry.getOrganizationId(), entry.getPipelineId(), entry.getBillingMonth(), entry.getAmount()));
        return entry;
    }

    public CostEntry recordUsage(String organizationId, String pipelineId, String articleId,
                                 AgentKind agentKind, AgentUsage usage) {
        BigDecimal amount = usage.amount() != null
            ? usage.amount()
            : calculateCost(usage.model(), usage.inputTokens(), usage.outputTokens());
        return record(CostEntry.builder()
            .organizationId(organizationId)
            .pipelineId(pipelineId)
            .articleId(articleId)
            .agentKind(agentKind)
            .service(usage.service())
            .model(usage.model())
            .inputTokens(usage.inputTokens())
            .outputTokens(usage.outputTokens())
            .amount(amount)
            .build());
    }

    public BigDecimal monthlyTotal(String organizationId, YearMonth month) {
        return entries(organizationId, month).stream()
            .map(CostEntry::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add)
            .setScale(AMOUNT_SCALE, RoundingMode.HALF_UP);
    }

    public BigDecimal currentMonthTotal(String organizationId) {
        return monthlyTotal(organizationId, currentMonth());
    }

    public YearMonth currentMonth() {
        return YearMonth.now(clock.withZone(ZoneOffset.UTC));
    }

    public List<CostEntry> entries(String organizationId, YearMonth month) {
        List<CostEntry> all = entries(organizationId);
        synchronized (all) {
            return all.stream().filter(entry -> month.equals(entry.getBillingMonth())).toList();
        }
    }

    public List<CostEntry> entriesForPipeline(String organizationId, String pipelineId) {
        List<CostEntry> all = entries(organizationId);
        synchronized (all) {
            return all.stream().filter(entry -> pipelineId.equals(entry.getPipelineId())).toList();
        }
    }

    public List<ServiceCostSummary> summaryByService(String organizationId, YearMonth month) {
        Map<String, List<CostEntry>> byService = entries(organizationId, month).stream()
            .collect(Collectors.groupingBy(
                entry -> entry.getService() != null ? entry.getService() : "unknown"));

        return byService.entrySet().stream()
            .map(group -> {
                List<CostEntry> serviceEntries = group.getValue();
                return new ServiceCostSummary(
                    group.getKey(),
                    serviceEntries.size(),
                    serviceEntries.stream().map(CostEntry::getAmount).reduce(BigDecimal.ZERO, BigDecimal::add),
                    serviceEntries.stream().map(CostEntry::getAmount).max(Comparator.naturalOrder()).orElse(BigDecimal.ZERO),
                    serviceEntries.stream().map(CostEntry::getAmount).min(Comparator.naturalOrder()).orElse(BigDecimal.ZERO),
                    serviceEntries.stream().mapToLong(e -> e.getInputTokens() + e.getOutputTokens()).sum());
            })
            .sorted(Comparator.comparing(ServiceCostSummary::totalCost).reversed())
            .toList();
    }

    private List<CostEntry> entries(String organizationId) {
        return entriesByOrganization.computeIfAbsent(organizationId,
            k -> Collections.synchronizedList(new ArrayList<>()));
    }

    private BigDecimal[] pricingFor(String model) {
        if (model != null) {
            String normalized = model.toLowerCase();
            for (Map.Entry<String, BigDecimal[]> pricing : MODEL_PRICING.entrySet()) {
                if (normalized.contains(pricing.getKey())) {
                    return pricing.getValue();
                }
            }
        }
        return MODEL_PRICING.get("sonnet");
    }

    private void persistEntry(CostEntry entry) {
        try {
            costsFile.append(entry);
        } catch (IOException e) {
            // The in-memory ledger still holds the entry, so admission keeps counting it.
            log.error("Failed to persist cost entry {} for org {}", entry.getId(), entry.getOrganizationId(), e);
        }
    }
}
